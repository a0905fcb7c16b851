package com.realtime.messenger.user.entity;

import com.realtime.messenger.presence.model.PresenceStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * 사용자 레코드. 가입/인증/친구 관리는 외부 모듈 소관이고
 * 메시징 코어는 존재 여부, 최소 프로필, 차단 목록, 마지막 접속 정보만 사용한다.
 */
@Entity
@Table(name = "users")
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class User {

    @Id
    private UUID id;

    /** 표시용 이름 */
    @Column(name = "name", length = 100, nullable = false)
    private String name;

    @Column(name = "phone", length = 32, unique = true)
    private String phone;

    @Column(name = "avatar_url", length = 512)
    private String avatarUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 16, nullable = false)
    @Builder.Default
    private PresenceStatus status = PresenceStatus.OFFLINE;

    @Column(name = "last_seen")
    private Instant lastSeen;

    // 프레즌스 영속화 순서 보장용 (늦게 도착한 이전 이벤트가 덮어쓰지 않도록)
    @Column(name = "status_changed_at")
    private Instant statusChangedAt;

    /** 이 사용자가 차단한 사용자 id 목록 */
    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "user_blocks", joinColumns = @JoinColumn(name = "owner_id"),
            uniqueConstraints = @UniqueConstraint(name = "uk_user_block", columnNames = {"owner_id", "blocked_id"}))
    @Column(name = "blocked_id", nullable = false)
    @Builder.Default
    private Set<UUID> blockedUsers = new HashSet<>();

    @CreationTimestamp
    @Column(updatable = false)
    private Instant createdAt;
}
