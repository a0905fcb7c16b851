package com.realtime.messenger.message.entity;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.BatchSize;

@Entity
@Table(
        name = "chat_messages",
        indexes = {
                @Index(name = "ix_chat_messages_message_id", columnList = "message_id", unique = true),
                @Index(name = "ix_chat_messages_pair_created", columnList = "sender_id, receiver_id, created_at"),
                @Index(name = "ix_chat_messages_receiver_read", columnList = "receiver_id, is_read")
        }
)
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ChatMessage {

    // 내부 PK (정렬 tie-breaker 겸용)
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** 외부에 노출되는 불투명 식별자 */
    @Column(name = "message_id", nullable = false, unique = true, updatable = false)
    private UUID messageId;

    @Column(name = "sender_id", nullable = false, updatable = false)
    private UUID senderId;

    @Column(name = "receiver_id", nullable = false, updatable = false)
    private UUID receiverId;

    @Column(nullable = false, length = 4000)
    private String text;

    @Enumerated(EnumType.STRING)
    @Column(name = "message_type", nullable = false, length = 16)
    @Builder.Default
    private MessageKind messageType = MessageKind.TEXT;

    @Column(name = "media_url", length = 1024)
    private String mediaUrl;

    @Column(name = "reply_to")
    private UUID replyTo;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "is_read", nullable = false)
    private boolean read;

    @Column(name = "read_at")
    private Instant readAt;

    @ElementCollection
    @CollectionTable(name = "message_reactions",
            joinColumns = @JoinColumn(name = "message_pk"),
            uniqueConstraints = @UniqueConstraint(name = "uk_reaction_once", columnNames = {"message_pk", "user_id", "emoji"}))
    @BatchSize(size = 100)
    @Builder.Default
    private Set<Reaction> reactions = new LinkedHashSet<>();

    /** 모두에게 삭제(tombstone) */
    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;

    /** 나에게서만 삭제한 사용자들. deleted 플래그와는 독립 */
    @ElementCollection
    @CollectionTable(name = "message_deleted_for",
            joinColumns = @JoinColumn(name = "message_pk"),
            uniqueConstraints = @UniqueConstraint(name = "uk_deleted_for", columnNames = {"message_pk", "user_id"}))
    @Column(name = "user_id", nullable = false)
    @BatchSize(size = 100)
    @Builder.Default
    private Set<UUID> deletedFor = new LinkedHashSet<>();

    @Column(name = "one_time_view", nullable = false)
    private boolean oneTimeView;

    @Column(name = "viewed_at")
    private Instant viewedAt;

    public boolean isParticipant(UUID userId) {
        return senderId.equals(userId) || receiverId.equals(userId);
    }

    public UUID counterpartOf(UUID userId) {
        return senderId.equals(userId) ? receiverId : senderId;
    }
}
