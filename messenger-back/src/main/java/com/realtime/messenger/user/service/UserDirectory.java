package com.realtime.messenger.user.service;

import com.realtime.messenger.presence.model.PresenceStatus;
import com.realtime.messenger.user.dto.UserBriefDto;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 사용자/차단 정보 조회 창구 (읽기 전용).
 * 가입·인증·친구 그래프는 외부 모듈이 소유하며, 메시징 코어는 이 인터페이스로만 접근한다.
 */
public interface UserDirectory {

    boolean exists(UUID userId);

    Map<UUID, UserBriefDto> findBriefs(Collection<UUID> userIds);

    /** owner 의 차단 목록에 target 이 있는지 */
    boolean hasBlocked(UUID ownerId, UUID targetId);

    /** 프로세스 재시작 이전에 기록된 상태 (트래커에 기록이 없을 때 폴백) */
    Optional<StoredPresence> storedPresence(UUID userId);

    record StoredPresence(PresenceStatus status, Instant lastSeen) {}
}
