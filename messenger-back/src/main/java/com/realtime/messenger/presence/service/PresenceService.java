package com.realtime.messenger.presence.service;

import com.realtime.messenger.common.MessengerException;
import com.realtime.messenger.presence.dto.PresenceDto;
import com.realtime.messenger.presence.model.PresenceStatus;
import com.realtime.messenger.presence.model.PresenceView;
import com.realtime.messenger.user.service.UserDirectory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * durable 경로용 프레즌스 조회/변경.
 * 트래커에 기록이 없으면 (재시작 이후 아직 접속하지 않은 사용자) 저장된 값을 쓴다.
 */
@Service
@RequiredArgsConstructor
public class PresenceService {

    private final PresenceTracker tracker;
    private final UserDirectory userDirectory;

    public PresenceDto get(UUID userId) {
        return find(userId).orElseThrow(() -> MessengerException.notFound("User not found"));
    }

    /** 트래커 → 저장된 값 순. 저장 값의 online 은 재시작 전 기록이므로 offline 으로 본다 */
    public Optional<PresenceDto> find(UUID userId) {
        Optional<PresenceDto> live = tracker.view(userId).map(PresenceService::toDto);
        if (live.isPresent()) return live;
        return userDirectory.storedPresence(userId)
                .map(s -> new PresenceDto(userId, s.status() == PresenceStatus.ONLINE
                        ? PresenceStatus.OFFLINE : s.status(), s.lastSeen(), false));
    }

    public PresenceDto setStatus(UUID userId, PresenceStatus status) {
        return toDto(tracker.setExplicit(userId, status));
    }

    private static PresenceDto toDto(PresenceView v) {
        return new PresenceDto(v.userId(), v.status(), v.lastSeen(), v.connections() > 0);
    }
}
