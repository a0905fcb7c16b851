package com.realtime.messenger.presence.event;

import com.realtime.messenger.presence.model.PresenceStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * 상태 전이 직후 발행. at 은 전이 시각이며 영속화 시 순서 판단에 쓴다.
 * lastSeenChanged 는 이번 전이에서 lastSeen 이 새로 찍혔는지 여부.
 */
public record PresenceChangedEvent(UUID userId, PresenceStatus status, Instant lastSeen,
                                   boolean lastSeenChanged, Instant at) {}
