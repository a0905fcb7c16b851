package com.realtime.messenger.presence.dto;

import com.realtime.messenger.presence.model.PresenceStatus;

import java.time.Instant;
import java.util.UUID;

/** online 은 live 연결이 하나 이상 있는지 (status 와 별개) */
public record PresenceDto(UUID userId, PresenceStatus status, Instant lastSeen, boolean online) {}
