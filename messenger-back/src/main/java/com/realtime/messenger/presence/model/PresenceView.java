package com.realtime.messenger.presence.model;

import java.time.Instant;
import java.util.UUID;

public record PresenceView(UUID userId, PresenceStatus status, Instant lastSeen, int connections) {}
