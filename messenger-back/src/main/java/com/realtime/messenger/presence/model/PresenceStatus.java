package com.realtime.messenger.presence.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.realtime.messenger.common.MessengerException;

import java.util.Locale;

public enum PresenceStatus {
    ONLINE, OFFLINE, AWAY, BUSY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PresenceStatus from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw MessengerException.badRequest("status is required");
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw MessengerException.badRequest("Unknown status: " + raw);
        }
    }
}
