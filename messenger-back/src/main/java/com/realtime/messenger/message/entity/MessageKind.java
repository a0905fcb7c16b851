package com.realtime.messenger.message.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.realtime.messenger.common.MessengerException;

import java.util.Locale;

public enum MessageKind {
    TEXT, IMAGE, VIDEO, AUDIO, DOCUMENT, LOCATION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** 비어 있으면 text */
    @JsonCreator
    public static MessageKind from(String raw) {
        if (raw == null || raw.isBlank()) return TEXT;
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw MessengerException.badRequest("Unknown messageType: " + raw);
        }
    }
}
