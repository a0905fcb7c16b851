package com.realtime.messenger.common;

import java.util.UUID;

/** 경로/페이로드로 들어온 문자열 식별자 파싱 */
public final class Ids {

    private Ids() {
    }

    public static UUID parse(String raw, String field) {
        if (raw == null || raw.isBlank()) {
            throw MessengerException.badRequest(field + " is required");
        }
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException e) {
            throw MessengerException.badRequest("Invalid " + field);
        }
    }
}
