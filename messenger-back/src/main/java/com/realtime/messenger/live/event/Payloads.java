package com.realtime.messenger.live.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.realtime.messenger.common.ErrorKind;
import com.realtime.messenger.presence.model.PresenceStatus;

import java.time.Instant;
import java.util.UUID;

/** live 이벤트 페이로드 모음 (입력은 모르는 필드 무시) */
public final class Payloads {

    private Payloads() {
    }

    /* ===== inbound ===== */

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Join(String userId, String token) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SendMessage(String sender, String receiver, String text, String messageType,
                              String mediaUrl, String replyTo, Boolean oneTimeView) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Typing(String sender, String receiver) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record UserStatus(String userId, String status) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessageRead(String messageId, String readerId) {}

    /* ===== outbound ===== */

    public record Joined(UUID userId, PresenceStatus status) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record MessageError(ErrorKind kind, String message, String event) {}

    public record TypingNotice(UUID sender, UUID receiver) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record UserStatusUpdate(UUID userId, PresenceStatus status, Instant lastSeen) {}

    public record MessageReadUpdate(UUID messageId, Instant readAt, UUID readerId) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record MessageDeleted(UUID messageId, boolean forEveryone, String text) {}

    /** signal 은 해석하지 않고 그대로 전달. from 은 join 된 사용자 */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CallIncoming(JsonNode signal, UUID from, String name, Boolean isVideo) {}

    public record CallEnded(UUID from) {}
}
