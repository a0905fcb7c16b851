package com.realtime.messenger.live.event;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/** 클라이언트 → 서버 live 이벤트 (닫힌 목록) */
public enum InboundEvent {
    JOIN("join"),
    SEND_MESSAGE("sendMessage"),
    TYPING("typing"),
    STOP_TYPING("stopTyping"),
    USER_ONLINE("userOnline"),
    USER_OFFLINE("userOffline"),
    SET_STATUS("setStatus"),
    MESSAGE_READ("messageRead"),
    CALL_USER("callUser"),
    ANSWER_CALL("answerCall"),
    END_CALL("endCall");

    private static final Map<String, InboundEvent> BY_WIRE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(InboundEvent::wireName, Function.identity()));

    private final String wireName;

    InboundEvent(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** join 이전에 허용되는 이벤트는 join 뿐 */
    public boolean requiresJoin() {
        return this != JOIN;
    }

    public static Optional<InboundEvent> fromWire(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(BY_WIRE.get(name));
    }
}
