package com.realtime.messenger.live.event;

import java.util.Objects;

/** 라우팅 단위. data 는 JSON 으로 직렬화 가능한 페이로드 */
public record LiveEvent(OutboundEvent type, Object data) {

    public LiveEvent {
        Objects.requireNonNull(type, "type");
    }

    public static LiveEvent of(OutboundEvent type, Object data) {
        return new LiveEvent(type, data);
    }
}
