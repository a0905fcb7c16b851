package com.realtime.messenger.notify;

import lombok.*;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** 외부 친구 그래프 모듈에서 넘어온 알림. payload 는 해석하지 않는다 */
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class NotifyEvent {
    // FRIEND_REQUEST_SENT / FRIEND_REQUEST_ACCEPTED / FRIEND_REQUEST_DECLINED ...
    private String type;
    private UUID from;
    private UUID to;
    private Instant at;
    private Map<String, Object> payload;
}
