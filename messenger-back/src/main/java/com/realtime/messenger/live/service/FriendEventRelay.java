package com.realtime.messenger.live.service;

import com.realtime.messenger.live.event.LiveEvent;
import com.realtime.messenger.live.event.OutboundEvent;
import com.realtime.messenger.notify.NotifyEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * 친구 그래프 모듈이 호출하는 live 통지 창구.
 * 양쪽 목록 새로고침 신호로 요청자/수신자 모두에게 보낸다.
 */
@Service
@RequiredArgsConstructor
public class FriendEventRelay {

    private final DeliveryRouter router;

    public void requestSent(UUID requesterId, UUID receiverId, Map<String, Object> payload) {
        relay(OutboundEvent.FRIEND_REQUEST_SENT, "FRIEND_REQUEST_SENT", requesterId, receiverId, payload);
    }

    /** status: ACCEPTED / DECLINED 등 (해석하지 않음) */
    public void requestResponded(UUID requesterId, UUID receiverId, String status, Map<String, Object> payload) {
        relay(OutboundEvent.FRIEND_REQUEST_RESPONDED, "FRIEND_REQUEST_" + status, receiverId, requesterId, payload);
    }

    private void relay(OutboundEvent kind, String type, UUID from, UUID to, Map<String, Object> payload) {
        NotifyEvent notice = NotifyEvent.builder()
                .type(type)
                .from(from)
                .to(to)
                .at(Instant.now())
                .payload(payload == null ? Map.of() : payload)
                .build();
        LiveEvent event = LiveEvent.of(kind, notice);
        router.route(to, event);
        router.route(from, event);
    }
}
