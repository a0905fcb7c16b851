package com.realtime.messenger.live.service;

import com.realtime.messenger.live.event.LiveEvent;
import com.realtime.messenger.live.event.OutboundEvent;
import com.realtime.messenger.live.event.Payloads;
import com.realtime.messenger.presence.event.PresenceChangedEvent;
import com.realtime.messenger.presence.service.PresenceTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 프레즌스 전이를 다른 접속 사용자들에게 알림.
 * 이벤트 값이 아니라 전송 시점의 트래커 상태를 보낸다 (동시 전이 시 마지막 상태가 이기도록).
 */
@Component
@RequiredArgsConstructor
public class PresenceBroadcaster {

    private final PresenceTracker presenceTracker;
    private final DeliveryRouter router;

    @EventListener
    public void onPresenceChanged(PresenceChangedEvent e) {
        Payloads.UserStatusUpdate update = presenceTracker.view(e.userId())
                .map(v -> new Payloads.UserStatusUpdate(v.userId(), v.status(), v.lastSeen()))
                .orElseGet(() -> new Payloads.UserStatusUpdate(e.userId(), e.status(), e.lastSeen()));
        router.broadcastExcept(e.userId(), LiveEvent.of(OutboundEvent.USER_STATUS_UPDATE, update));
    }
}
