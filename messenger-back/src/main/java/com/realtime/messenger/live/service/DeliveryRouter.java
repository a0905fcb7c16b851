package com.realtime.messenger.live.service;

import com.realtime.messenger.live.connection.LiveConnection;
import com.realtime.messenger.live.connection.LiveDeliveryException;
import com.realtime.messenger.live.event.LiveEvent;
import com.realtime.messenger.presence.service.PresenceTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * 사용자 → live 연결 라우팅.
 * 대상에 연결이 없으면 이벤트는 버린다 (저장소가 기준이며 클라이언트는 재조회로 맞춘다).
 * 제한 안에 받지 못한 연결은 죽은 것으로 보고 닫은 뒤 트래커에서 제거한다.
 * 스토리지 I/O 는 하지 않는다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeliveryRouter {

    private final PresenceTracker presenceTracker;
    private final LiveFrameCodec codec;

    /** @return 전달에 성공한 연결 수 */
    public int route(UUID targetUserId, LiveEvent event) {
        List<LiveConnection> connections = presenceTracker.connectionsOf(targetUserId);
        if (connections.isEmpty()) {
            log.debug("{} for {} dropped: no live connection", event.type().wireName(), targetUserId);
            return 0;
        }
        String frame = codec.encode(event);
        int delivered = 0;
        for (LiveConnection c : connections) {
            if (send(c, frame, event)) delivered++;
        }
        return delivered;
    }

    /** 특정 연결 하나로만 (join 응답, 오류 응답) */
    public boolean deliver(LiveConnection connection, LiveEvent event) {
        return send(connection, codec.encode(event), event);
    }

    /** excluded 를 제외한 모든 접속 사용자에게 */
    public int broadcastExcept(UUID excluded, LiveEvent event) {
        int delivered = 0;
        for (UUID userId : presenceTracker.connectedUserIds()) {
            if (userId.equals(excluded)) continue;
            delivered += route(userId, event);
        }
        return delivered;
    }

    private boolean send(LiveConnection c, String frame, LiveEvent event) {
        try {
            c.send(frame);
            return true;
        } catch (LiveDeliveryException e) {
            log.warn("{} to {} failed, dropping connection: {}", event.type().wireName(), c.id(), e.getMessage());
            c.close();
            presenceTracker.disconnect(c.id());
            return false;
        }
    }
}
