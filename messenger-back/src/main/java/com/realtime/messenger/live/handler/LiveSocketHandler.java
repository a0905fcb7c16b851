package com.realtime.messenger.live.handler;

import com.realtime.messenger.config.LiveProps;
import com.realtime.messenger.live.connection.LiveConnection;
import com.realtime.messenger.live.connection.WebSocketLiveConnection;
import com.realtime.messenger.presence.service.PresenceTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * live 소켓 엔드포인트. 연결 수립 시에는 아무 사용자에게도 묶지 않고,
 * join 이벤트가 들어와야 트래커에 등록된다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LiveSocketHandler extends TextWebSocketHandler {

    private final LiveEventDispatcher dispatcher;
    private final PresenceTracker presenceTracker;
    private final LiveProps liveProps;

    // sessionId -> 연결 (join 전 포함)
    private final Map<String, LiveConnection> connections = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        connections.put(session.getId(), new WebSocketLiveConnection(
                session, liveProps.getSendTimeLimitMs(), liveProps.getBufferSizeLimit()));
        log.info("live session {} opened from {}", session.getId(), session.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        LiveConnection connection = connections.get(session.getId());
        if (connection == null) {
            log.warn("frame on unknown session {}", session.getId());
            return;
        }
        dispatcher.dispatch(connection, message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("live session {} transport error: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        connections.remove(session.getId());
        presenceTracker.disconnect(session.getId());
        log.info("live session {} closed (code: {}, reason: {})",
                session.getId(), status.getCode(), status.getReason());
    }
}
