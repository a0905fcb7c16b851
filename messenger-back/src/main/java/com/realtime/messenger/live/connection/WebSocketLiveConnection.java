package com.realtime.messenger.live.connection;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

/**
 * WebSocketSession 기반 연결.
 * ConcurrentWebSocketSessionDecorator 가 연결별 전송을 직렬화하고,
 * 다른 스레드가 쓰는 중이면 버퍼에 쌓았다가 순서대로 flush 한다.
 * 전송 시간 또는 버퍼 한도를 넘기면 SessionLimitExceededException 이 나고 세션은 닫힌다.
 */
@Slf4j
public class WebSocketLiveConnection implements LiveConnection {

    private final WebSocketSession session;

    public WebSocketLiveConnection(WebSocketSession raw, int sendTimeLimitMs, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(raw, sendTimeLimitMs, bufferSizeLimit);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String frame) {
        if (!session.isOpen()) {
            throw new LiveDeliveryException("session " + session.getId() + " is closed");
        }
        try {
            session.sendMessage(new TextMessage(frame));
        } catch (SessionLimitExceededException e) {
            throw new LiveDeliveryException("session " + session.getId() + " exceeded send limits", e);
        } catch (IOException e) {
            throw new LiveDeliveryException("session " + session.getId() + " write failed", e);
        }
    }

    @Override
    public void close() {
        if (!session.isOpen()) return;
        try {
            session.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException e) {
            log.debug("close failed for session {}: {}", session.getId(), e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "WebSocketLiveConnection[" + session.getId() + "]";
    }
}
