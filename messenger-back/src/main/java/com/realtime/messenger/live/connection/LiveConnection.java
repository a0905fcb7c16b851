package com.realtime.messenger.live.connection;

/**
 * 인증된 사용자에게 묶일 수 있는 live 연결 핸들.
 * 구현체는 연결 단위로 단일 writer(FIFO)를 보장하고, 쓰기는 제한 시간/버퍼 안에서만 시도한다.
 */
public interface LiveConnection {

    String id();

    boolean isOpen();

    /**
     * 직렬화된 프레임 전송.
     * @throws LiveDeliveryException 제한 시간/버퍼 초과 또는 I/O 실패 (연결이 죽은 것으로 간주)
     */
    void send(String frame);

    void close();
}
