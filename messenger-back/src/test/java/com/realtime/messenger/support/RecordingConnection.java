package com.realtime.messenger.support;

import com.realtime.messenger.live.connection.LiveConnection;
import com.realtime.messenger.live.connection.LiveDeliveryException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** 전송된 프레임을 기록하는 테스트용 연결. failing 이면 send 가 항상 실패 */
public class RecordingConnection implements LiveConnection {

    private final String id;
    private final boolean failing;
    private final List<String> frames = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;

    public RecordingConnection(String id) {
        this(id, false);
    }

    public RecordingConnection(String id, boolean failing) {
        this.id = id;
        this.failing = failing;
    }

    public static RecordingConnection failing(String id) {
        return new RecordingConnection(id, true);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void send(String frame) {
        if (failing || !open) throw new LiveDeliveryException("write timed out");
        frames.add(frame);
    }

    @Override
    public void close() {
        open = false;
    }

    public List<String> frames() {
        return frames;
    }
}
