package com.realtime.messenger.presence.model;

import com.realtime.messenger.live.connection.LiveConnection;

import java.time.Instant;
import java.util.Map;

/**
 * 사용자 한 명의 프레즌스 스냅샷. 불변이며 트래커는 갱신 시 통째로 교체한다.
 * connections: connectionId -> 연결 (등록 순서 유지)
 */
public record PresenceEntry(Map<String, LiveConnection> connections, PresenceStatus status, Instant lastSeen) {

    public static PresenceEntry initial() {
        return new PresenceEntry(Map.of(), PresenceStatus.OFFLINE, null);
    }

    public boolean hasConnections() {
        return !connections.isEmpty();
    }
}
