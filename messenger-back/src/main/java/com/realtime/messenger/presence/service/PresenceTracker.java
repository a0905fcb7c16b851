package com.realtime.messenger.presence.service;

import com.realtime.messenger.live.connection.LiveConnection;
import com.realtime.messenger.presence.event.PresenceChangedEvent;
import com.realtime.messenger.presence.model.PresenceEntry;
import com.realtime.messenger.presence.model.PresenceStatus;
import com.realtime.messenger.presence.model.PresenceView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 프로세스 전역 프레즌스/연결 레지스트리.
 * 사용자별 엔트리는 ConcurrentHashMap.compute 로 키 단위 원자 교체 (전역 락 없음).
 * 이벤트는 compute 밖에서, 상태가 바뀐 뒤에만 발행한다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PresenceTracker {

    private final ApplicationEventPublisher events;

    private final ConcurrentHashMap<UUID, PresenceEntry> entries = new ConcurrentHashMap<>();
    // connectionId -> userId (join 으로 묶인 연결만)
    private final ConcurrentHashMap<String, UUID> owners = new ConcurrentHashMap<>();

    /**
     * 연결을 사용자에 등록. 첫 연결이면 online 으로 전이.
     * owners 바인딩은 엔트리 compute 안에서 같이 한다 (같은 키의 disconnect 와 직렬화).
     */
    public void connect(UUID userId, LiveConnection connection) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(connection, "connection");
        String connectionId = connection.id();

        AtomicReference<PresenceChangedEvent> change = new AtomicReference<>();
        entries.compute(userId, (id, cur) -> {
            UUID previous = owners.putIfAbsent(connectionId, id);
            if (previous != null && !previous.equals(id)) {
                throw new IllegalStateException("connection " + connectionId + " is bound to another user");
            }
            PresenceEntry base = (cur == null) ? PresenceEntry.initial() : cur;
            if (base.connections().containsKey(connectionId)) return base;

            Map<String, LiveConnection> next = new LinkedHashMap<>(base.connections());
            next.put(connectionId, connection);
            if (!base.hasConnections()) {
                change.set(new PresenceChangedEvent(id, PresenceStatus.ONLINE, base.lastSeen(), false, now()));
                return new PresenceEntry(Collections.unmodifiableMap(next), PresenceStatus.ONLINE, base.lastSeen());
            }
            return new PresenceEntry(Collections.unmodifiableMap(next), base.status(), base.lastSeen());
        });
        log.info("presence: {} connected via {}", userId, connectionId);
        publish(change.get());

        // 등록 전후로 닫힌 연결은 바로 정리 (close 콜백이 바인딩보다 먼저 돌았을 수 있다)
        if (!connection.isOpen()) {
            owners.remove(connectionId, userId);
            detach(userId, connectionId);
        }
    }

    /** 연결 해제. 남은 연결이 없으면 offline + lastSeen. 모르는 연결이면 false */
    public boolean disconnect(String connectionId) {
        if (connectionId == null) return false;
        UUID userId = owners.remove(connectionId);
        if (userId == null) return false;
        detach(userId, connectionId);
        return true;
    }

    private void detach(UUID userId, String connectionId) {
        AtomicReference<PresenceChangedEvent> change = new AtomicReference<>();
        entries.computeIfPresent(userId, (id, cur) -> {
            if (!cur.connections().containsKey(connectionId)) return cur;

            Map<String, LiveConnection> next = new LinkedHashMap<>(cur.connections());
            next.remove(connectionId);
            if (next.isEmpty()) {
                Instant at = now();
                change.set(new PresenceChangedEvent(id, PresenceStatus.OFFLINE, at, true, at));
                return new PresenceEntry(Map.of(), PresenceStatus.OFFLINE, at);
            }
            return new PresenceEntry(Collections.unmodifiableMap(next), cur.status(), cur.lastSeen());
        });
        log.info("presence: {} disconnected {}", userId, connectionId);
        publish(change.get());
    }

    /** 클라이언트가 명시적으로 알린 상태. 연결 수와 무관하다 */
    public PresenceView setExplicit(UUID userId, PresenceStatus status) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(status, "status");

        AtomicReference<PresenceChangedEvent> change = new AtomicReference<>();
        PresenceEntry updated = entries.compute(userId, (id, cur) -> {
            PresenceEntry base = (cur == null) ? PresenceEntry.initial() : cur;
            if (base.status() == status && cur != null) return base;

            Instant at = now();
            boolean offline = status == PresenceStatus.OFFLINE;
            Instant lastSeen = offline ? at : base.lastSeen();
            change.set(new PresenceChangedEvent(id, status, lastSeen, offline, at));
            return new PresenceEntry(base.connections(), status, lastSeen);
        });
        publish(change.get());
        return toView(userId, updated);
    }

    public Optional<PresenceView> view(UUID userId) {
        if (userId == null) return Optional.empty();
        PresenceEntry e = entries.get(userId);
        return e == null ? Optional.empty() : Optional.of(toView(userId, e));
    }

    public List<LiveConnection> connectionsOf(UUID userId) {
        if (userId == null) return List.of();
        PresenceEntry e = entries.get(userId);
        return e == null ? List.of() : List.copyOf(e.connections().values());
    }

    public Optional<UUID> userOf(String connectionId) {
        return connectionId == null ? Optional.empty() : Optional.ofNullable(owners.get(connectionId));
    }

    /** live 연결이 하나 이상 있는 사용자 */
    public Set<UUID> connectedUserIds() {
        Set<UUID> ids = new HashSet<>();
        entries.forEach((id, e) -> {
            if (e.hasConnections()) ids.add(id);
        });
        return ids;
    }

    private void publish(PresenceChangedEvent event) {
        if (event == null) return;
        log.info("presence: {} -> {}", event.userId(), event.status().wireName());
        events.publishEvent(event);
    }

    private static PresenceView toView(UUID userId, PresenceEntry e) {
        return new PresenceView(userId, e.status(), e.lastSeen(), e.connections().size());
    }

    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }
}
