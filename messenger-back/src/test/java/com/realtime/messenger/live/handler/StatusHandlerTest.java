package com.realtime.messenger.live.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.realtime.messenger.common.ErrorKind;
import com.realtime.messenger.common.MessengerException;
import com.realtime.messenger.live.event.InboundEvent;
import com.realtime.messenger.live.service.LiveFrameCodec;
import com.realtime.messenger.presence.event.PresenceChangedEvent;
import com.realtime.messenger.presence.model.PresenceStatus;
import com.realtime.messenger.presence.model.PresenceView;
import com.realtime.messenger.presence.service.PresenceTracker;
import com.realtime.messenger.support.RecordingConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class StatusHandlerTest {

    private final ObjectMapper mapper = Jackson2ObjectMapperBuilder.json().build();
    private final List<Object> published = new ArrayList<>();
    private PresenceTracker tracker;
    private StatusHandler handler;

    private final UUID alice = UUID.randomUUID();
    private final RecordingConnection conn = new RecordingConnection("a1");
    private LiveContext ctx;

    @BeforeEach
    void setUp() {
        tracker = new PresenceTracker(published::add);
        tracker.connect(alice, conn);
        handler = new StatusHandler(new LiveFrameCodec(mapper), tracker);
        ctx = new LiveContext(conn, alice);
    }

    private PresenceView view() {
        return tracker.view(alice).orElseThrow();
    }

    private ErrorKind kindOf(InboundEvent event, Object data) {
        MessengerException e = catchThrowableOfType(
                () -> handler.handle(event, ctx, mapper.valueToTree(data)), MessengerException.class);
        assertThat(e).isNotNull();
        return e.getKind();
    }

    @Test
    void setStatus_로_away_와_busy_에_도달한다() {
        handler.handle(InboundEvent.SET_STATUS, ctx, mapper.createObjectNode().put("status", "away"));
        assertThat(view().status()).isEqualTo(PresenceStatus.AWAY);

        handler.handle(InboundEvent.SET_STATUS, ctx, mapper.getNodeFactory().textNode("busy"));
        assertThat(view().status()).isEqualTo(PresenceStatus.BUSY);
        assertThat(view().connections()).isEqualTo(1);
    }

    @Test
    void userOffline_은_연결이_남아_있어도_오프라인() {
        handler.handle(InboundEvent.USER_OFFLINE, ctx, mapper.getNodeFactory().textNode(alice.toString()));

        assertThat(view().status()).isEqualTo(PresenceStatus.OFFLINE);
        assertThat(view().lastSeen()).isNotNull();
        assertThat(view().connections()).isEqualTo(1);
        assertThat(conn.isOpen()).isTrue();

        PresenceChangedEvent last = (PresenceChangedEvent) published.get(published.size() - 1);
        assertThat(last.status()).isEqualTo(PresenceStatus.OFFLINE);
    }

    @Test
    void userOnline_은_data_없이도_된다() {
        handler.handle(InboundEvent.USER_OFFLINE, ctx, NullNode.getInstance());
        handler.handle(InboundEvent.USER_ONLINE, ctx, NullNode.getInstance());

        assertThat(view().status()).isEqualTo(PresenceStatus.ONLINE);
    }

    @Test
    void 모르는_상태_문자열은_BAD_REQUEST() {
        assertThat(kindOf(InboundEvent.SET_STATUS, Map.of("status", "sleeping")))
                .isEqualTo(ErrorKind.BAD_REQUEST);
        assertThat(kindOf(InboundEvent.SET_STATUS, Map.of())).isEqualTo(ErrorKind.BAD_REQUEST);
        assertThat(view().status()).isEqualTo(PresenceStatus.ONLINE);
    }

    @Test
    void 다른_사용자의_상태는_바꿀_수_없다() {
        assertThat(kindOf(InboundEvent.USER_OFFLINE, Map.of("userId", UUID.randomUUID().toString())))
                .isEqualTo(ErrorKind.FORBIDDEN);
        assertThat(view().status()).isEqualTo(PresenceStatus.ONLINE);
    }
}
