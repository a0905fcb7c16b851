package com.realtime.messenger.live.handler;

import com.realtime.messenger.common.ErrorKind;
import com.realtime.messenger.common.MessengerException;
import com.realtime.messenger.live.connection.LiveConnection;
import com.realtime.messenger.live.event.InboundEvent;
import com.realtime.messenger.live.event.InboundFrame;
import com.realtime.messenger.live.event.LiveEvent;
import com.realtime.messenger.live.event.OutboundEvent;
import com.realtime.messenger.live.event.Payloads;
import com.realtime.messenger.live.service.DeliveryRouter;
import com.realtime.messenger.live.service.LiveFrameCodec;
import com.realtime.messenger.presence.service.PresenceTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * inbound 프레임 → 핸들러 디스패치 (InboundEvent 기준 EnumMap).
 * 처리 실패는 보낸 연결에만 messageError 로 돌려주고 연결은 유지한다.
 */
@Component
@Slf4j
public class LiveEventDispatcher {

    private final Map<InboundEvent, LiveCommandHandler> handlers = new EnumMap<>(InboundEvent.class);
    private final LiveFrameCodec codec;
    private final DeliveryRouter router;
    private final PresenceTracker presenceTracker;

    public LiveEventDispatcher(List<LiveCommandHandler> all, LiveFrameCodec codec,
                               DeliveryRouter router, PresenceTracker presenceTracker) {
        this.codec = codec;
        this.router = router;
        this.presenceTracker = presenceTracker;
        for (LiveCommandHandler h : all) {
            for (InboundEvent e : h.events()) {
                LiveCommandHandler prev = handlers.putIfAbsent(e, h);
                if (prev != null) {
                    throw new IllegalStateException("duplicate handler for " + e + ": "
                            + prev.getClass().getSimpleName() + ", " + h.getClass().getSimpleName());
                }
            }
        }
        for (InboundEvent e : InboundEvent.values()) {
            if (!handlers.containsKey(e)) throw new IllegalStateException("no handler for " + e);
        }
    }

    public void dispatch(LiveConnection origin, String raw) {
        String eventName = null;
        try {
            InboundFrame frame = codec.decode(raw);
            eventName = frame.event();
            InboundEvent event = InboundEvent.fromWire(eventName)
                    .orElseThrow(() -> MessengerException.badRequest("Unknown event"));

            LiveContext ctx = new LiveContext(origin, presenceTracker.userOf(origin.id()).orElse(null));
            if (event.requiresJoin()) ctx.requireUser();

            handlers.get(event).handle(event, ctx, frame.data());
        } catch (MessengerException e) {
            log.debug("live {} from {} rejected: {} {}", eventName, origin.id(), e.getKind(), e.getMessage());
            replyError(origin, e.getKind(), e.getMessage(), eventName);
        } catch (DataAccessException e) {
            log.warn("live {} from {} failed on storage: {}", eventName, origin.id(), e.getMessage());
            replyError(origin, ErrorKind.TRANSIENT, "Storage temporarily unavailable", eventName);
        } catch (RuntimeException e) {
            log.error("live {} from {} failed", eventName, origin.id(), e);
            replyError(origin, ErrorKind.TRANSIENT, "Server error", eventName);
        }
    }

    private void replyError(LiveConnection origin, ErrorKind kind, String message, String eventName) {
        router.deliver(origin, LiveEvent.of(OutboundEvent.MESSAGE_ERROR,
                new Payloads.MessageError(kind, message, eventName)));
    }
}
