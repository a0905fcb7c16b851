package com.realtime.messenger.live.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.realtime.messenger.common.Ids;
import com.realtime.messenger.live.event.InboundEvent;
import com.realtime.messenger.live.event.Payloads;
import com.realtime.messenger.live.service.LiveFrameCodec;
import com.realtime.messenger.presence.model.PresenceStatus;
import com.realtime.messenger.presence.service.PresenceTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.UUID;

/**
 * 클라이언트의 명시적 상태 신호. 연결 수와 무관하게 상태만 바꾼다.
 * away/busy 는 setStatus 로만 도달한다.
 */
@Component
@RequiredArgsConstructor
public class StatusHandler implements LiveCommandHandler {

    private final LiveFrameCodec codec;
    private final PresenceTracker presenceTracker;

    @Override
    public Set<InboundEvent> events() {
        return Set.of(InboundEvent.USER_ONLINE, InboundEvent.USER_OFFLINE, InboundEvent.SET_STATUS);
    }

    @Override
    public void handle(InboundEvent event, LiveContext ctx, JsonNode data) {
        Payloads.UserStatus p = readStatus(event, data);
        UUID me = ctx.requireActor(p.userId() == null ? null : Ids.parse(p.userId(), "userId"));

        PresenceStatus status = switch (event) {
            case USER_ONLINE -> PresenceStatus.ONLINE;
            case USER_OFFLINE -> PresenceStatus.OFFLINE;
            case SET_STATUS -> PresenceStatus.from(p.status());
            default -> throw new IllegalArgumentException("unsupported event " + event);
        };
        presenceTracker.setExplicit(me, status);
    }

    /**
     * userOnline/userOffline: data 없음, userId 값만, 또는 {userId}.
     * setStatus: status 값만, 또는 {userId, status}.
     */
    private Payloads.UserStatus readStatus(InboundEvent event, JsonNode data) {
        if (data == null || data.isNull() || data.isMissingNode()) {
            return new Payloads.UserStatus(null, null);
        }
        if (data.isTextual()) {
            return event == InboundEvent.SET_STATUS
                    ? new Payloads.UserStatus(null, data.asText())
                    : new Payloads.UserStatus(data.asText(), null);
        }
        return codec.read(data, Payloads.UserStatus.class);
    }
}
