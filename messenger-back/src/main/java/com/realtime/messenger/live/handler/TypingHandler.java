package com.realtime.messenger.live.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.realtime.messenger.common.Ids;
import com.realtime.messenger.live.event.InboundEvent;
import com.realtime.messenger.live.event.LiveEvent;
import com.realtime.messenger.live.event.OutboundEvent;
import com.realtime.messenger.live.event.Payloads;
import com.realtime.messenger.live.service.DeliveryRouter;
import com.realtime.messenger.live.service.LiveFrameCodec;
import com.realtime.messenger.policy.AccessPolicyGuard;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class TypingHandler implements LiveCommandHandler {

    private final LiveFrameCodec codec;
    private final AccessPolicyGuard accessPolicyGuard;
    private final DeliveryRouter router;

    @Override
    public Set<InboundEvent> events() {
        return Set.of(InboundEvent.TYPING, InboundEvent.STOP_TYPING);
    }

    @Override
    public void handle(InboundEvent event, LiveContext ctx, JsonNode data) {
        Payloads.Typing p = codec.read(data, Payloads.Typing.class);
        UUID sender = ctx.requireActor(p.sender() == null ? null : Ids.parse(p.sender(), "sender"));
        UUID receiver = Ids.parse(p.receiver(), "receiver");
        accessPolicyGuard.requireCanSend(sender, receiver);

        OutboundEvent out = (event == InboundEvent.TYPING) ? OutboundEvent.USER_TYPING : OutboundEvent.USER_STOP_TYPING;
        router.route(receiver, LiveEvent.of(out, new Payloads.TypingNotice(sender, receiver)));
    }
}
