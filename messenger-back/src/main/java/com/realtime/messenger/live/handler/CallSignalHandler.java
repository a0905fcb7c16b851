package com.realtime.messenger.live.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.realtime.messenger.common.Ids;
import com.realtime.messenger.common.MessengerException;
import com.realtime.messenger.live.event.InboundEvent;
import com.realtime.messenger.live.event.LiveEvent;
import com.realtime.messenger.live.event.OutboundEvent;
import com.realtime.messenger.live.event.Payloads;
import com.realtime.messenger.live.service.DeliveryRouter;
import com.realtime.messenger.policy.AccessPolicyGuard;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * 통화 시그널링 중계. signal 은 해석하지 않고 대상에게 그대로 넘긴다.
 * 대상: data.userToCall → data.to → data.target 순.
 * callUser → callIncoming{signal, from, name, isVideo}, answerCall → callAccepted(signal), endCall → callEnded{from}
 */
@Component
@RequiredArgsConstructor
public class CallSignalHandler implements LiveCommandHandler {

    private static final List<String> TARGET_FIELDS = List.of("userToCall", "to", "target");

    private final AccessPolicyGuard accessPolicyGuard;
    private final DeliveryRouter router;

    @Override
    public Set<InboundEvent> events() {
        return Set.of(InboundEvent.CALL_USER, InboundEvent.ANSWER_CALL, InboundEvent.END_CALL);
    }

    @Override
    public void handle(InboundEvent event, LiveContext ctx, JsonNode data) {
        if (data == null || !data.isObject()) {
            throw MessengerException.badRequest("data is required");
        }
        UUID me = ctx.requireUser();
        UUID target = Ids.parse(targetOf(data), "target");
        accessPolicyGuard.requireCanSend(me, target);

        LiveEvent out = switch (event) {
            case CALL_USER -> LiveEvent.of(OutboundEvent.CALL_INCOMING, new Payloads.CallIncoming(
                    signalOf(data, "signalData"), me, textOrNull(data, "name"),
                    data.hasNonNull("isVideo") ? data.get("isVideo").asBoolean() : null));
            case ANSWER_CALL -> LiveEvent.of(OutboundEvent.CALL_ACCEPTED, signalOf(data, "signal"));
            case END_CALL -> LiveEvent.of(OutboundEvent.CALL_ENDED, new Payloads.CallEnded(me));
            default -> throw new IllegalArgumentException("unsupported event " + event);
        };
        router.route(target, out);
    }

    private static String targetOf(JsonNode data) {
        for (String field : TARGET_FIELDS) {
            if (data.hasNonNull(field)) return data.get(field).asText();
        }
        return null;
    }

    private static JsonNode signalOf(JsonNode data, String preferred) {
        if (data.has(preferred)) return data.get(preferred);
        return data.has("signal") ? data.get("signal") : NullNode.getInstance();
    }

    private static String textOrNull(JsonNode data, String field) {
        return data.hasNonNull(field) ? data.get(field).asText() : null;
    }
}
