package com.realtime.messenger.live.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.realtime.messenger.live.event.InboundEvent;

import java.util.Set;

/** 하나 이상의 inbound 이벤트를 처리. 실패는 MessengerException 으로 던진다 */
public interface LiveCommandHandler {

    Set<InboundEvent> events();

    void handle(InboundEvent event, LiveContext ctx, JsonNode data);
}
