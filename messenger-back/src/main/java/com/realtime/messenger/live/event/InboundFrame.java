package com.realtime.messenger.live.event;

import com.fasterxml.jackson.databind.JsonNode;

/** {"event": "...", "data": {...}} */
public record InboundFrame(String event, JsonNode data) {}
