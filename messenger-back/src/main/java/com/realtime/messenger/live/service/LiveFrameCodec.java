package com.realtime.messenger.live.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.realtime.messenger.common.MessengerException;
import com.realtime.messenger.live.event.InboundFrame;
import com.realtime.messenger.live.event.LiveEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/** live 프레임 JSON 인코딩/디코딩 */
@Component
@RequiredArgsConstructor
public class LiveFrameCodec {

    private final ObjectMapper objectMapper;

    public String encode(LiveEvent event) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("event", event.type().wireName());
        frame.put("data", event.data());
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot encode live event " + event.type(), e);
        }
    }

    public InboundFrame decode(String raw) {
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw MessengerException.badRequest("Malformed frame");
        }
        if (root == null || !root.isObject() || !root.path("event").isTextual()) {
            throw MessengerException.badRequest("Frame must be {\"event\": ..., \"data\": ...}");
        }
        JsonNode data = root.has("data") ? root.get("data") : NullNode.getInstance();
        return new InboundFrame(root.get("event").asText(), data);
    }

    public <T> T read(JsonNode data, Class<T> type) {
        if (data == null || data.isNull() || data.isMissingNode()) {
            throw MessengerException.badRequest("data is required");
        }
        try {
            return objectMapper.treeToValue(data, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw MessengerException.badRequest("Malformed " + type.getSimpleName() + " payload");
        }
    }
}
