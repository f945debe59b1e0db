package com.example.widgetstate.shared.store.redis;

import com.example.widgetstate.shared.model.EventMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JSON wire format of event messages on Redis pub/sub channels. Keys are snake_case and the
 * timestamp is epoch millis.
 */
@Slf4j
@RequiredArgsConstructor
public class EventMessageCodec {

    private static final TypeReference<Map<String, Object>> DATA_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public String encode(EventMessage message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event_type", message.getEventType());
        payload.put("widget_id", message.getWidgetId());
        payload.put("data", message.getData());
        payload.put("source_worker_id", message.getSourceWorkerId());
        payload.put("target_worker_id", message.getTargetWorkerId().orElse(null));
        Instant timestamp = message.getTimestamp() != null ? message.getTimestamp() : Instant.now();
        payload.put("timestamp", timestamp.toEpochMilli());
        payload.put("message_id", message.getMessageId() != null ? message.getMessageId() : UUID.randomUUID().toString());
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event data for widget " + message.getWidgetId()
                    + " is not JSON serializable: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @return empty when the payload is not a JSON object
     */
    public Optional<EventMessage> decode(byte[] body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.isObject()) {
                log.warn("Skipping event payload that is not a JSON object: {}", new String(body, StandardCharsets.UTF_8));
                return Optional.empty();
            }
            JsonNode data = root.path("data");
            Map<String, Object> dataMap = data.isObject() ? objectMapper.convertValue(data, DATA_TYPE) : Map.of();
            JsonNode target = root.path("target_worker_id");
            long millis = root.path("timestamp").asLong(0);
            return Optional.of(EventMessage.builder()
                    .eventType(root.path("event_type").asText(""))
                    .widgetId(root.path("widget_id").asText(""))
                    .data(dataMap)
                    .sourceWorkerId(root.path("source_worker_id").asText(""))
                    .targetWorkerId(target.isTextual() ? target.asText() : null)
                    .timestamp(Instant.ofEpochMilli(millis))
                    .messageId(root.path("message_id").asText(""))
                    .build());
        } catch (IOException e) {
            log.warn("Skipping malformed event payload: {}", new String(body, StandardCharsets.UTF_8), e);
            return Optional.empty();
        }
    }
}
