package com.example.widgetstate.shared.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON helpers for the values kept inside Redis hash fields (metadata maps, role lists).
 * Reads are lenient: a corrupt field is logged and read back as empty.
 */
@Slf4j
public final class JsonUtils {

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRING_LIST_TYPE = new TypeReference<>() {};

    private JsonUtils() {}

    public static ObjectMapper mapper() {
        return objectMapper;
    }

    public static Map<String, Object> parseMap(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, MAP_TYPE);
            return parsed != null ? parsed : Map.of();
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse JSON object string: {}", json, e);
            return Map.of();
        }
    }

    public static Set<String> parseStringSet(String json) {
        if (json == null || json.isBlank()) {
            return Set.of();
        }
        try {
            List<String> parsed = objectMapper.readValue(json, STRING_LIST_TYPE);
            return parsed != null ? new LinkedHashSet<>(parsed) : Set.of();
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse JSON array string: {}", json, e);
            return Set.of();
        }
    }

    /**
     * @throws IllegalArgumentException if the map holds values Jackson cannot serialize
     */
    public static String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not JSON serializable: " + e.getOriginalMessage(), e);
        }
    }

    public static String toJsonArray(Collection<String> values) {
        return toJson(values == null ? List.of() : List.copyOf(values));
    }

    public static Map<String, Object> copyOf(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
