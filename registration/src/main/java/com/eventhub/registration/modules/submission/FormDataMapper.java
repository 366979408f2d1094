package com.eventhub.registration.modules.submission;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts the JSONB {@code form_data} column to and from a map of custom
 * field values.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FormDataMapper {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public Map<String, Object> read(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.error("Unreadable form data, treating as empty: {}", e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    public String write(Map<String, Object> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize form data", e);
        }
    }

    /**
     * Stored values overlaid with the submitted ones; a submitted key always
     * wins.
     */
    public String merge(String storedJson, Map<String, Object> submitted) {
        Map<String, Object> merged = read(storedJson);
        if (submitted != null) {
            merged.putAll(submitted);
        }
        return write(merged);
    }
}
