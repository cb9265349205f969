package com.example.healthrag;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stores field maps as JSON without encryption. Deployments that encrypt payloads replace this
 * bean with their own {@link RecordCipher}.
 */
@Component
public class PlaintextRecordCipher implements RecordCipher {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public PlaintextRecordCipher(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String encrypt(Map<String, Object> fields) {
        try {
            return mapper.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("metric fields are not serializable", e);
        }
    }

    @Override
    public Map<String, Object> decrypt(String payload) {
        if (payload == null || payload.isBlank()) return new LinkedHashMap<>();
        try {
            return mapper.readValue(payload, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("stored metric payload is not valid JSON", e);
        }
    }
}
