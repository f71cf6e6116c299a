package com.nzila.core.hash;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Canonical JSON serialization: object keys sorted, no insignificant whitespace.
 * Everything that is hashed (proposals, policy decisions, ledger payloads, attestations)
 * goes through this mapper so that equal content always yields equal bytes.
 */
public final class CanonicalJson {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .build();

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {};

    private CanonicalJson() {
    }

    public static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CanonicalJsonException("Cannot serialize value to canonical JSON", e);
        }
    }

    public static byte[] writeBytes(Object value) {
        return write(value).getBytes(StandardCharsets.UTF_8);
    }

    public static Map<String, Object> readMap(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new CanonicalJsonException("Invalid JSON object", e);
        }
    }

    public static Map<String, Object> readMap(byte[] json) {
        return readMap(new String(json, StandardCharsets.UTF_8));
    }

    public static List<Object> readList(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return MAPPER.readValue(json, LIST_TYPE);
        } catch (JsonProcessingException e) {
            throw new CanonicalJsonException("Invalid JSON array", e);
        }
    }

    public static <T> T read(String json, Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new CanonicalJsonException("Cannot read " + type.getSimpleName(), e);
        }
    }

    /**
     * Re-serializes arbitrary JSON text into its canonical form.
     */
    public static String canonicalize(String json) {
        try {
            return write(MAPPER.readValue(json, Object.class));
        } catch (JsonProcessingException e) {
            throw new CanonicalJsonException("Invalid JSON", e);
        }
    }

    public static String hash(Object value) {
        return ContentHashing.sha256(write(value));
    }

    public static class CanonicalJsonException extends RuntimeException {
        public CanonicalJsonException(String message, Throwable cause) { super(message, cause); }
    }
}
