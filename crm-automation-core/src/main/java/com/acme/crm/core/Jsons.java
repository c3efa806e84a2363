package com.acme.crm.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Jsons {
    private static final ObjectMapper M =
            new ObjectMapper()
                    .registerModule(new JavaTimeModule())
                    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                    .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {
    };

    private Jsons() {
    }

    public static ObjectMapper mapper() {
        return M;
    }

    public static String toJson(Object o) {
        try {
            return M.writeValueAsString(o);
        } catch (Exception e) {
            throw new PermanentException("Failed to serialize " + o.getClass().getSimpleName(), e);
        }
    }

    public static <T> T fromJson(String json, Class<T> clazz) {
        try {
            return M.readValue(json, clazz);
        } catch (Exception e) {
            throw new PermanentException("Failed to deserialize " + clazz.getSimpleName(), e);
        }
    }

    public static <T> List<T> listFromJson(String json, Class<T> elementType) {
        try {
            return M.readValue(json, M.getTypeFactory().constructCollectionType(List.class, elementType));
        } catch (Exception e) {
            throw new PermanentException("Failed to deserialize list of " + elementType.getSimpleName(), e);
        }
    }

    /** Reads a flat string map, tolerating null or blank input as empty. */
    public static Map<String, String> toStringMap(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return new LinkedHashMap<>(M.readValue(json, STRING_MAP));
        } catch (Exception e) {
            throw new PermanentException("Failed to deserialize string map", e);
        }
    }

    /**
     * Lenient parse used by the reply sanitizer. Returns null when the text is not JSON at all
     * instead of throwing.
     */
    public static JsonNode tryParse(String text) {
        try {
            return M.readTree(text);
        } catch (Exception e) {
            return null;
        }
    }
}
