package com.pbsmon.core.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Shared Jackson mapper for PBS API payloads.
 * <p>
 * Unknown properties are ignored: PBS adds fields between releases and the exporter
 * only reads the ones it projects.
 * </p>
 */
public final class JsonUtils {
    private JsonUtils() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static ObjectMapper mapper() {
        return MAPPER;
    }

    public static <T> T readValue(String json, Class<T> clazz) {
        try {
            return mapper().readValue(json, clazz);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to parse " + clazz.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    public static <T> T readValue(String json, TypeReference<T> type) {
        try {
            return mapper().readValue(json, type);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to parse " + type.getType().getTypeName() + ": " + e.getMessage(), e);
        }
    }
}
