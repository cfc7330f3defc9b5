package com.thicket.db.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Shared Jackson mapper for the database document and the worker wire format.
 * Property names are snake_case; map keys (model, variant and label names) are left as-is.
 */
public class JsonUtil {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final ObjectMapper PRETTY = MAPPER.copy()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private JsonUtil() {
        // Utility class
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectMapper prettyMapper() {
        return PRETTY;
    }
}
