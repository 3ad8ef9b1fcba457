package io.tongchi.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

public final class Jsons {
    private static final ObjectMapper PRETTY = base().enable(SerializationFeature.INDENT_OUTPUT);
    private static final ObjectMapper COMPACT = base();

    private Jsons() {
    }

    public static ObjectMapper mapper() {
        return PRETTY;
    }

    public static String toJson(Object value) {
        return write(PRETTY, value);
    }

    public static String toCompactJson(Object value) {
        return write(COMPACT, value);
    }

    private static ObjectMapper base() {
        return new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    private static String write(ObjectMapper mapper, Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName() + " as JSON", e);
        }
    }
}
