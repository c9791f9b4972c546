package com.apisentinel.core.model;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson configuration for records, alerts and aggregates.
 *
 * <p>
 * Instants and durations are written as ISO-8601 text; unknown properties are
 * ignored on read so producers can add fields.
 * </p>
 *
 * @since 1.0.0
 */
public final class JsonMappers {

    private JsonMappers() {
        // utility class, not instantiable
    }

    /**
     * @return a newly configured mapper; {@link ObjectMapper} is thread-safe
     *         once configured, so callers keep one per component
     */
    public static ObjectMapper create() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
