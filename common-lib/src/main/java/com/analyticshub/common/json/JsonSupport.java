package com.analyticshub.common.json;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson configuration for the analytics core.
 *
 * <p>Two mappers are exposed:
 * <ul>
 *   <li>{@link #mapper()}:          insertion-ordered output; used wherever the
 *       serialized form must mirror the payload exactly as received</li>
 *   <li>{@link #canonicalMapper()}: alphabetically sorted properties and map keys;
 *       used for content hashing where equal inputs must stringify identically</li>
 * </ul>
 * Both write {@link java.time.Instant} values as ISO-8601 strings.
 */
public final class JsonSupport {

    private static final ObjectMapper MAPPER = configure(JsonMapper.builder()).build();

    private static final ObjectMapper CANONICAL_MAPPER = configure(JsonMapper.builder())
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .build();

    private JsonSupport() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectMapper canonicalMapper() {
        return CANONICAL_MAPPER;
    }

    /** Applies the platform defaults to a fresh builder; also used by the Spring config. */
    public static JsonMapper.Builder configure(JsonMapper.Builder builder) {
        return builder
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
