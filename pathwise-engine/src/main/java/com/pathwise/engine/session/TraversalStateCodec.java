package com.pathwise.engine.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pathwise.engine.runtime.TraversalState;

import java.io.UncheckedIOException;

/**
 * JSON form of a traversal state, for hosts that persist sessions between processes.
 */
public final class TraversalStateCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private TraversalStateCodec() {
    }

    public static String toJson(TraversalState state) {
        try {
            return MAPPER.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize traversal state", e);
        }
    }

    public static TraversalState fromJson(String json) {
        try {
            return MAPPER.readValue(json, TraversalState.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to parse traversal state JSON", e);
        }
    }
}
