package com.pathwise.planlibrary;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.pathwise.planlibrary.config.PlanDefinition;
import com.pathwise.planlibrary.config.PlanLibrary;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Serialization and deserialization of the plan library document and single plans.
 * JSON excludes null values when serializing. Unknown properties are ignored; unknown node types,
 * edge conditions and verification types fail the parse.
 */
public final class PlanLibraryConfig {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private PlanLibraryConfig() {
    }

    /**
     * Deserializes the plan library from a JSON string.
     *
     * @param json the JSON document (e.g. file contents)
     * @return the parsed {@link PlanLibrary}
     * @throws UncheckedIOException on parse failure, including unknown node types and conditions
     */
    public static PlanLibrary fromJson(String json) {
        try {
            return MAPPER.readValue(json, PlanLibrary.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Serializes the plan library to a JSON string (nulls excluded).
     *
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(PlanLibrary library) {
        try {
            return MAPPER.writeValueAsString(library);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /** Serializes a single plan to JSON (e.g. for diagnostics). */
    public static String toJson(PlanDefinition plan) {
        try {
            return MAPPER.writeValueAsString(plan);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /** Deserializes a single plan from JSON. */
    public static PlanDefinition planFromJson(String json) {
        try {
            return MAPPER.readValue(json, PlanDefinition.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
