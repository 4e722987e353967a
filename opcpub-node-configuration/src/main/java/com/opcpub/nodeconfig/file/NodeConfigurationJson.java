package com.opcpub.nodeconfig.file;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Serialization and deserialization of the published nodes file.
 * JSON excludes null values when serializing, so fields left at their defaults are not written.
 */
public final class NodeConfigurationJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final TypeReference<List<ConfigurationFileEntryLegacy>> LEGACY_ENTRIES_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<ConfigurationFileEntry>> ENTRIES_TYPE = new TypeReference<>() {};

    private NodeConfigurationJson() {
    }

    /**
     * Deserializes a published nodes file in either schema. A blank document or JSON {@code null}
     * yields an empty list.
     *
     * @throws UncheckedIOException on parse failure
     */
    public static List<ConfigurationFileEntryLegacy> readEntries(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<ConfigurationFileEntryLegacy> entries = MAPPER.readValue(json, LEGACY_ENTRIES_TYPE);
            return entries != null ? entries : List.of();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Deserializes a file in the grouped schema.
     *
     * @throws UncheckedIOException on parse failure
     */
    public static List<ConfigurationFileEntry> readGroupedEntries(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<ConfigurationFileEntry> entries = MAPPER.readValue(json, ENTRIES_TYPE);
            return entries != null ? entries : List.of();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Serializes endpoint blocks in the grouped schema (indented, nulls excluded).
     *
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(List<ConfigurationFileEntry> entries) {
        try {
            return MAPPER.writeValueAsString(entries);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Serializes node id listing records in the flat schema. */
    public static String toLegacyJson(List<ConfigurationFileEntryLegacy> entries) {
        try {
            return MAPPER.writeValueAsString(entries);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
