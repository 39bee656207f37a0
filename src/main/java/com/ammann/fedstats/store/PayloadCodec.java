/* (C)2026 */
package com.ammann.fedstats.store;

import com.ammann.fedstats.exception.ArtifactStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;

/**
 * Encodes payloads as UTF-8 line-delimited JSON, one object per line.
 */
public final class PayloadCodec {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);

    private PayloadCodec() {}

    /**
     * Serializes one object to a single JSON line terminated by a newline.
     */
    public static String encode(Object payload) {
        try {
            return JSON_MAPPER.writeValueAsString(payload) + "\n";
        } catch (JsonProcessingException e) {
            throw new ArtifactStoreException("Cannot encode " + payload.getClass().getSimpleName(), e);
        }
    }

    /**
     * Parses every non-blank line of a blob.
     *
     * @throws ArtifactStoreException if a line is not a valid object of the given type
     */
    public static <T> List<T> decodeAll(String blob, Class<T> type) {
        List<T> values = new ArrayList<>();
        for (String line : blob.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                values.add(JSON_MAPPER.readValue(line, type));
            } catch (JsonProcessingException e) {
                throw new ArtifactStoreException(
                        "Malformed " + type.getSimpleName() + " line: " + e.getOriginalMessage(), e);
            }
        }
        return values;
    }

    /**
     * Parses a blob expected to hold exactly one object.
     *
     * @throws ArtifactStoreException if the blob holds zero or several objects
     */
    public static <T> T decodeSingle(String blob, Class<T> type) {
        List<T> values = decodeAll(blob, type);
        if (values.size() != 1) {
            throw new ArtifactStoreException(String.format(
                    "Expected one %s, found %d", type.getSimpleName(), values.size()));
        }
        return values.get(0);
    }
}
