// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.core.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.List;

/**
 * Shared Jackson mapper producing canonical JSON: map entries are written in key
 * order so equal values always serialize to equal strings.
 */
public final class Json {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private Json() {
    }

    public static String canonical(final Object value) throws JsonProcessingException {
        return MAPPER.writeValueAsString(value);
    }

    public static List<String> readStringArray(final String json) throws JsonProcessingException {
        return MAPPER.readValue(json, STRING_LIST);
    }
}
