package com.findmydevice.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;

public final class Jsons {
    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
        .build();

    private Jsons() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String stringify(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize json", e);
        }
    }

    /** Command types a device accepts, stored as a sorted JSON array. */
    public static String encodeTypes(Collection<String> types) {
        return stringify(new TreeSet<>(types));
    }

    public static Set<String> decodeTypes(String json) {
        if (json == null || json.isBlank()) {
            return Set.of();
        }
        try {
            return MAPPER.readValue(json, new TypeReference<LinkedHashSet<String>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot parse accepted command types", e);
        }
    }
}
