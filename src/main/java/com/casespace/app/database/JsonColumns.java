package com.casespace.app.database;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;

/**
 * Colunas JSON em texto ({@code tags}, {@code linked_files}, {@code inventory_data}).
 */
public final class JsonColumns {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonColumns() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String stringArray(List<String> values) {
        ArrayNode arr = MAPPER.createArrayNode();
        if (values != null) {
            for (String v : values) arr.add(v);
        }
        return write(arr);
    }

    /** Array JSON de strings; vazio/blank vira lista vazia. */
    public static List<String> parseStringArray(String json) {
        List<String> out = new ArrayList<>();
        if (json == null || json.isBlank()) return out;
        JsonNode node = read(json);
        if (!node.isArray()) {
            throw new IllegalArgumentException("Expected a JSON array: " + json);
        }
        for (JsonNode n : node) out.add(n.asText());
        return out;
    }

    public static JsonNode read(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON column value", e);
        }
    }

    public static String write(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize JSON column value", e);
        }
    }
}
