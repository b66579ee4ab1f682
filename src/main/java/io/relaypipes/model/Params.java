package io.relaypipes.model;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.relaypipes.util.Jsons;

import java.util.Map;
import java.util.Optional;

/**
 * Decoded bootstrap parameters. Holds a private copy of the JSON object; every accessor
 * that exposes structure returns a copy.
 */
public final class Params {
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectNode values;

    private Params(ObjectNode values) {
        this.values = values;
    }

    public static Params of(ObjectNode values) {
        return new Params(values == null ? Jsons.mapper().createObjectNode() : values.deepCopy());
    }

    public static Params of(Map<String, ?> values) {
        ObjectNode node = values == null
                ? Jsons.mapper().createObjectNode()
                : Jsons.mapper().valueToTree(values);
        return new Params(node);
    }

    public boolean has(String key) {
        return values.has(key) && !values.get(key).isNull();
    }

    public Optional<JsonNode> get(String key) {
        JsonNode node = values.get(key);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        return Optional.of(node.deepCopy());
    }

    /**
     * Text value of {@code key}, empty when absent or not a JSON string.
     */
    public Optional<String> text(String key) {
        JsonNode node = values.get(key);
        if (node == null || !node.isTextual()) {
            return Optional.empty();
        }
        return Optional.of(node.asText());
    }

    public ObjectNode toJson() {
        return values.deepCopy();
    }

    public Map<String, Object> toMap() {
        return Jsons.mapper().convertValue(values, MAP_TYPE);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Params that)) {
            return false;
        }
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Params" + Jsons.toJson(values);
    }
}
