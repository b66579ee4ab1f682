package io.relaypipes.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.relaypipes.util.Jsons;

import java.util.Map;

/**
 * One record of the message stream: {@code {"method": ..., "params": {...}}}.
 */
public record PipesMessage(PipesMethod method, ObjectNode params) {

    public PipesMessage {
        if (method == null) {
            throw new IllegalArgumentException("message method cannot be null");
        }
        params = params == null ? Jsons.mapper().createObjectNode() : params.deepCopy();
    }

    public static PipesMessage assetMaterialization(String assetKey, Map<String, ?> metadata, String dataVersion) {
        ObjectNode params = Jsons.mapper().createObjectNode();
        params.set("metadata", metadataNode(metadata));
        params.put("asset_key", assetKey);
        params.put("data_version", dataVersion);
        return new PipesMessage(PipesMethod.REPORT_ASSET_MATERIALIZATION, params);
    }

    public static PipesMessage assetCheck(
            String assetKey,
            String checkName,
            boolean passed,
            AssetCheckSeverity severity,
            Map<String, ?> metadata
    ) {
        ObjectNode params = Jsons.mapper().createObjectNode();
        params.put("asset_key", assetKey);
        params.put("check_name", checkName);
        params.put("passed", passed);
        params.put("severity", (severity == null ? AssetCheckSeverity.ERROR : severity).name());
        params.set("metadata", metadataNode(metadata));
        return new PipesMessage(PipesMethod.REPORT_ASSET_CHECK, params);
    }

    public static PipesMessage log(LogLevel level, String text) {
        ObjectNode params = Jsons.mapper().createObjectNode();
        params.put("message", text == null ? "" : text);
        params.put("level", (level == null ? LogLevel.INFO : level).name());
        return new PipesMessage(PipesMethod.LOG, params);
    }

    public static PipesMessage closed() {
        return new PipesMessage(PipesMethod.CLOSED, null);
    }

    public static PipesMessage closed(ObjectNode exception) {
        ObjectNode params = Jsons.mapper().createObjectNode();
        if (exception != null) {
            params.set("exception", exception);
        }
        return new PipesMessage(PipesMethod.CLOSED, params);
    }

    /**
     * Parses a wire record; throws {@link IllegalArgumentException} when the shape is wrong.
     */
    public static PipesMessage fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("message must be a JSON object");
        }
        JsonNode method = node.get("method");
        if (method == null || !method.isTextual()) {
            throw new IllegalArgumentException("message is missing a method");
        }
        JsonNode params = node.get("params");
        if (params != null && !params.isNull() && !params.isObject()) {
            throw new IllegalArgumentException("message params must be a JSON object");
        }
        return new PipesMessage(
                PipesMethod.fromString(method.asText()),
                params == null || params.isNull() ? null : (ObjectNode) params
        );
    }

    @Override
    public ObjectNode params() {
        return params.deepCopy();
    }

    public ObjectNode toJson() {
        ObjectNode root = Jsons.mapper().createObjectNode();
        root.put("method", method.wireName());
        root.set("params", params.deepCopy());
        return root;
    }

    /**
     * Compact JSON without the trailing newline.
     */
    public String toJsonLine() {
        return Jsons.toJson(toJson());
    }

    private static ObjectNode metadataNode(Map<String, ?> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Jsons.mapper().createObjectNode();
        }
        return Jsons.mapper().valueToTree(metadata);
    }
}
