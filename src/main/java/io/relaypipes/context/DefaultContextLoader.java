package io.relaypipes.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.relaypipes.config.PipesConfig;
import io.relaypipes.model.Params;
import io.relaypipes.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Accepts the inline shape {@code {"context": {...}}} or the file shape {@code {"path": "..."}}.
 * Inline wins when both keys are present.
 */
public final class DefaultContextLoader implements ContextLoader {
    private static final Logger LOG = LoggerFactory.getLogger(DefaultContextLoader.class);

    @Override
    public RunContext loadContext(Params params) {
        if (params == null) {
            throw new ContextDecodeException("context params are missing");
        }
        if (params.has(PipesConfig.CONTEXT_KEY)) {
            JsonNode inline = params.get(PipesConfig.CONTEXT_KEY).orElseThrow();
            return fromJson(inline);
        }
        if (params.has(PipesConfig.PATH_KEY)) {
            String path = params.text(PipesConfig.PATH_KEY)
                    .orElseThrow(() -> new ContextDecodeException("context params 'path' must be a string"));
            return fromJson(readFile(path));
        }
        throw new ContextDecodeException(
                "context params must contain '" + PipesConfig.CONTEXT_KEY + "' or '" + PipesConfig.PATH_KEY + "'"
        );
    }

    private JsonNode readFile(String rawPath) {
        Path path;
        try {
            path = Path.of(rawPath);
        } catch (InvalidPathException e) {
            throw new ContextDecodeException("invalid context path: " + rawPath, e);
        }
        try {
            String json = Files.readString(path, StandardCharsets.UTF_8);
            LOG.debug("Read context file {}", path);
            return Jsons.mapper().readTree(json);
        } catch (JsonProcessingException e) {
            throw new ContextDecodeException("context file is not valid JSON: " + path, e);
        } catch (IOException e) {
            throw new ContextDecodeException("Failed to read context file: " + path, e);
        }
    }

    static RunContext fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ContextDecodeException("context must be a JSON object");
        }
        String runId = requiredText(node, "run_id");
        List<String> assetKeys = assetKeys(node);
        ObjectNode extras = extras(node);
        return new RunContext(
                runId,
                optionalText(node, "job_name"),
                assetKeys,
                optionalText(node, "partition_key"),
                keyRange(node),
                timeWindow(node),
                optionalText(node, "code_version_tag"),
                retryNumber(node),
                extras
        );
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new ContextDecodeException("context is missing required field: " + field);
        }
        if (!value.isTextual() || value.asText().isBlank()) {
            throw new ContextDecodeException("context field must be a non-empty string: " + field);
        }
        return value.asText();
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new ContextDecodeException("context field must be a string: " + field);
        }
        return value.asText();
    }

    private static List<String> assetKeys(JsonNode node) {
        JsonNode value = node.get("asset_keys");
        if (value == null || value.isNull()) {
            throw new ContextDecodeException("context is missing required field: asset_keys");
        }
        if (!value.isArray()) {
            throw new ContextDecodeException("context field must be an array: asset_keys");
        }
        List<String> keys = new ArrayList<>(value.size());
        for (JsonNode item : value) {
            if (!item.isTextual() || item.asText().isBlank()) {
                throw new ContextDecodeException("asset_keys must contain non-empty strings");
            }
            keys.add(item.asText());
        }
        return keys;
    }

    private static ObjectNode extras(JsonNode node) {
        JsonNode value = node.get("extras");
        if (value == null || value.isNull()) {
            return Jsons.mapper().createObjectNode();
        }
        if (!value.isObject()) {
            throw new ContextDecodeException("context field must be an object: extras");
        }
        return (ObjectNode) value;
    }

    private static PartitionKeyRange keyRange(JsonNode node) {
        JsonNode value = node.get("partition_key_range");
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isObject()) {
            throw new ContextDecodeException("context field must be an object: partition_key_range");
        }
        return new PartitionKeyRange(requiredText(value, "start"), requiredText(value, "end"));
    }

    private static PartitionTimeWindow timeWindow(JsonNode node) {
        JsonNode value = node.get("partition_time_window");
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isObject()) {
            throw new ContextDecodeException("context field must be an object: partition_time_window");
        }
        return new PartitionTimeWindow(requiredText(value, "start"), requiredText(value, "end"));
    }

    private static int retryNumber(JsonNode node) {
        JsonNode value = node.get("retry_number");
        if (value == null || value.isNull()) {
            return 0;
        }
        if (!value.canConvertToInt() || !value.isIntegralNumber() || value.asInt() < 0) {
            throw new ContextDecodeException("context field must be a non-negative integer: retry_number");
        }
        return value.asInt();
    }
}
