package io.relaypipes.context;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.relaypipes.util.Jsons;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Run metadata handed to the process by its launcher. Built once per session by a
 * {@link ContextLoader}; read-only afterwards.
 */
public final class RunContext {
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final String runId;
    private final String jobName;
    private final List<String> assetKeys;
    private final String partitionKey;
    private final PartitionKeyRange partitionKeyRange;
    private final PartitionTimeWindow partitionTimeWindow;
    private final String codeVersionTag;
    private final int retryNumber;
    private final ObjectNode extras;

    RunContext(
            String runId,
            String jobName,
            List<String> assetKeys,
            String partitionKey,
            PartitionKeyRange partitionKeyRange,
            PartitionTimeWindow partitionTimeWindow,
            String codeVersionTag,
            int retryNumber,
            ObjectNode extras
    ) {
        this.runId = runId;
        this.jobName = jobName;
        this.assetKeys = List.copyOf(assetKeys);
        this.partitionKey = partitionKey;
        this.partitionKeyRange = partitionKeyRange;
        this.partitionTimeWindow = partitionTimeWindow;
        this.codeVersionTag = codeVersionTag;
        this.retryNumber = retryNumber;
        this.extras = extras == null ? Jsons.mapper().createObjectNode() : extras.deepCopy();
    }

    public String runId() {
        return runId;
    }

    public Optional<String> jobName() {
        return Optional.ofNullable(jobName);
    }

    public List<String> assetKeys() {
        return assetKeys;
    }

    public boolean isAssetStep() {
        return !assetKeys.isEmpty();
    }

    public Optional<String> partitionKey() {
        return Optional.ofNullable(partitionKey);
    }

    public Optional<PartitionKeyRange> partitionKeyRange() {
        return Optional.ofNullable(partitionKeyRange);
    }

    public Optional<PartitionTimeWindow> partitionTimeWindow() {
        return Optional.ofNullable(partitionTimeWindow);
    }

    public boolean isPartitionStep() {
        return partitionKey != null || partitionKeyRange != null;
    }

    public Optional<String> codeVersionTag() {
        return Optional.ofNullable(codeVersionTag);
    }

    public int retryNumber() {
        return retryNumber;
    }

    /**
     * @return a fresh copy of the launcher-supplied extras
     */
    public Map<String, Object> extras() {
        return Jsons.mapper().convertValue(extras, MAP_TYPE);
    }

    public ObjectNode extrasJson() {
        return extras.deepCopy();
    }

    public Optional<JsonNode> extra(String key) {
        JsonNode value = extras.get(key);
        return value == null ? Optional.empty() : Optional.of(value.deepCopy());
    }

    @Override
    public String toString() {
        return "RunContext{runId=" + runId + ", jobName=" + jobName + ", assetKeys=" + assetKeys
                + ", partitionKey=" + partitionKey + ", retryNumber=" + retryNumber + "}";
    }
}
