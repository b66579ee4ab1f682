package io.relaypipes.model;

public enum AssetCheckSeverity {
    WARN,
    ERROR;

    public static AssetCheckSeverity fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return ERROR;
        }
        for (AssetCheckSeverity value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown asset check severity: " + raw);
    }
}
