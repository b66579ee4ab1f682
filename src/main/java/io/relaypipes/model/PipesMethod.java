package io.relaypipes.model;

public enum PipesMethod {
    REPORT_ASSET_MATERIALIZATION("report_asset_materialization"),
    REPORT_ASSET_CHECK("report_asset_check"),
    LOG("log"),
    CLOSED("closed");

    private final String wireName;

    PipesMethod(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static PipesMethod fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Pipes method cannot be empty");
        }
        for (PipesMethod value : values()) {
            if (value.wireName.equals(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown pipes method: " + raw);
    }
}
