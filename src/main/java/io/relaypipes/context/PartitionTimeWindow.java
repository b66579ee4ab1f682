package io.relaypipes.context;

/**
 * ISO-8601 bounds of the time partition, as supplied by the launcher.
 */
public record PartitionTimeWindow(String start, String end) {
}
