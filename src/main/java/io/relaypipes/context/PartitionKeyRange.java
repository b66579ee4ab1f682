package io.relaypipes.context;

public record PartitionKeyRange(String start, String end) {
}
