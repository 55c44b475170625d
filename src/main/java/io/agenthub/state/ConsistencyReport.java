package io.agenthub.state;

public record ConsistencyReport(int checked, int repaired, int evicted) {
}
