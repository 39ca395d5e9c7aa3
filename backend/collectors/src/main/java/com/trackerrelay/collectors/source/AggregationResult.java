package com.trackerrelay.collectors.source;

import com.trackerrelay.core.model.SourceOutcome;

import java.util.List;

public record AggregationResult(List<String> endpoints, List<SourceOutcome> outcomes) {
    public AggregationResult {
        endpoints = List.copyOf(endpoints);
        outcomes = List.copyOf(outcomes);
    }

    public long failedSources() {
        return outcomes.stream().filter(outcome -> !outcome.success()).count();
    }
}
