package com.trackerrelay.collectors.probe;

import com.trackerrelay.core.model.ProbeResult;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

public class TrackerSelector {
    static final Comparator<ProbeResult> RANKING = Comparator
            .comparingDouble(ProbeResult::score).reversed()
            .thenComparing(ProbeResult::endpoint);

    private final double minScore;

    public TrackerSelector(double minScore) {
        this.minScore = minScore;
    }

    public List<ProbeResult> select(Collection<ProbeResult> results, int topN) {
        if (topN < 0) {
            throw new IllegalArgumentException("topN must not be negative, got: " + topN);
        }
        return results.stream()
                .filter(result -> result.score() > minScore)
                .sorted(RANKING)
                .limit(topN)
                .toList();
    }
}
