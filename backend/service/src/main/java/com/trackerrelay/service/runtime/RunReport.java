package com.trackerrelay.service.runtime;

import com.trackerrelay.core.model.ProbeResult;
import com.trackerrelay.core.model.SourceOutcome;
import com.trackerrelay.service.publish.PublishOutcome;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

public record RunReport(
        RunStatus status,
        List<String> endpoints,
        List<SourceOutcome> sources,
        List<ProbeResult> best,
        List<PublishOutcome> published,
        Duration elapsed
) {
    public RunReport {
        Objects.requireNonNull(status, "status is required");
        endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
        sources = sources == null ? List.of() : List.copyOf(sources);
        best = best == null ? List.of() : List.copyOf(best);
        published = published == null ? List.of() : List.copyOf(published);
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public int exitCode() {
        return status.exitCode();
    }
}
