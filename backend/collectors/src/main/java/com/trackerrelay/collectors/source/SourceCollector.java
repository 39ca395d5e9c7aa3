package com.trackerrelay.collectors.source;

import com.trackerrelay.collectors.api.FetchResult;
import com.trackerrelay.collectors.api.PipelineContext;
import com.trackerrelay.collectors.runtime.WorkerPool;
import com.trackerrelay.core.events.AlertRaised;
import com.trackerrelay.core.events.SourceFetched;
import com.trackerrelay.core.events.StageCompleted;
import com.trackerrelay.core.events.StageStarted;
import com.trackerrelay.core.model.Failure;
import com.trackerrelay.core.model.SourceOutcome;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

public class SourceCollector {
    public static final String STAGE = "sources";
    private static final Logger LOGGER = Logger.getLogger(SourceCollector.class.getName());

    private final PipelineContext ctx;
    private final WorkerPool pool;
    private final SourceFetcher fetcher;

    public SourceCollector(PipelineContext ctx, WorkerPool pool, SourceFetcher fetcher) {
        this.ctx = ctx;
        this.pool = pool;
        this.fetcher = fetcher;
    }

    public AggregationResult fetchAndAggregate(List<String> sources) {
        Instant stageStartedAt = ctx.clock().instant();
        ctx.eventBus().publish(new StageStarted(stageStartedAt, STAGE, sources.size()));
        LOGGER.info("Fetching " + sources.size() + " sources with " + pool.width() + " workers");

        List<FetchResult> results = pool.map(sources, this::fetchOne);

        Map<String, FetchResult> byUrl = new HashMap<>();
        List<String> bodies = new ArrayList<>();
        for (FetchResult result : results) {
            byUrl.put(result.url(), result);
            if (result.success()) {
                bodies.add(result.body());
            }
        }
        List<String> endpoints = TrackerAggregator.aggregate(bodies);

        List<SourceOutcome> outcomes = new ArrayList<>(sources.size());
        for (String url : sources) {
            FetchResult result = byUrl.get(url);
            outcomes.add(result.success()
                    ? SourceOutcome.succeeded(url, TrackerAggregator.extract(result.body()).size())
                    : SourceOutcome.failed(url, result.failure()));
        }
        AggregationResult aggregation = new AggregationResult(endpoints, outcomes);

        long durationMillis = Duration.between(stageStartedAt, ctx.clock().instant()).toMillis();
        ctx.eventBus().publish(new StageCompleted(
                ctx.clock().instant(),
                STAGE,
                aggregation.failedSources() < sources.size() || sources.isEmpty(),
                durationMillis
        ));
        LOGGER.info("Aggregated " + endpoints.size() + " unique trackers from "
                + (sources.size() - aggregation.failedSources()) + "/" + sources.size() + " sources");
        return aggregation;
    }

    private FetchResult fetchOne(String url) {
        Instant startedAt = ctx.clock().instant();
        FetchResult result = fetcher.fetch(url);
        long durationMillis = Duration.between(startedAt, ctx.clock().instant()).toMillis();
        if (result.success()) {
            int count = TrackerAggregator.extract(result.body()).size();
            ctx.eventBus().publish(new SourceFetched(ctx.clock().instant(), url, true, count, null, null, durationMillis));
            LOGGER.info("Source " + url + " yielded " + count + " trackers");
        } else {
            Failure failure = result.failure();
            ctx.eventBus().publish(new SourceFetched(
                    ctx.clock().instant(),
                    url,
                    false,
                    0,
                    failure.kind().name(),
                    failure.detail(),
                    durationMillis
            ));
            ctx.eventBus().publish(new AlertRaised(
                    ctx.clock().instant(),
                    "source",
                    "Fetch failed for " + url + ": " + failure.detail(),
                    Map.of("url", url, "kind", failure.kind().name())
            ));
            LOGGER.warning("Source failed: " + failure);
        }
        return result;
    }
}
