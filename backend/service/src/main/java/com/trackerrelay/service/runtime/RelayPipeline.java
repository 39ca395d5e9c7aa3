package com.trackerrelay.service.runtime;

import com.trackerrelay.collectors.api.PipelineContext;
import com.trackerrelay.collectors.probe.HealthProber;
import com.trackerrelay.collectors.probe.HttpTrackerProbe;
import com.trackerrelay.collectors.probe.TrackerSelector;
import com.trackerrelay.collectors.probe.UdpTrackerProbe;
import com.trackerrelay.collectors.runtime.WorkerPool;
import com.trackerrelay.collectors.source.AggregationResult;
import com.trackerrelay.collectors.source.SourceCollector;
import com.trackerrelay.collectors.source.SourceFetcher;
import com.trackerrelay.core.events.AlertRaised;
import com.trackerrelay.core.model.ProbeResult;
import com.trackerrelay.service.config.PublishConfig;
import com.trackerrelay.service.config.RelayConfig;
import com.trackerrelay.service.publish.ContentStoreClient;
import com.trackerrelay.service.publish.PublishClient;
import com.trackerrelay.service.publish.PublishOutcome;
import com.trackerrelay.service.readme.ReadmePatcher;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

public class RelayPipeline {
    private static final Logger LOGGER = Logger.getLogger(RelayPipeline.class.getName());
    static final DateTimeFormatter COMMIT_DATE = DateTimeFormatter.ofPattern("yyyy/MM/dd");

    private final RelayConfig config;
    private final PipelineContext ctx;
    private final SourceCollector sourceCollector;
    private final HealthProber prober;
    private final PublishClient publisher;

    public RelayPipeline(
            RelayConfig config,
            PipelineContext ctx,
            SourceCollector sourceCollector,
            HealthProber prober,
            PublishClient publisher
    ) {
        this.config = config;
        this.ctx = ctx;
        this.sourceCollector = sourceCollector;
        this.prober = prober;
        this.publisher = publisher;
    }

    public static RelayPipeline create(RelayConfig config, PipelineContext ctx, WorkerPool pool) {
        SourceFetcher fetcher = new SourceFetcher(ctx, config.sources().requestTimeout(), config.sources().retryPolicy());
        HealthProber prober = new HealthProber(
                ctx,
                pool,
                List.of(new HttpTrackerProbe(ctx.httpClient(), config.probe()), new UdpTrackerProbe(config.probe())),
                new TrackerSelector(config.probe().minScore())
        );
        PublishConfig publish = config.publish();
        PublishClient publisher = new PublishClient(ctx, new ContentStoreClient(ctx.httpClient(), publish), publish);
        return new RelayPipeline(config, ctx, new SourceCollector(ctx, pool, fetcher), prober, publisher);
    }

    public RunReport run() {
        Instant started = ctx.clock().instant();
        AggregationResult aggregation = sourceCollector.fetchAndAggregate(config.sources().urls());
        List<String> endpoints = aggregation.endpoints();
        LOGGER.info("Aggregated " + endpoints.size() + " unique trackers from " + aggregation.outcomes().size()
                + " sources (" + aggregation.failedSources() + " failed)");

        if (endpoints.size() < config.minTrackers()) {
            LOGGER.severe("Only " + endpoints.size() + " trackers aggregated, below the floor of "
                    + config.minTrackers() + "; nothing will be published");
            ctx.eventBus().publish(new AlertRaised(
                    ctx.clock().instant(),
                    "safety_floor",
                    "Aggregated tracker count " + endpoints.size() + " is below " + config.minTrackers(),
                    Map.of("count", endpoints.size(), "minimum", config.minTrackers())
            ));
            return new RunReport(RunStatus.BELOW_SAFETY_FLOOR, endpoints, aggregation.outcomes(), List.of(), List.of(),
                    Duration.between(started, ctx.clock().instant()));
        }

        List<ProbeResult> best = prober.probeAndSelect(endpoints, config.probe().topN());

        String date = LocalDate.now(ctx.clock()).format(COMMIT_DATE);
        PublishConfig publish = config.publish();
        List<PublishOutcome> published = new ArrayList<>();
        String primaryMessage = "Update trackers on " + date + " - " + endpoints.size() + " items";

        PublishOutcome primary = publisher.publish(publish.primaryPath(), render(endpoints), primaryMessage);
        published.add(primary);
        if (!primary.succeeded()) {
            LOGGER.severe("Publishing " + publish.primaryPath() + " failed: " + primary.failure()
                    + "; skipping remaining artifacts");
            return new RunReport(RunStatus.PRIMARY_PUBLISH_FAILED, endpoints, aggregation.outcomes(), best, published,
                    Duration.between(started, ctx.clock().instant()));
        }

        if (best.isEmpty()) {
            LOGGER.warning("No tracker passed the health check; " + publish.bestPath() + " left as is");
        } else {
            List<String> bestEndpoints = best.stream().map(ProbeResult::endpoint).toList();
            PublishOutcome bestOutcome = publisher.publish(
                    publish.bestPath(), render(bestEndpoints), "Update best trackers on " + date);
            published.add(bestOutcome);
            if (!bestOutcome.succeeded()) {
                LOGGER.warning("Publishing " + publish.bestPath() + " failed: " + bestOutcome.failure());
            }
        }

        if (Boolean.TRUE.equals(publish.publishReadme())) {
            int count = endpoints.size();
            PublishOutcome readme = publisher.publishDerived(
                    publish.readmePath(), current -> ReadmePatcher.patch(current, date, count), primaryMessage);
            published.add(readme);
            if (!readme.succeeded()) {
                LOGGER.warning("Publishing " + publish.readmePath() + " failed: " + readme.failure());
            }
        }

        Duration elapsed = Duration.between(started, ctx.clock().instant());
        if (elapsed.compareTo(config.slowRunWarning()) > 0) {
            LOGGER.warning("Run took " + elapsed.toSeconds() + "s, longer than " + config.slowRunWarning().toSeconds() + "s");
        }
        if (endpoints.size() < config.lowCountWarning()) {
            LOGGER.warning("Tracker count " + endpoints.size() + " is below " + config.lowCountWarning()
                    + "; sources may be degraded");
        }
        LOGGER.info("Run completed in " + elapsed.toMillis() + "ms with " + endpoints.size() + " trackers, "
                + best.size() + " selected");
        return new RunReport(RunStatus.COMPLETED, endpoints, aggregation.outcomes(), best, published, elapsed);
    }

    static String render(List<String> endpoints) {
        if (endpoints.isEmpty()) {
            return "";
        }
        return String.join("\n", endpoints) + "\n";
    }
}
