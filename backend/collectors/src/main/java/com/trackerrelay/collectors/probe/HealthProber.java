package com.trackerrelay.collectors.probe;

import com.trackerrelay.collectors.api.PipelineContext;
import com.trackerrelay.collectors.runtime.WorkerPool;
import com.trackerrelay.core.events.ProbeCompleted;
import com.trackerrelay.core.events.StageCompleted;
import com.trackerrelay.core.events.StageStarted;
import com.trackerrelay.core.model.ProbeResult;
import com.trackerrelay.core.model.TrackerScheme;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

public class HealthProber {
    public static final String STAGE = "probe";
    private static final Logger LOGGER = Logger.getLogger(HealthProber.class.getName());

    private final PipelineContext ctx;
    private final WorkerPool pool;
    private final List<TrackerProbe> probes;
    private final TrackerSelector selector;

    public HealthProber(PipelineContext ctx, WorkerPool pool, List<TrackerProbe> probes, TrackerSelector selector) {
        this.ctx = ctx;
        this.pool = pool;
        this.probes = List.copyOf(probes);
        this.selector = selector;
    }

    public ProbeResult probe(String endpoint) {
        TrackerScheme scheme = TrackerScheme.of(endpoint);
        for (TrackerProbe probe : probes) {
            if (probe.supports(scheme)) {
                try {
                    return probe.probe(endpoint);
                } catch (RuntimeException e) {
                    LOGGER.log(Level.WARNING, "Probe crashed for " + endpoint, e);
                    return ProbeResult.dead(endpoint, Duration.ZERO);
                }
            }
        }
        return ProbeResult.dead(endpoint, Duration.ZERO);
    }

    public List<ProbeResult> probeAll(List<String> endpoints) {
        return pool.map(endpoints, this::probe);
    }

    public List<ProbeResult> probeAndSelect(List<String> endpoints, int topN) {
        Instant startedAt = ctx.clock().instant();
        ctx.eventBus().publish(new StageStarted(startedAt, STAGE, endpoints.size()));
        LOGGER.info("Probing health of " + endpoints.size() + " trackers");

        List<ProbeResult> results = probeAll(endpoints);
        List<ProbeResult> best = selector.select(results, topN);

        int alive = (int) results.stream().filter(ProbeResult::alive).count();
        long durationMillis = Duration.between(startedAt, ctx.clock().instant()).toMillis();
        ctx.eventBus().publish(new ProbeCompleted(ctx.clock().instant(), results.size(), alive, best.size(), durationMillis));
        ctx.eventBus().publish(new StageCompleted(ctx.clock().instant(), STAGE, true, durationMillis));
        LOGGER.info("Probe finished: " + alive + "/" + results.size() + " alive, " + best.size() + " selected");
        for (int i = 0; i < best.size(); i++) {
            ProbeResult result = best.get(i);
            LOGGER.info(String.format("  %2d. %s latency=%dms score=%.2f",
                    i + 1, result.endpoint(), result.latency().toMillis(), result.score()));
        }
        return best;
    }
}
