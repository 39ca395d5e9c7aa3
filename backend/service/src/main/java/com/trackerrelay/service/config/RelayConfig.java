package com.trackerrelay.service.config;

import com.trackerrelay.collectors.config.ProbeConfig;
import com.trackerrelay.collectors.config.SourceConfig;
import com.trackerrelay.collectors.runtime.WorkerPool;

import java.time.Duration;

public record RelayConfig(
        int workers,
        int minTrackers,
        int lowCountWarning,
        Duration slowRunWarning,
        SourceConfig sources,
        ProbeConfig probe,
        PublishConfig publish
) {
    public RelayConfig {
        workers = workers <= 0 ? WorkerPool.DEFAULT_WIDTH : workers;
        minTrackers = minTrackers <= 0 ? 50 : minTrackers;
        lowCountWarning = lowCountWarning <= 0 ? 100 : lowCountWarning;
        slowRunWarning = slowRunWarning == null ? Duration.ofSeconds(30) : slowRunWarning;
        sources = sources == null ? SourceConfig.defaults() : sources;
        probe = probe == null ? ProbeConfig.defaults() : probe;
        publish = publish == null ? PublishConfig.defaults() : publish;
    }

    public static RelayConfig defaults() {
        return new RelayConfig(0, 0, 0, null, null, null, null);
    }

    public RelayConfig withPublish(PublishConfig next) {
        return new RelayConfig(workers, minTrackers, lowCountWarning, slowRunWarning, sources, probe, next);
    }
}
