package com.trackerrelay.collectors.api;

import com.trackerrelay.core.bus.EventBus;
import com.trackerrelay.core.util.Sleeper;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.Objects;

public record PipelineContext(
        HttpClient httpClient,
        EventBus eventBus,
        Clock clock,
        Sleeper sleeper
) {
    public PipelineContext {
        Objects.requireNonNull(httpClient, "httpClient is required");
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(sleeper, "sleeper is required");
    }
}
