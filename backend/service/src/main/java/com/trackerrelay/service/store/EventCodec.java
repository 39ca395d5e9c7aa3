package com.trackerrelay.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trackerrelay.core.bus.EventBus;
import com.trackerrelay.core.events.Event;
import com.trackerrelay.core.util.JsonUtils;

import java.io.IOException;
import java.time.Instant;
import java.util.Set;
import java.util.function.Consumer;

public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Set<String> TYPES = Set.of(
            "StageStarted",
            "StageCompleted",
            "SourceFetched",
            "ProbeCompleted",
            "ArtifactPublished",
            "AlertRaised"
    );

    private EventCodec() {
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize event", e);
        }
    }

    // Pipeline events only; anything else published on the bus is not logged.
    public static void subscribeAll(EventBus bus, Consumer<Event> consumer) {
        bus.subscribeAll(event -> {
            if (TYPES.contains(event.type())) {
                consumer.accept(event);
            }
        });
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
