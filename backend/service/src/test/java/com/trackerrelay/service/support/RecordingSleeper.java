package com.trackerrelay.service.support;

import com.trackerrelay.core.util.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingSleeper implements Sleeper {
    private final List<Duration> requested = new CopyOnWriteArrayList<>();
    private final MutableClock clock;

    public RecordingSleeper() {
        this(null);
    }

    public RecordingSleeper(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public void sleep(Duration duration) {
        requested.add(duration);
        if (clock != null) {
            clock.advance(duration);
        }
    }

    public List<Duration> requested() {
        return List.copyOf(requested);
    }
}
