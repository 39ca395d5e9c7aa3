package com.trackerrelay.core.bus;

import com.trackerrelay.core.events.SourceFetched;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventBusConcurrencyTest {
    @Test
    void workersPublishingConcurrentlyReachEveryTypedAndWildcardSubscriber() throws Exception {
        EventBus bus = new EventBus((event, error) -> {
            throw new AssertionError("No handler should fail in this test", error);
        });
        int typedSubscribers = 6;
        int publishCount = 1_000;
        LongAdder typed = new LongAdder();
        LongAdder wildcard = new LongAdder();
        for (int i = 0; i < typedSubscribers; i++) {
            bus.subscribe(SourceFetched.class, event -> typed.increment());
        }
        bus.subscribeAll(event -> wildcard.increment());

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            Future<?>[] futures = new Future<?>[publishCount];
            for (int i = 0; i < publishCount; i++) {
                int n = i;
                futures[i] = executor.submit(() -> bus.publish(fetched("https://example.com/" + n)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals((long) typedSubscribers * publishCount, typed.sum());
        assertEquals(publishCount, wildcard.sum());
    }

    @Test
    void subscribingWhilePublishingStaysStable() throws Exception {
        AtomicInteger handlerErrors = new AtomicInteger();
        EventBus bus = new EventBus((event, error) -> handlerErrors.incrementAndGet());
        AtomicInteger observed = new AtomicInteger();
        bus.subscribe(SourceFetched.class, event -> observed.incrementAndGet());

        int publishers = 4;
        int publishesEach = 500;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            Future<?>[] tasks = new Future<?>[publishers * 2];
            for (int i = 0; i < publishers; i++) {
                tasks[i] = executor.submit(() -> {
                    start.await();
                    for (int j = 0; j < publishesEach; j++) {
                        bus.publish(fetched("https://example.com/list.txt"));
                    }
                    return null;
                });
                tasks[publishers + i] = executor.submit(() -> {
                    start.await();
                    for (int j = 0; j < 100; j++) {
                        bus.subscribeAll(event -> observed.incrementAndGet());
                    }
                    return null;
                });
            }
            start.countDown();
            for (Future<?> task : tasks) {
                task.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(0, handlerErrors.get());
        assertTrue(observed.get() >= publishers * publishesEach);
    }

    private static SourceFetched fetched(String url) {
        return new SourceFetched(Instant.now(), url, true, 10, null, null, 5);
    }
}
