package com.trackerrelay.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProbeResultTest {
    private static final Duration WINDOW = ProbeResult.DEFAULT_SCORE_WINDOW;

    @Test
    void scoreDecaysLinearlyAcrossWindow() {
        assertEquals(1.0, ProbeResult.measured("udp://a:1", true, Duration.ZERO, WINDOW).score(), 1e-9);
        assertEquals(0.8, ProbeResult.measured("udp://a:1", true, Duration.ofSeconds(1), WINDOW).score(), 1e-9);
        assertEquals(0.5, ProbeResult.measured("udp://a:1", true, Duration.ofMillis(2500), WINDOW).score(), 1e-9);
    }

    @Test
    void scoreStaysWithinBounds() {
        List<Duration> latencies = List.of(
                Duration.ZERO,
                Duration.ofMillis(1),
                Duration.ofSeconds(5),
                Duration.ofSeconds(9),
                Duration.ofMillis(-3)
        );
        for (Duration latency : latencies) {
            for (boolean alive : new boolean[]{true, false}) {
                ProbeResult result = ProbeResult.measured("http://t/announce", alive, latency, WINDOW);
                assertTrue(result.score() >= 0.0 && result.score() <= 1.0, "score out of range for " + latency);
                if (!alive) {
                    assertEquals(0.0, result.score());
                }
            }
        }
    }

    @Test
    void deadEndpointKeepsLatencyButScoresZero() {
        ProbeResult dead = ProbeResult.dead("udp://x:1", Duration.ofSeconds(5));

        assertEquals(0.0, dead.score());
        assertEquals(Duration.ofSeconds(5), dead.latency());
    }

    @Test
    void constructorRejectsInconsistentScores() {
        assertThrows(IllegalArgumentException.class, () -> new ProbeResult("a", false, Duration.ZERO, 0.4));
        assertThrows(IllegalArgumentException.class, () -> new ProbeResult("a", true, Duration.ZERO, 1.2));
    }
}
