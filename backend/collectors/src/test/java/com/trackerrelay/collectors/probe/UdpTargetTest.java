package com.trackerrelay.collectors.probe;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UdpTargetTest {
    @Test
    void parsesHostAndPort() {
        assertEquals(Optional.of(new UdpTarget("tracker.example", 1337)), UdpTarget.parse("udp://tracker.example:1337"));
    }

    @Test
    void ignoresAnnouncePathAfterPort() {
        assertEquals(Optional.of(new UdpTarget("open.tracker", 6969)), UdpTarget.parse("udp://open.tracker:6969/announce"));
    }

    @Test
    void rejectsMalformedTargets() {
        assertTrue(UdpTarget.parse("udp://bad").isEmpty());
        assertTrue(UdpTarget.parse("udp://host:notaport").isEmpty());
        assertTrue(UdpTarget.parse("udp://host:1:2").isEmpty());
        assertTrue(UdpTarget.parse("udp://:80").isEmpty());
        assertTrue(UdpTarget.parse("udp://host:").isEmpty());
        assertTrue(UdpTarget.parse("udp://host:0").isEmpty());
        assertTrue(UdpTarget.parse("udp://host:70000").isEmpty());
        assertTrue(UdpTarget.parse("udp://host:-5").isEmpty());
        assertTrue(UdpTarget.parse("http://host:80").isEmpty());
    }
}
