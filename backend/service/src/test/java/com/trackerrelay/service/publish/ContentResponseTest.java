package com.trackerrelay.service.publish;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContentResponseTest {
    @Test
    void refusalIsThrottledOnlyWhenQuotaIsSpent() {
        assertTrue(new ContentResponse(403, null, new RateLimit(0, 100), "").isThrottled());
        assertTrue(new ContentResponse(429, null, new RateLimit(1, 100), "").isThrottled());
        assertFalse(new ContentResponse(403, null, new RateLimit(4000, 100), "").isThrottled());
        assertFalse(new ContentResponse(403, null, null, "").isThrottled());
        assertFalse(new ContentResponse(500, null, new RateLimit(0, 100), "").isThrottled());
    }
}
