package me.remotepilot.ratelimit;

import me.remotepilot.domain.model.RateLimitResult;
import me.remotepilot.domain.model.RateLimitWindow;
import me.remotepilot.infrastructure.config.PilotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FixedWindowRateLimiterTest {

    private static final Instant START = Instant.parse("2026-03-10T12:00:00Z");

    private PilotProperties properties;
    private FixedWindowRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        properties = new PilotProperties();
        properties.getRateLimit().setMaxRequests(3);
        properties.getRateLimit().setWindowSeconds(60);
        rateLimiter = new FixedWindowRateLimiter(properties);
    }

    @Test
    void shouldOpenWindowOnFirstRequest() {
        RateLimitResult result = rateLimiter.check(null, START);

        assertTrue(result.isAllowed());
        assertEquals(1, result.getCount());
        assertEquals(2, result.getRemaining());
        assertEquals(Duration.ofSeconds(60), result.getResetIn());
        assertEquals(START.plusSeconds(60), result.getWindow().getResetAt());
    }

    @Test
    void shouldDenyRequestsBeyondLimitWithinWindow() {
        RateLimitWindow window = null;
        for (int i = 0; i < 3; i++) {
            RateLimitResult result = rateLimiter.check(window, START.plusSeconds(i));
            assertTrue(result.isAllowed());
            window = result.getWindow();
        }

        RateLimitResult denied = rateLimiter.check(window, START.plusSeconds(10));

        assertFalse(denied.isAllowed());
        assertEquals(4, denied.getCount());
        assertEquals(0, denied.getRemaining());
        assertEquals(Duration.ofSeconds(50), denied.getResetIn());
        assertEquals(50, denied.getResetInSeconds());
    }

    @Test
    void shouldStartFreshWindowAtResetInstant() {
        RateLimitWindow exhausted = new RateLimitWindow(10, START.plusSeconds(60));

        RateLimitResult result = rateLimiter.check(exhausted, START.plusSeconds(60));

        assertTrue(result.isAllowed());
        assertEquals(1, result.getCount());
        assertEquals(START.plusSeconds(120), result.getWindow().getResetAt());
    }

    @Test
    void shouldRoundResetSecondsUp() {
        RateLimitWindow window = new RateLimitWindow(3, START.plusMillis(1500));

        RateLimitResult result = rateLimiter.check(window, START);

        assertFalse(result.isAllowed());
        assertEquals(2, result.getResetInSeconds());
    }

    @Test
    void shouldAllowEverythingWhenDisabled() {
        properties.getRateLimit().setEnabled(false);
        RateLimitWindow window = new RateLimitWindow(100, START.plusSeconds(30));

        RateLimitResult result = rateLimiter.check(window, START);

        assertTrue(result.isAllowed());
        assertSame(window, result.getWindow());
    }

    @Test
    void shouldKeepNullWindowWhenDisabled() {
        properties.getRateLimit().setEnabled(false);

        assertNull(rateLimiter.check(null, START).getWindow());
    }
}
