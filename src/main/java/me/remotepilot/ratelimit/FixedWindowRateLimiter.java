package me.remotepilot.ratelimit;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.remotepilot.domain.model.RateLimitResult;
import me.remotepilot.domain.model.RateLimitWindow;
import me.remotepilot.infrastructure.config.PilotProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-window rate limiter.
 *
 * <p>
 * A window opens on the first request after the previous one expired and
 * lasts {@code pilot.rate-limit.window-seconds}. Within a window at most
 * {@code pilot.rate-limit.max-requests} requests are allowed; denied requests
 * still count. Disabled entirely via {@code pilot.rate-limit.enabled=false}.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FixedWindowRateLimiter implements RateLimiter {

    private final PilotProperties properties;

    @Override
    public RateLimitResult check(RateLimitWindow window, Instant now) {
        PilotProperties.RateLimitProperties config = properties.getRateLimit();
        if (!config.isEnabled()) {
            return RateLimitResult.unlimited(window);
        }

        RateLimitWindow current = window;
        if (current == null || current.getResetAt() == null || !now.isBefore(current.getResetAt())) {
            current = new RateLimitWindow(0, now.plusSeconds(config.getWindowSeconds()));
        }

        int count = current.getCount() + 1;
        RateLimitWindow next = new RateLimitWindow(count, current.getResetAt());
        int max = config.getMaxRequests();
        Duration resetIn = Duration.between(now, next.getResetAt());
        if (resetIn.isNegative()) {
            resetIn = Duration.ZERO;
        }

        boolean allowed = count <= max;
        if (!allowed) {
            log.debug("Rate limit exceeded: {} requests in window, resets in {}s", count, resetIn.toSeconds());
        }

        return RateLimitResult.builder()
                .allowed(allowed)
                .count(count)
                .remaining(Math.max(0, max - count))
                .resetIn(resetIn)
                .window(next)
                .build();
    }
}
