package me.remotepilot.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * Result of a rate limit check operation.
 *
 * <p>
 * Contains:
 * <ul>
 * <li>{@code allowed} - whether the request was permitted</li>
 * <li>{@code count} - requests counted in the current window, this one
 * included</li>
 * <li>{@code remaining} - requests left before the window is exhausted</li>
 * <li>{@code resetIn} - time until the window resets</li>
 * <li>{@code window} - the window to store back on the session</li>
 * </ul>
 *
 * @since 1.0
 */
@Data
@Builder
public class RateLimitResult {

    private boolean allowed;
    private int count;
    private int remaining;
    private Duration resetIn;
    private RateLimitWindow window;

    /**
     * Result for a disabled limiter: always allowed, window left untouched.
     */
    public static RateLimitResult unlimited(RateLimitWindow window) {
        return RateLimitResult.builder()
                .allowed(true)
                .remaining(Integer.MAX_VALUE)
                .resetIn(Duration.ZERO)
                .window(window)
                .build();
    }

    /**
     * Seconds until reset, rounded up, as sent in {@code X-RateLimit-Reset}.
     */
    public long getResetInSeconds() {
        if (resetIn == null) {
            return 0;
        }
        long millis = resetIn.toMillis();
        return (millis + 999) / 1000;
    }
}
