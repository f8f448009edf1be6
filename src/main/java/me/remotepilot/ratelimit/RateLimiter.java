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

import me.remotepilot.domain.model.RateLimitResult;
import me.remotepilot.domain.model.RateLimitWindow;

import java.time.Instant;

/**
 * Rate limiter for per-session request throughput.
 *
 * <p>
 * The limiter is stateless: the window lives on the session and is passed in
 * on every check. The returned {@link RateLimitResult#getWindow()} must be
 * stored back on the session whether or not the request was allowed.
 *
 * @since 1.0
 * @see FixedWindowRateLimiter
 */
public interface RateLimiter {

    /**
     * Count one request against {@code window} at {@code now}.
     *
     * @param window
     *            the session's current window, or {@code null} if none yet
     */
    RateLimitResult check(RateLimitWindow window, Instant now);
}
