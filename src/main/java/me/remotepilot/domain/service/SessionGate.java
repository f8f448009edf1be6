package me.remotepilot.domain.service;

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
import me.remotepilot.domain.model.RateLimitResult;
import me.remotepilot.domain.model.SessionState;
import me.remotepilot.ratelimit.RateLimitExceededException;
import me.remotepilot.ratelimit.RateLimiter;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Entry point for inbound requests that touch a session: runs the work in the
 * session's actor after counting the request against the session's rate
 * window. A denied request does no further work.
 */
@Service
@RequiredArgsConstructor
public class SessionGate {

    private final SessionActorRegistry actorRegistry;
    private final RateLimiter rateLimiter;
    private final Clock clock;

    /**
     * @return future completed with the work's result, or exceptionally with
     *         {@link RateLimitExceededException} when throttled
     */
    public <T> CompletableFuture<T> submit(String sessionId, Function<SessionState, T> work) {
        return actorRegistry.submit(sessionId, session -> {
            RateLimitResult limit = rateLimiter.check(session.getRateLimit(), clock.instant());
            session.applyRateLimit(limit.getWindow());
            if (!limit.isAllowed()) {
                throw new RateLimitExceededException(limit);
            }
            return work.apply(session);
        });
    }
}
