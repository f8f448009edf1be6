package me.remotepilot.adapter.inbound.web;

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
import me.remotepilot.domain.service.SessionIdValidator;
import me.remotepilot.infrastructure.config.PilotProperties;
import org.springframework.stereotype.Component;

/**
 * Picks the session a request addresses from the {@code X-Session-Id} header
 * or the WebSocket {@code session} query parameter.
 */
@Component
@RequiredArgsConstructor
public class SessionHeaderResolver {

    public static final String HEADER = "X-Session-Id";

    private final PilotProperties properties;

    /**
     * @throws IllegalArgumentException
     *             if the value is present but not a valid session id
     */
    public String resolve(String value) {
        return SessionIdValidator.normalizeOrDefault(value, properties.getSession().getDefaultId());
    }
}
