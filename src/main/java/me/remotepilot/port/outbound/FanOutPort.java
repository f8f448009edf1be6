package me.remotepilot.port.outbound;

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

import me.remotepilot.domain.model.RealtimeEvent;

/**
 * Port for pushing events to live listeners of a session. Sends never block
 * the caller and a failing listener never affects the others.
 */
public interface FanOutPort {

    /**
     * Deliver {@code event} to every listener connected to {@code sessionId}.
     */
    void broadcast(String sessionId, RealtimeEvent event);

    /**
     * Number of listeners currently connected to {@code sessionId}.
     */
    int listenerCount(String sessionId);
}
