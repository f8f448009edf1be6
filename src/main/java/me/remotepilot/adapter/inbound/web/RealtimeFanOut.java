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

import lombok.extern.slf4j.Slf4j;
import me.remotepilot.domain.model.RealtimeEvent;
import me.remotepilot.port.outbound.FanOutPort;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * FanOutPort backed by one Reactor sink per WebSocket connection.
 *
 * <p>
 * Connections are grouped by session id. Emission never blocks: a connection
 * whose sink has been cancelled or terminated is dropped on the next send.
 */
@Component
@Slf4j
public class RealtimeFanOut implements FanOutPort {

    private final Map<String, Map<String, Sinks.Many<RealtimeEvent>>> listeners = new ConcurrentHashMap<>();

    /**
     * Register a connection and return the stream of events addressed to it.
     */
    public Flux<RealtimeEvent> register(String sessionId, String connectionId) {
        Sinks.Many<RealtimeEvent> sink = Sinks.many().unicast().onBackpressureBuffer();
        listeners.computeIfAbsent(sessionId, id -> new ConcurrentHashMap<>()).put(connectionId, sink);
        log.debug("[WebSocket] Listener registered: session={}, connectionId={}", sessionId, connectionId);
        return sink.asFlux();
    }

    public void deregister(String sessionId, String connectionId) {
        listeners.computeIfPresent(sessionId, (id, connections) -> {
            Sinks.Many<RealtimeEvent> sink = connections.remove(connectionId);
            if (sink != null) {
                synchronized (sink) {
                    sink.tryEmitComplete();
                }
            }
            return connections.isEmpty() ? null : connections;
        });
        log.debug("[WebSocket] Listener removed: session={}, connectionId={}", sessionId, connectionId);
    }

    /**
     * Deliver {@code event} to a single connection.
     */
    public void send(String sessionId, String connectionId, RealtimeEvent event) {
        Map<String, Sinks.Many<RealtimeEvent>> connections = listeners.get(sessionId);
        if (connections == null) {
            return;
        }
        Sinks.Many<RealtimeEvent> sink = connections.get(connectionId);
        if (sink != null) {
            emit(sessionId, connectionId, sink, event);
        }
    }

    @Override
    public void broadcast(String sessionId, RealtimeEvent event) {
        Map<String, Sinks.Many<RealtimeEvent>> connections = listeners.get(sessionId);
        if (connections == null || connections.isEmpty()) {
            log.debug("[WebSocket] No listeners for session {}, {} dropped", sessionId, event.getType());
            return;
        }
        connections.forEach((connectionId, sink) -> emit(sessionId, connectionId, sink, event));
    }

    @Override
    public int listenerCount(String sessionId) {
        Map<String, Sinks.Many<RealtimeEvent>> connections = listeners.get(sessionId);
        return connections != null ? connections.size() : 0;
    }

    private void emit(String sessionId, String connectionId, Sinks.Many<RealtimeEvent> sink, RealtimeEvent event) {
        Sinks.EmitResult result;
        // Sinks reject concurrent emitters
        synchronized (sink) {
            result = sink.tryEmitNext(event);
        }
        if (result == Sinks.EmitResult.FAIL_CANCELLED || result == Sinks.EmitResult.FAIL_TERMINATED) {
            log.debug("[WebSocket] Dropping closed connection {}", connectionId);
            deregister(sessionId, connectionId);
        } else if (result.isFailure()) {
            log.warn("[WebSocket] Failed to emit {} to {}: {}", event.getType(), connectionId, result);
        }
    }
}
