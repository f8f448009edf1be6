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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.remotepilot.adapter.inbound.web.security.ApiTokenAuthenticator;
import me.remotepilot.domain.model.RealtimeEvent;
import me.remotepilot.domain.model.RealtimeEventType;
import me.remotepilot.domain.service.SessionGate;
import me.remotepilot.domain.service.SessionOrchestrator;
import me.remotepilot.port.outbound.ExecutionAgentPort;
import me.remotepilot.ratelimit.RateLimitExceededException;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.UncheckedIOException;
import java.net.URI;
import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletionException;

/**
 * Real-time channel at {@code /ws?session=<id>}.
 *
 * <p>
 * Outbound frames are {@code {type, payload, timestamp}}. A new connection
 * gets a "Connected" notification followed by the execution agent's
 * reachability as {@code bridge_status}. Inbound frames:
 * <ul>
 * <li>{@code {"type":"ping"}} - answered with {@code ping {pong:true}}</li>
 * <li>{@code {"type":"chat","token":"...","message":"..."}} - handled like
 * {@code POST /chat} and answered with a {@code chat} event on this
 * connection</li>
 * </ul>
 * Malformed frames are ignored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RealtimeWebSocketHandler implements WebSocketHandler {

    private static final String TYPE_PING = "ping";
    private static final String TYPE_CHAT = "chat";

    private final RealtimeFanOut fanOut;
    private final SessionGate sessionGate;
    private final SessionOrchestrator orchestrator;
    private final ExecutionAgentPort executionAgent;
    private final ApiTokenAuthenticator authenticator;
    private final SessionHeaderResolver sessionResolver;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String sessionId;
        try {
            sessionId = sessionResolver.resolve(extractQueryParam(session, "session"));
        } catch (IllegalArgumentException e) {
            log.warn("[WebSocket] Connection rejected: {}", e.getMessage());
            return session.close();
        }

        String connectionId = UUID.randomUUID().toString();
        log.info("[WebSocket] Connection established: session={}, connectionId={}", sessionId, connectionId);

        Flux<WebSocketMessage> outbound = fanOut.register(sessionId, connectionId)
                .map(this::toJson)
                .map(session::textMessage);

        fanOut.send(sessionId, connectionId,
                RealtimeEvent.notification("Connected", "Real-time updates enabled", clock.instant()));
        executionAgent.health().thenAccept(online -> fanOut.send(sessionId, connectionId,
                RealtimeEvent.of(RealtimeEventType.BRIDGE_STATUS, Map.of("online", online), clock.instant())));

        Mono<Void> inbound = session.receive()
                .doOnNext(message -> handleIncoming(message.getPayloadAsText(), sessionId, connectionId))
                .then();

        return session.send(outbound)
                .and(inbound)
                .doFinally(signal -> {
                    log.info("[WebSocket] Connection closed: connectionId={}, signal={}", connectionId, signal);
                    fanOut.deregister(sessionId, connectionId);
                });
    }

    void handleIncoming(String payload, String sessionId, String connectionId) {
        try {
            JsonNode frame = objectMapper.readTree(payload);
            String type = text(frame, "type");

            if (TYPE_PING.equals(type)) {
                fanOut.send(sessionId, connectionId,
                        RealtimeEvent.of(RealtimeEventType.PING, Map.of("pong", true), clock.instant()));
                return;
            }

            if (!TYPE_CHAT.equals(type)) {
                log.debug("[WebSocket] Ignoring frame of type {}", type);
                return;
            }
            String token = text(frame, "token");
            if (token == null || token.isEmpty() || !authenticator.matches(token)) {
                log.warn("[WebSocket] Missing or invalid token on connection {}", connectionId);
                fanOut.send(sessionId, connectionId, RealtimeEvent.notification("Error", "Invalid token",
                        clock.instant()));
                return;
            }
            String message = text(frame, "message");
            if (message == null || message.isBlank()) {
                log.debug("[WebSocket] Ignoring empty chat frame on connection {}", connectionId);
                return;
            }

            sessionGate.submit(sessionId, state -> orchestrator.handle(state, message))
                    .whenComplete((response, error) -> {
                        if (error == null) {
                            fanOut.send(sessionId, connectionId,
                                    RealtimeEvent.of(RealtimeEventType.CHAT, response, clock.instant()));
                        } else {
                            onChatFailure(unwrap(error), sessionId, connectionId);
                        }
                    });
        } catch (JsonProcessingException | RuntimeException e) { // NOSONAR - a bad frame must not close the socket
            log.debug("[WebSocket] Failed to process incoming frame: {}", e.getMessage());
        }
    }

    private void onChatFailure(Throwable error, String sessionId, String connectionId) {
        if (error instanceof RateLimitExceededException rateLimited) {
            fanOut.send(sessionId, connectionId, RealtimeEvent.notification("Error",
                    "Rate limit exceeded, retry in " + rateLimited.getRetryAfterSeconds() + "s", clock.instant()));
            return;
        }
        log.error("[WebSocket] Chat failed in session {}", sessionId, error);
        fanOut.send(sessionId, connectionId, RealtimeEvent.notification("Error", "Internal server error",
                clock.instant()));
    }

    private String toJson(RealtimeEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node != null ? node.get(field) : null;
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static String extractQueryParam(WebSocketSession session, String key) {
        URI uri = session.getHandshakeInfo().getUri();
        String query = uri.getQuery();
        if (query == null || query.isBlank()) {
            return null;
        }
        return UriComponentsBuilder.newInstance()
                .query(query)
                .build()
                .getQueryParams()
                .getFirst(key);
    }
}
