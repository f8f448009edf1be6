package me.remotepilot.adapter.inbound.web.controller;

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
import me.remotepilot.adapter.inbound.web.SessionHeaderResolver;
import me.remotepilot.adapter.inbound.web.dto.ChatRequest;
import me.remotepilot.adapter.inbound.web.dto.ExecuteRequest;
import me.remotepilot.adapter.inbound.web.dto.HistoryResponse;
import me.remotepilot.adapter.inbound.web.dto.SessionStateResponse;
import me.remotepilot.domain.model.ChatResponse;
import me.remotepilot.domain.model.ToolResult;
import me.remotepilot.domain.service.SessionGate;
import me.remotepilot.domain.service.SessionOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Chat and session endpoints. Every call goes through the session's actor and
 * counts against its rate limit.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final SessionGate sessionGate;
    private final SessionOrchestrator orchestrator;
    private final SessionHeaderResolver sessionResolver;
    private final Clock clock;

    @PostMapping("/chat")
    public Mono<ResponseEntity<ChatResponse>> chat(
            @RequestHeader(value = SessionHeaderResolver.HEADER, required = false) String sessionHeader,
            @RequestBody(required = false) ChatRequest request) {
        String sessionId = sessionResolver.resolve(sessionHeader);
        if (request == null || request.getMessage() == null || request.getMessage().isBlank()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "message is required"));
        }
        String message = request.getMessage();
        log.debug("[API] Chat message for session {}", sessionId);
        return Mono.fromFuture(sessionGate.submit(sessionId, session -> orchestrator.handle(session, message)))
                .map(ResponseEntity::ok);
    }

    @GetMapping("/history")
    public Mono<ResponseEntity<HistoryResponse>> history(
            @RequestHeader(value = SessionHeaderResolver.HEADER, required = false) String sessionHeader) {
        String sessionId = sessionResolver.resolve(sessionHeader);
        return Mono.fromFuture(sessionGate.submit(sessionId, session -> HistoryResponse.builder()
                .history(session.getHistory())
                .lastActive(session.getLastActive())
                .build()))
                .map(ResponseEntity::ok);
    }

    @PostMapping("/clear")
    public Mono<ResponseEntity<Map<String, Object>>> clear(
            @RequestHeader(value = SessionHeaderResolver.HEADER, required = false) String sessionHeader) {
        String sessionId = sessionResolver.resolve(sessionHeader);
        return Mono.fromFuture(sessionGate.submit(sessionId, session -> {
            session.clearHistory(clock.instant());
            return success(null);
        })).map(ResponseEntity::ok);
    }

    @PostMapping("/execute")
    public Mono<ResponseEntity<ToolResult>> execute(
            @RequestHeader(value = SessionHeaderResolver.HEADER, required = false) String sessionHeader,
            @RequestBody(required = false) ExecuteRequest request) {
        String sessionId = sessionResolver.resolve(sessionHeader);
        if (request == null || request.getTool() == null || request.getTool().isBlank()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "tool is required"));
        }
        return Mono.fromFuture(sessionGate.submit(sessionId,
                session -> orchestrator.executeDirect(request.getTool(), request.getArgs())))
                .map(ResponseEntity::ok);
    }

    @GetMapping("/state")
    public Mono<ResponseEntity<SessionStateResponse>> state(
            @RequestHeader(value = SessionHeaderResolver.HEADER, required = false) String sessionHeader) {
        String sessionId = sessionResolver.resolve(sessionHeader);
        return Mono.fromFuture(sessionGate.submit(sessionId, session -> SessionStateResponse.builder()
                .historyLength(session.getHistory().size())
                .preferences(new LinkedHashMap<>(session.getPreferences()))
                .pendingAction(session.getPendingAction().orElse(null))
                .lastActive(session.getLastActive())
                .build()))
                .map(ResponseEntity::ok);
    }

    @PostMapping("/reset")
    public Mono<ResponseEntity<Map<String, Object>>> reset(
            @RequestHeader(value = SessionHeaderResolver.HEADER, required = false) String sessionHeader) {
        String sessionId = sessionResolver.resolve(sessionHeader);
        return Mono.fromFuture(sessionGate.submit(sessionId, session -> {
            orchestrator.reset(session);
            return success("History cleared, preferences kept");
        })).map(ResponseEntity::ok);
    }

    private static Map<String, Object> success(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        if (message != null) {
            body.put("message", message);
        }
        return body;
    }
}
