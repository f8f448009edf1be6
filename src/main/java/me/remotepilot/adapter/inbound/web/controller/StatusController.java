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
import me.remotepilot.domain.service.ScheduleService;
import me.remotepilot.infrastructure.config.PilotProperties;
import me.remotepilot.port.outbound.ExecutionAgentPort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated status and health endpoints.
 */
@RestController
@RequiredArgsConstructor
public class StatusController {

    private final PilotProperties properties;
    private final ScheduleService scheduleService;
    private final ExecutionAgentPort executionAgent;
    private final Clock clock;

    @GetMapping("/")
    public Mono<ResponseEntity<Map<String, Object>>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "online");
        body.put("agent", properties.getLlm().getAssistantName());
        body.put("timestamp", clock.instant().toString());
        return Mono.just(ResponseEntity.ok(body));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.fromFuture(executionAgent.health())
                .map(bridgeOnline -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("status", "awake");
                    body.put("timestamp", clock.instant().toString());
                    body.put("schedules", scheduleService.armedCount());
                    body.put("bridge", bridgeOnline ? "online" : "offline");
                    return ResponseEntity.ok(body);
                });
    }
}
