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
import me.remotepilot.adapter.inbound.web.SessionHeaderResolver;
import me.remotepilot.adapter.inbound.web.dto.ScheduleListResponse;
import me.remotepilot.domain.service.ScheduleService;
import me.remotepilot.domain.service.SessionGate;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Schedule listing and cancellation.
 */
@RestController
@RequestMapping("/schedules")
@RequiredArgsConstructor
public class ScheduleController {

    private final SessionGate sessionGate;
    private final ScheduleService scheduleService;
    private final SessionHeaderResolver sessionResolver;

    @GetMapping
    public Mono<ResponseEntity<ScheduleListResponse>> list(
            @RequestHeader(value = SessionHeaderResolver.HEADER, required = false) String sessionHeader) {
        String sessionId = sessionResolver.resolve(sessionHeader);
        return Mono.fromFuture(sessionGate.submit(sessionId,
                session -> ScheduleListResponse.of(session.getSchedules())))
                .map(ResponseEntity::ok);
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Map<String, Object>>> delete(
            @RequestHeader(value = SessionHeaderResolver.HEADER, required = false) String sessionHeader,
            @PathVariable String id) {
        String sessionId = sessionResolver.resolve(sessionHeader);
        return Mono.fromFuture(sessionGate.submit(sessionId, session -> {
            scheduleService.cancel(session, id);
            return Map.<String, Object>of("success", true);
        })).map(ResponseEntity::ok);
    }
}
