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
import lombok.extern.slf4j.Slf4j;
import me.remotepilot.domain.model.HistoryEntry;
import me.remotepilot.domain.model.RealtimeEvent;
import me.remotepilot.domain.model.RealtimeEventType;
import me.remotepilot.domain.model.ScheduleFiredEvent;
import me.remotepilot.domain.model.ScheduleRecord;
import me.remotepilot.domain.model.SessionState;
import me.remotepilot.domain.model.ToolResult;
import me.remotepilot.port.outbound.ExecutionAgentPort;
import me.remotepilot.port.outbound.FanOutPort;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Runs a fired schedule inside its session's actor.
 *
 * <p>
 * The tool result is appended to history as
 * {@code [Scheduled: <description>]} followed by the result or error, one-time
 * records are removed, and a {@code scheduled_result} event goes to every
 * listener of the session. Scheduled work is not rate-limited.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScheduledTaskExecutor {

    private final SessionActorRegistry actorRegistry;
    private final ExecutionAgentPort executionAgent;
    private final ScheduleService scheduleService;
    private final FanOutPort fanOut;
    private final Clock clock;

    @EventListener
    public void onScheduleFired(ScheduleFiredEvent event) {
        log.debug("[Schedule] Trigger fired: {} in session {}", event.scheduleId(), event.sessionId());
        execute(event.sessionId(), event.scheduleId()).whenComplete((result, error) -> {
            if (error != null) {
                log.error("[Schedule] Failed to run {} in session {}", event.scheduleId(), event.sessionId(),
                        error);
            }
        });
    }

    /**
     * Queue the schedule's tool call on the session's actor.
     *
     * @return future completed with the tool result, or with {@code null} when
     *         the schedule no longer exists
     */
    public CompletableFuture<ToolResult> execute(String sessionId, String scheduleId) {
        return actorRegistry.submit(sessionId, session -> run(session, scheduleId));
    }

    private ToolResult run(SessionState session, String scheduleId) {
        Optional<ScheduleRecord> found = session.findSchedule(scheduleId);
        if (found.isEmpty()) {
            log.info("[Schedule] {} no longer registered in session {}, skipping", scheduleId, session.getId());
            scheduleService.release(session.getId(), scheduleId);
            return null;
        }
        ScheduleRecord record = found.get();

        log.info("[Schedule] Running {}: {} ({})", record.getId(), record.getTool(), record.getDescription());
        ToolResult result = executionAgent.invoke(record.getTool(), record.getArgs()).join();

        Instant now = clock.instant();
        session.appendHistory(HistoryEntry.assistant(
                "[Scheduled: " + record.getDescription() + "]\n" + result.summary()), now);
        if (record.getType() == ScheduleRecord.ScheduleType.ONE_TIME) {
            session.removeSchedule(record.getId(), now);
            scheduleService.release(session.getId(), record.getId());
        }

        fanOut.broadcast(session.getId(), RealtimeEvent.of(RealtimeEventType.SCHEDULED_RESULT,
                resultPayload(record, result), now));
        return result;
    }

    private static Map<String, Object> resultPayload(ScheduleRecord record, ToolResult result) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("description", record.getDescription());
        payload.put("tool", record.getTool());
        payload.put("args", record.getArgs());
        payload.put("result", result.summary());
        payload.put("success", result.isSuccess());
        if (result.getImage() != null) {
            payload.put("image", result.getImage());
        }
        return payload;
    }
}
