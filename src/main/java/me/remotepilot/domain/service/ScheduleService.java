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

import lombok.extern.slf4j.Slf4j;
import me.remotepilot.domain.model.Directive;
import me.remotepilot.domain.model.ScheduleFiredEvent;
import me.remotepilot.domain.model.ScheduleRecord;
import me.remotepilot.domain.model.ScheduleWhen;
import me.remotepilot.domain.model.SessionState;
import me.remotepilot.infrastructure.event.SpringEventBus;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Registers schedules on a session and arms their triggers.
 *
 * <p>
 * One-time schedules use an {@link Instant} trigger, recurring ones a
 * {@link CronTrigger} built from the 5-field expression with a leading seconds
 * field. A trigger only publishes a {@link ScheduleFiredEvent}; the work runs
 * in the session's actor, see {@link ScheduledTaskExecutor}.
 *
 * <p>
 * Triggers are re-armed from persisted sessions once the application is
 * ready. One-time schedules whose instant already passed fire immediately, so
 * a schedule may run twice across a crash.
 */
@Service
@Slf4j
public class ScheduleService {

    private static final String ID_PREFIX = "sched-";
    private static final Duration INVALID_CRON_DELAY = Duration.ofSeconds(60);

    private final TemporalExpressionParser temporalParser;
    private final TaskScheduler taskScheduler;
    private final SpringEventBus eventBus;
    private final SessionService sessionService;
    private final SessionActorRegistry actorRegistry;
    private final Clock clock;

    private final Map<String, ScheduledFuture<?>> triggers = new ConcurrentHashMap<>();

    public ScheduleService(TemporalExpressionParser temporalParser, TaskScheduler taskScheduler,
            SpringEventBus eventBus, SessionService sessionService, SessionActorRegistry actorRegistry,
            Clock clock) {
        this.temporalParser = temporalParser;
        this.taskScheduler = taskScheduler;
        this.eventBus = eventBus;
        this.sessionService = sessionService;
        this.actorRegistry = actorRegistry;
        this.clock = clock;
    }

    /**
     * Register {@code directive} on the session and arm its trigger.
     */
    public ScheduleRecord schedule(SessionState session, Directive.Schedule directive) {
        Instant now = clock.instant();
        ScheduleWhen when = temporalParser.parse(directive.when(), now);
        if (when.isRecurring() && !CronExpression.isValidExpression(springCron(when.cron()))) {
            log.warn("[Schedule] Invalid cron '{}', running once in {}s", when.cron(),
                    INVALID_CRON_DELAY.toSeconds());
            when = ScheduleWhen.at(now.plus(INVALID_CRON_DELAY));
        }

        ScheduleRecord record = ScheduleRecord.builder()
                .id(newId())
                .at(when.at())
                .cron(when.cron())
                .tool(directive.tool())
                .args(directive.args())
                .description(directive.description())
                .createdAt(now)
                .type(when.isRecurring() ? ScheduleRecord.ScheduleType.RECURRING
                        : ScheduleRecord.ScheduleType.ONE_TIME)
                .build();

        session.registerSchedule(record, now);
        arm(session.getId(), record);
        log.info("[Schedule] Registered {} ({}, {}) in session {}: {}", record.getId(), record.getType().value(),
                when.describe(), session.getId(), record.getDescription());
        return record;
    }

    /**
     * Cancel the trigger and drop the registry entry. Unknown ids are a no-op.
     *
     * @return whether a registry entry was removed
     */
    public boolean cancel(SessionState session, String scheduleId) {
        disarm(session.getId(), scheduleId);
        Optional<ScheduleRecord> removed = session.removeSchedule(scheduleId, clock.instant());
        removed.ifPresent(record -> log.info("[Schedule] Cancelled {} in session {}", scheduleId, session.getId()));
        return removed.isPresent();
    }

    public void cancelAll(SessionState session) {
        for (ScheduleRecord record : List.copyOf(session.getSchedules())) {
            cancel(session, record.getId());
        }
    }

    /**
     * Forget the trigger of a one-time schedule that has fired.
     */
    public void release(String sessionId, String scheduleId) {
        triggers.remove(key(sessionId, scheduleId));
    }

    /**
     * Number of triggers currently armed across all sessions.
     */
    public int armedCount() {
        return triggers.size();
    }

    public boolean isArmed(String sessionId, String scheduleId) {
        return triggers.containsKey(key(sessionId, scheduleId));
    }

    @EventListener(ApplicationReadyEvent.class)
    public void rearmPersistedSchedules() {
        List<SessionState> sessions = sessionService.loadAll();
        for (SessionState session : sessions) {
            if (session.getSchedules().isEmpty()) {
                continue;
            }
            actorRegistry.submit(session.getId(), state -> {
                state.getSchedules().forEach(record -> arm(state.getId(), record));
                log.info("[Schedule] Re-armed {} schedule(s) in session {}", state.getSchedules().size(),
                        state.getId());
                return null;
            });
        }
    }

    private void arm(String sessionId, ScheduleRecord record) {
        Runnable fire = () -> eventBus.publish(new ScheduleFiredEvent(sessionId, record.getId()));
        ScheduledFuture<?> future;
        if (record.getCron() != null) {
            future = taskScheduler.schedule(fire, new CronTrigger(springCron(record.getCron()),
                    temporalParser.getZone()));
        } else {
            future = taskScheduler.schedule(fire, record.getAt());
        }
        if (future == null) {
            log.warn("[Schedule] Trigger for {} will never fire", record.getId());
            return;
        }
        ScheduledFuture<?> previous = triggers.put(key(sessionId, record.getId()), future);
        if (previous != null) {
            previous.cancel(false);
        }
    }

    private void disarm(String sessionId, String scheduleId) {
        ScheduledFuture<?> future = triggers.remove(key(sessionId, scheduleId));
        if (future != null) {
            future.cancel(false);
        }
    }

    private static String springCron(String fiveFieldCron) {
        return "0 " + fiveFieldCron;
    }

    private static String key(String sessionId, String scheduleId) {
        return sessionId + "/" + scheduleId;
    }

    private static String newId() {
        return ID_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
