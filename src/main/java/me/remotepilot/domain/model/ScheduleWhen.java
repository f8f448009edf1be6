package me.remotepilot.domain.model;

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

import java.time.Instant;

/**
 * Parsed schedule time: exactly one of a concrete instant or a 5-field cron
 * expression (minute hour day-of-month month day-of-week).
 */
public record ScheduleWhen(Instant at, String cron) {

    public ScheduleWhen {
        if ((at == null) == (cron == null)) {
            throw new IllegalArgumentException("Exactly one of at/cron must be set");
        }
    }

    public static ScheduleWhen at(Instant instant) {
        return new ScheduleWhen(instant, null);
    }

    public static ScheduleWhen cron(String expression) {
        return new ScheduleWhen(null, expression);
    }

    public boolean isRecurring() {
        return cron != null;
    }

    /**
     * The cron expression, or the ISO-8601 instant for one-time schedules.
     */
    public String describe() {
        return isRecurring() ? cron : at.toString();
    }
}
