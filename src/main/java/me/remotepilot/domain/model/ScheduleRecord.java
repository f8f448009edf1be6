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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * A registered scheduled tool call. Records are persisted inside the owning
 * {@link SessionState} and re-armed on startup.
 *
 * <p>
 * Exactly one of {@code at} (one-time) or {@code cron} (recurring) is set.
 * Records never change after creation.
 */
@Value
@Builder
@Jacksonized
public class ScheduleRecord {

    String id;
    Instant at;
    String cron;
    String tool;
    Map<String, Object> args;
    String description;
    Instant createdAt;
    ScheduleType type;

    @JsonIgnore
    public ScheduleWhen getWhen() {
        return cron != null ? ScheduleWhen.cron(cron) : ScheduleWhen.at(at);
    }

    /**
     * Schedule kind, serialized as {@code one-time} / {@code recurring}.
     */
    public enum ScheduleType {
        ONE_TIME("one-time"), RECURRING("recurring");

        private final String value;

        ScheduleType(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }

        @JsonCreator
        public static ScheduleType fromValue(String value) {
            for (ScheduleType type : values()) {
                if (type.value.equals(value) || type.name().equals(value)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown schedule type: " + value);
        }
    }
}
