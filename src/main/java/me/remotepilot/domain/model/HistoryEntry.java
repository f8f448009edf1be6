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
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

/**
 * A single turn of the conversation kept in session history and replayed to
 * the completion service as context.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryEntry {

    private Role role;
    private String content;

    public static HistoryEntry user(String content) {
        return new HistoryEntry(Role.USER, content);
    }

    public static HistoryEntry assistant(String content) {
        return new HistoryEntry(Role.ASSISTANT, content);
    }

    /**
     * Conversation role, serialized as {@code user} / {@code assistant}.
     */
    public enum Role {
        USER, ASSISTANT;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Role fromValue(String value) {
            return Role.valueOf(value.toUpperCase(Locale.ROOT));
        }
    }
}
