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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A structured instruction extracted from the assistant's reply.
 *
 * <p>
 * The completion service embeds directives as fenced blocks tagged
 * {@code action}, {@code schedule} or {@code preference}; each block is parsed
 * into one of the variants below.
 */
public sealed interface Directive permits Directive.Action, Directive.Schedule, Directive.Preference {

    /**
     * Run {@code tool} now.
     */
    record Action(String tool, Map<String, Object> args) implements Directive {
        public Action {
            args = args != null ? Collections.unmodifiableMap(new LinkedHashMap<>(args)) : Map.of();
        }
    }

    /**
     * Run {@code tool} at the time described by {@code when}.
     */
    record Schedule(String when, String tool, Map<String, Object> args, String description) implements Directive {
        public Schedule {
            args = args != null ? Collections.unmodifiableMap(new LinkedHashMap<>(args)) : Map.of();
            if (description == null || description.isBlank()) {
                description = tool;
            }
        }
    }

    /**
     * Remember a user preference.
     */
    record Preference(String key, String value) implements Directive {
    }
}
