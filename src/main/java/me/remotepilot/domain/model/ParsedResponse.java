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

import java.util.List;
import java.util.Optional;

/**
 * Assistant reply split into display text and the directives it carried.
 *
 * @param text
 *            reply with directive blocks removed, never blank
 * @param directives
 *            directives in the order they appeared
 */
public record ParsedResponse(String text, List<Directive> directives) {

    public ParsedResponse {
        directives = directives != null ? List.copyOf(directives) : List.of();
    }

    public List<Directive.Action> actions() {
        return directives.stream()
                .filter(Directive.Action.class::isInstance)
                .map(Directive.Action.class::cast)
                .toList();
    }

    public Optional<Directive.Schedule> schedule() {
        return directives.stream()
                .filter(Directive.Schedule.class::isInstance)
                .map(Directive.Schedule.class::cast)
                .findFirst();
    }

    public Optional<Directive.Preference> preference() {
        return directives.stream()
                .filter(Directive.Preference.class::isInstance)
                .map(Directive.Preference.class::cast)
                .findFirst();
    }
}
