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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An action held back until the user replies.
 *
 * <p>
 * While {@link PendingState#CONFIRMATION} the action is complete and waits for
 * yes/no. While {@link PendingState#CLARIFICATION} the argument named by
 * {@link #missingField} is still empty and the next message fills it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PendingAction {

    private String tool;

    @Builder.Default
    private Map<String, Object> args = new LinkedHashMap<>();

    /** Human-readable context shown in the prompt, e.g. the contact found. */
    private String context;

    private String originalRequest;

    @Builder.Default
    private PendingState awaiting = PendingState.CONFIRMATION;

    private String missingField;

    @JsonIgnore
    public boolean isAwaitingClarification() {
        return awaiting == PendingState.CLARIFICATION;
    }

    /**
     * Returns a copy with the missing field filled in, awaiting confirmation.
     */
    public PendingAction withClarification(String value) {
        Map<String, Object> filled = new LinkedHashMap<>(args != null ? args : Map.of());
        if (missingField != null) {
            filled.put(missingField, value);
        }
        return toBuilder()
                .args(filled)
                .awaiting(PendingState.CONFIRMATION)
                .missingField(null)
                .build();
    }
}
