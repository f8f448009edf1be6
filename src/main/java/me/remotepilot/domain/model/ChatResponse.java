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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Reply to a chat message. {@code action} repeats the first entry of
 * {@code actions} for clients that only render one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatResponse {

    private String message;
    private ActionResult action;
    private List<ActionResult> actions;
    private ScheduledSummary scheduled;
    private Boolean error;

    public static ChatResponse text(String message) {
        return ChatResponse.builder().message(message).build();
    }

    /**
     * Short description of a schedule registered while handling the message.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ScheduledSummary {
        private String id;
        private String when;
        private String description;
    }
}
