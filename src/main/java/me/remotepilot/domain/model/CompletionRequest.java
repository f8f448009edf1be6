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

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * A request to the completion service.
 *
 * <p>
 * {@code messages} are the conversation turns in order, the last being the
 * user's. When {@code image} is set, providers attach it to the last user
 * message. {@code model} overrides the configured default when present.
 */
@Data
@Builder
public class CompletionRequest {

    private String systemPrompt;
    private List<HistoryEntry> messages;
    private String model;
    private ToolResult.ToolImage image;
}
