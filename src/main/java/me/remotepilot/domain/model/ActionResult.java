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

import java.util.Map;

/**
 * A tool call made while answering a chat message, as reported to the client.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActionResult {

    private String tool;
    private Map<String, Object> args;
    private String result;
    private boolean success;
    private ToolResult.ToolImage image;

    public static ActionResult of(String tool, Map<String, Object> args, ToolResult toolResult) {
        return ActionResult.builder()
                .tool(tool)
                .args(args)
                .result(toolResult.summary())
                .success(toolResult.isSuccess())
                .image(toolResult.getImage())
                .build();
    }
}
