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

/**
 * Outcome of a tool invocation on the execution agent. Either {@code result}
 * or {@code error} is set; screenshot-style tools may attach an image.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String result;
    private String error;
    private ToolImage image;

    public static ToolResult success(String result) {
        return ToolResult.builder()
                .success(true)
                .result(result)
                .build();
    }

    public static ToolResult failure(String error) {
        return ToolResult.builder()
                .success(false)
                .error(error)
                .build();
    }

    /**
     * The text to show or record: result on success, error otherwise.
     */
    public String summary() {
        if (success) {
            return result != null ? result : "";
        }
        return error != null ? error : "Unknown error";
    }

    /**
     * Base64 image payload returned by a tool.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolImage {
        private String data;
        private String mimeType;
    }
}
