package me.remotepilot.port.outbound;

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

import me.remotepilot.domain.model.ToolDefinition;
import me.remotepilot.domain.model.ToolResult;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the execution agent that runs automation tools on the remote
 * device. Implementations never complete exceptionally: failures are reported
 * as an empty catalog, a failed {@link ToolResult} or {@code false}.
 */
public interface ExecutionAgentPort {

    /**
     * Fetch the tool catalog. Empty on any failure.
     */
    CompletableFuture<List<ToolDefinition>> listTools();

    /**
     * Invoke a tool. Times out after the configured call timeout.
     */
    CompletableFuture<ToolResult> invoke(String tool, Map<String, Object> args);

    /**
     * Whether the agent answers its health endpoint.
     */
    CompletableFuture<Boolean> health();
}
