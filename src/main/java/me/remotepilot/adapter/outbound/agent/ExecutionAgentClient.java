package me.remotepilot.adapter.outbound.agent;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.remotepilot.domain.model.ToolDefinition;
import me.remotepilot.domain.model.ToolResult;
import me.remotepilot.infrastructure.config.PilotProperties;
import me.remotepilot.port.outbound.ExecutionAgentPort;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Execution agent adapter: talks to the agent's REST API over HTTP.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>GET /tools - tool catalog</li>
 * <li>POST /execute - run one tool</li>
 * <li>GET /health - liveness</li>
 * </ul>
 *
 * <p>
 * Every call carries {@code Authorization: Bearer <pilot.agent.auth-token>}.
 * Tool calls are bounded by {@code pilot.agent.timeout-seconds} and are never
 * retried. Failures never escape: the catalog degrades to empty, a tool call
 * to {@code Timeout} or {@code Bridge unreachable}. Calls block on the
 * {@code outboundIoExecutor} pool.
 *
 * @see me.remotepilot.port.outbound.ExecutionAgentPort
 */
@Component
@Slf4j
public class ExecutionAgentClient implements ExecutionAgentPort {

    static final String ERROR_TIMEOUT = "Timeout";
    static final String ERROR_UNREACHABLE = "Bridge unreachable";

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final PilotProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Executor ioExecutor;

    public ExecutionAgentClient(PilotProperties properties, OkHttpClient baseHttpClient, ObjectMapper objectMapper,
            @Qualifier("outboundIoExecutor") Executor ioExecutor) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.ioExecutor = ioExecutor;

        int timeoutSeconds = properties.getAgent().getTimeoutSeconds();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .retryOnConnectionFailure(false)
                .build();
    }

    @Override
    public CompletableFuture<List<ToolDefinition>> listTools() {
        return CompletableFuture.supplyAsync(() -> {
            try (Response response = httpClient.newCall(
                    authorized(new Request.Builder().url(endpoint("/tools")).get())).execute()) {
                ResponseBody body = response.body();
                if (!response.isSuccessful() || body == null) {
                    log.warn("[Agent] Tool catalog failed: HTTP {}", response.code());
                    return List.<ToolDefinition>of();
                }
                ToolsResponse parsed = objectMapper.readValue(body.string(), ToolsResponse.class);
                if (parsed == null || parsed.tools() == null) {
                    log.warn("[Agent] Tool catalog response has no tools");
                    return List.<ToolDefinition>of();
                }
                return parsed.tools().stream().filter(Objects::nonNull).toList();
            } catch (IOException | RuntimeException e) {
                log.warn("[Agent] Tool catalog error: {}", e.getMessage());
                return List.<ToolDefinition>of();
            }
        }, ioExecutor);
    }

    @Override
    public CompletableFuture<ToolResult> invoke(String tool, Map<String, Object> args) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                String payload = objectMapper.writeValueAsString(
                        new ExecuteRequest(tool, args != null ? args : Map.of()));
                Request request = authorized(new Request.Builder()
                        .url(endpoint("/execute"))
                        .post(RequestBody.create(payload, JSON)));

                try (Response response = httpClient.newCall(request).execute()) {
                    ResponseBody body = response.body();
                    if (body == null) {
                        log.warn("[Agent] {} returned no body: HTTP {}", tool, response.code());
                        return ToolResult.failure(ERROR_UNREACHABLE);
                    }
                    ToolResult result = objectMapper.readValue(body.string(), ToolResult.class);
                    if (result == null) {
                        log.warn("[Agent] {} returned an empty result: HTTP {}", tool, response.code());
                        return ToolResult.failure(ERROR_UNREACHABLE);
                    }
                    log.info("[Agent] {} -> success={}", tool, result.isSuccess());
                    return result;
                }
            } catch (InterruptedIOException e) {
                log.warn("[Agent] {} timed out: {}", tool, e.getMessage());
                return ToolResult.failure(ERROR_TIMEOUT);
            } catch (IOException | RuntimeException e) {
                log.warn("[Agent] {} failed: {}", tool, e.getMessage());
                return ToolResult.failure(ERROR_UNREACHABLE);
            }
        }, ioExecutor);
    }

    @Override
    public CompletableFuture<Boolean> health() {
        return CompletableFuture.supplyAsync(() -> {
            try (Response response = httpClient.newCall(
                    authorized(new Request.Builder().url(endpoint("/health")).get())).execute()) {
                return response.isSuccessful();
            } catch (IOException | RuntimeException e) {
                log.debug("[Agent] Health check failed: {}", e.getMessage());
                return false;
            }
        }, ioExecutor);
    }

    private String endpoint(String path) {
        String base = properties.getAgent().getUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    private Request authorized(Request.Builder builder) {
        String token = properties.getAgent().getAuthToken();
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder.build();
    }

    // Request/response DTOs
    record ExecuteRequest(String tool, Map<String, Object> args) {
    }

    record ToolsResponse(List<ToolDefinition> tools) {
    }
}
