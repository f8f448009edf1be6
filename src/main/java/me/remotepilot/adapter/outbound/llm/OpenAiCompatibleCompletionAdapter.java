package me.remotepilot.adapter.outbound.llm;

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
import com.fasterxml.jackson.annotation.JsonProperty;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.remotepilot.domain.model.CompletionRequest;
import me.remotepilot.domain.model.HistoryEntry;
import me.remotepilot.domain.model.ToolResult;
import me.remotepilot.infrastructure.config.PilotProperties;
import me.remotepilot.infrastructure.http.FeignClientFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Completion adapter for OpenAI-compatible chat-completions APIs using Feign +
 * OkHttp.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code pilot.llm.custom.base-url} - base URL of the API</li>
 * <li>{@code pilot.llm.custom.api-key} - bearer key</li>
 * </ul>
 *
 * <p>
 * Provider ID: {@code "custom"}
 *
 * @see me.remotepilot.infrastructure.http.FeignClientFactory
 */
@Component
@Slf4j
public class OpenAiCompatibleCompletionAdapter implements CompletionProviderAdapter {

    private final PilotProperties properties;
    private final FeignClientFactory feignClientFactory;
    private final Executor ioExecutor;

    private ChatCompletionsApi client;
    private volatile boolean initialized = false;

    public OpenAiCompatibleCompletionAdapter(PilotProperties properties, FeignClientFactory feignClientFactory,
            @Qualifier("outboundIoExecutor") Executor ioExecutor) {
        this.properties = properties;
        this.feignClientFactory = feignClientFactory;
        this.ioExecutor = ioExecutor;
    }

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        String baseUrl = properties.getLlm().getCustom().getBaseUrl();
        if (baseUrl != null && !baseUrl.isBlank()) {
            this.client = feignClientFactory.create(ChatCompletionsApi.class, baseUrl,
                    properties.getLlm().getTimeoutMs());
            initialized = true;
            log.info("[LLM] Custom completion adapter initialized with URL: {}", baseUrl);
        } else {
            log.warn("[LLM] pilot.llm.custom.base-url is not set");
        }
    }

    @Override
    public String getProviderId() {
        return "custom";
    }

    @Override
    public CompletableFuture<String> complete(CompletionRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            if (!initialized) {
                initialize();
            }
            if (client == null) {
                throw new IllegalStateException("Custom completion adapter not available");
            }
            try {
                ChatCompletionResponse response = client.chatCompletion(
                        properties.getLlm().getCustom().getApiKey(), buildRequest(request));
                String text = extractText(response);
                return text == null || text.isEmpty() ? LangchainCompletionAdapter.EMPTY_REPLY : text;
            } catch (Exception e) { // NOSONAR - Feign wraps transport and decode failures
                log.error("[LLM] Custom completion failed", e);
                throw new IllegalStateException("Custom LLM chat failed: " + e.getMessage(), e);
            }
        }, ioExecutor);
    }

    @Override
    public boolean isAvailable() {
        PilotProperties.ProviderProperties custom = properties.getLlm().getCustom();
        return custom.getBaseUrl() != null && !custom.getBaseUrl().isBlank()
                && custom.getApiKey() != null && !custom.getApiKey().isBlank();
    }

    ChatCompletionRequest buildRequest(CompletionRequest request) {
        ChatCompletionRequest apiRequest = new ChatCompletionRequest();
        apiRequest.setModel(request.getModel() != null && !request.getModel().isBlank()
                ? request.getModel()
                : properties.getLlm().getModel());
        apiRequest.setMaxTokens(properties.getLlm().getMaxTokens());

        List<ApiMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(new ApiMessage("system", request.getSystemPrompt()));
        }

        List<HistoryEntry> entries = request.getMessages() != null ? request.getMessages() : List.of();
        for (int i = 0; i < entries.size(); i++) {
            HistoryEntry entry = entries.get(i);
            boolean last = i == entries.size() - 1;
            if (last && entry.getRole() == HistoryEntry.Role.USER && request.getImage() != null) {
                messages.add(new ApiMessage("user", withImage(entry.getContent(), request.getImage())));
            } else {
                messages.add(new ApiMessage(entry.getRole() == HistoryEntry.Role.USER ? "user" : "assistant",
                        entry.getContent()));
            }
        }
        apiRequest.setMessages(messages);
        return apiRequest;
    }

    private static List<Map<String, Object>> withImage(String text, ToolResult.ToolImage image) {
        String dataUrl = "data:" + image.getMimeType() + ";base64," + image.getData();
        return List.of(
                Map.of("type", "text", "text", text != null ? text : ""),
                Map.of("type", "image_url", "image_url", Map.of("url", dataUrl)));
    }

    private static String extractText(ChatCompletionResponse response) {
        if (response == null || response.getChoices() == null || response.getChoices().isEmpty()) {
            return null;
        }
        ApiMessage message = response.getChoices().get(0).getMessage();
        if (message == null || message.getContent() == null) {
            return null;
        }
        return message.getContent().toString();
    }

    // Feign API interface
    public interface ChatCompletionsApi {
        @RequestLine("POST /chat/completions")
        @Headers({
                "Content-Type: application/json",
                "Authorization: Bearer {apiKey}"
        })
        ChatCompletionResponse chatCompletion(@Param("apiKey") String apiKey, ChatCompletionRequest request);
    }

    // API DTOs
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChatCompletionRequest {
        private String model;
        private List<ApiMessage> messages;
        @JsonProperty("max_tokens")
        private Integer maxTokens;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ApiMessage {
        private String role;
        // Plain text, or a list of content parts when an image is attached
        private Object content;
    }

    @Data
    public static class ChatCompletionResponse {
        private List<ChatChoice> choices;
    }

    @Data
    public static class ChatChoice {
        private ApiMessage message;
        @JsonProperty("finish_reason")
        private String finishReason;
    }
}
