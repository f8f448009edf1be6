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

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.remotepilot.domain.model.CompletionRequest;
import me.remotepilot.domain.model.HistoryEntry;
import me.remotepilot.domain.model.ToolResult;
import me.remotepilot.infrastructure.config.PilotProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Completion adapter backed by langchain4j chat models.
 *
 * <p>
 * Serves two providers:
 * <ul>
 * <li>anthropic - {@link AnthropicChatModel}, keyed by
 * {@code pilot.llm.anthropic.api-key}</li>
 * <li>openai - {@link OpenAiChatModel}, keyed by
 * {@code pilot.llm.openai.api-key}</li>
 * </ul>
 *
 * <p>
 * Models are created lazily per model name and cached. A request carrying an
 * image uses {@code pilot.llm.vision-model} when one is configured. Retries
 * are disabled: a failed call completes the future exceptionally.
 */
@Component
@Slf4j
public class LangchainCompletionAdapter implements CompletionProviderAdapter {

    static final String PROVIDER_ANTHROPIC = "anthropic";
    static final String PROVIDER_OPENAI = "openai";
    static final String EMPTY_REPLY = "No response";

    private final PilotProperties properties;
    private final Executor ioExecutor;

    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();
    private volatile String provider = PROVIDER_ANTHROPIC;

    public LangchainCompletionAdapter(PilotProperties properties,
            @Qualifier("outboundIoExecutor") Executor ioExecutor) {
        this.properties = properties;
        this.ioExecutor = ioExecutor;
    }

    @Override
    public boolean supports(String provider) {
        return PROVIDER_ANTHROPIC.equals(provider) || PROVIDER_OPENAI.equals(provider);
    }

    @Override
    public void initialize() {
        this.provider = properties.getLlm().getProvider();
        log.info("[LLM] langchain4j adapter initialized: provider={}, model={}", provider,
                properties.getLlm().getModel());
    }

    @Override
    public String getProviderId() {
        return provider;
    }

    @Override
    public CompletableFuture<String> complete(CompletionRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            String modelName = resolveModel(request);
            List<ChatMessage> messages = convertMessages(request);

            try {
                ChatModel chatModel = models.computeIfAbsent(modelName, this::createModel);
                ChatResponse response = chatModel.chat(messages);
                AiMessage aiMessage = response.aiMessage();
                String text = aiMessage != null ? aiMessage.text() : null;
                return text == null || text.isEmpty() ? EMPTY_REPLY : text;
            } catch (Exception e) { // NOSONAR - provider SDKs throw unchecked exceptions of many kinds
                log.error("[LLM] Completion failed: model={}", modelName, e);
                throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
            }
        }, ioExecutor);
    }

    @Override
    public boolean isAvailable() {
        String apiKey = providerConfig().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    private String resolveModel(CompletionRequest request) {
        if (request.getModel() != null && !request.getModel().isBlank()) {
            return request.getModel();
        }
        String visionModel = properties.getLlm().getVisionModel();
        if (request.getImage() != null && visionModel != null && !visionModel.isBlank()) {
            return visionModel;
        }
        return properties.getLlm().getModel();
    }

    private ChatModel createModel(String modelName) {
        PilotProperties.ProviderProperties config = providerConfig();
        if (PROVIDER_OPENAI.equals(provider)) {
            return createOpenAiModel(modelName, config);
        }
        return createAnthropicModel(modelName, config);
    }

    private ChatModel createAnthropicModel(String modelName, PilotProperties.ProviderProperties config) {
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0)
                .maxTokens(properties.getLlm().getMaxTokens())
                .timeout(Duration.ofMillis(properties.getLlm().getTimeoutMs()));

        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        log.debug("[LLM] Created Anthropic model: {}", modelName);
        return builder.build();
    }

    private ChatModel createOpenAiModel(String modelName, PilotProperties.ProviderProperties config) {
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0)
                .maxTokens(properties.getLlm().getMaxTokens())
                .timeout(Duration.ofMillis(properties.getLlm().getTimeoutMs()));

        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        log.debug("[LLM] Created OpenAI model: {}", modelName);
        return builder.build();
    }

    private PilotProperties.ProviderProperties providerConfig() {
        return PROVIDER_OPENAI.equals(provider)
                ? properties.getLlm().getOpenai()
                : properties.getLlm().getAnthropic();
    }

    private List<ChatMessage> convertMessages(CompletionRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        List<HistoryEntry> entries = request.getMessages() != null ? request.getMessages() : List.of();
        int lastUser = lastUserIndex(entries);
        for (int i = 0; i < entries.size(); i++) {
            HistoryEntry entry = entries.get(i);
            String content = entry.getContent() != null ? entry.getContent() : "";
            if (entry.getRole() == HistoryEntry.Role.ASSISTANT) {
                messages.add(AiMessage.from(content));
            } else if (i == lastUser && request.getImage() != null) {
                ToolResult.ToolImage image = request.getImage();
                messages.add(UserMessage.from(
                        TextContent.from(content),
                        ImageContent.from(image.getData(), image.getMimeType())));
            } else {
                messages.add(UserMessage.from(content));
            }
        }
        return messages;
    }

    private static int lastUserIndex(List<HistoryEntry> entries) {
        for (int i = entries.size() - 1; i >= 0; i--) {
            if (entries.get(i).getRole() == HistoryEntry.Role.USER) {
                return i;
            }
        }
        return -1;
    }
}
