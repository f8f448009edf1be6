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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.remotepilot.domain.model.CompletionRequest;
import me.remotepilot.infrastructure.config.PilotProperties;
import me.remotepilot.port.outbound.CompletionPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Selects the completion adapter based on configuration.
 *
 * <p>
 * {@code pilot.llm.provider} picks the active adapter:
 * <ul>
 * <li>anthropic / openai - langchain4j chat models</li>
 * <li>custom - any OpenAI-compatible chat-completions endpoint via Feign</li>
 * <li>none - placeholder replies</li>
 * </ul>
 * Unknown providers fall back to {@code none}.
 *
 * @see LangchainCompletionAdapter
 * @see OpenAiCompatibleCompletionAdapter
 * @see NoOpCompletionAdapter
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class CompletionAdapterFactory implements CompletionPort {

    private static final String PROVIDER_NONE = "none";

    private final PilotProperties properties;
    private final List<CompletionProviderAdapter> adapters;

    private CompletionProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        String provider = properties.getLlm().getProvider();
        activeAdapter = adapters.stream()
                .filter(adapter -> adapter.supports(provider))
                .findFirst()
                .orElse(null);

        if (activeAdapter == null) {
            activeAdapter = adapters.stream()
                    .filter(adapter -> adapter.supports(PROVIDER_NONE))
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No completion adapters registered"));
            log.warn("[LLM] Provider '{}' not found, using: {}", provider, activeAdapter.getProviderId());
        } else {
            activeAdapter.initialize();
            log.info("[LLM] Active provider: {}", provider);
        }
    }

    public CompletionPort getActiveAdapter() {
        return activeAdapter;
    }

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE;
    }

    @Override
    public CompletableFuture<String> complete(CompletionRequest request) {
        return activeAdapter.complete(request);
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}
