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

import me.remotepilot.domain.model.CompletionRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Port for the completion service (Anthropic, OpenAI-compatible endpoints).
 * Returns the assistant's raw text; the future completes exceptionally when the
 * service cannot be reached or rejects the request.
 */
public interface CompletionPort {

    /**
     * Returns the provider identifier (e.g., "anthropic", "openai").
     */
    String getProviderId();

    CompletableFuture<String> complete(CompletionRequest request);

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();
}
