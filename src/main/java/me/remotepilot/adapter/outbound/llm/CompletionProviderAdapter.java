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

import me.remotepilot.port.outbound.CompletionPort;

/**
 * Interface for completion provider adapters.
 *
 * <p>
 * All provider adapters implement this interface to be managed by
 * {@link CompletionAdapterFactory}, which picks one per
 * {@code pilot.llm.provider}.
 *
 * @see CompletionAdapterFactory
 */
public interface CompletionProviderAdapter extends CompletionPort {

    /**
     * Whether this adapter serves the configured provider name. Defaults to an
     * exact match on {@link #getProviderId()}.
     */
    default boolean supports(String provider) {
        return getProviderId().equals(provider);
    }

    /**
     * Initialize the adapter. Called when adapter is selected.
     */
    default void initialize() {
        // Default no-op
    }
}
