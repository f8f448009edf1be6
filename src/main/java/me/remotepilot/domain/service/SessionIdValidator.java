package me.remotepilot.domain.service;

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

import java.util.regex.Pattern;

/**
 * Session id validation helpers.
 *
 * <p>
 * Contract: {@code ^[a-zA-Z0-9._-]{1,64}$}, dots allowed but never a bare
 * {@code .} or {@code ..} since ids become file names.
 */
public final class SessionIdValidator {

    private static final Pattern SESSION_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9._-]{1,64}$");

    private SessionIdValidator() {
    }

    public static boolean isValid(String value) {
        String normalized = normalize(value);
        return normalized != null
                && SESSION_ID_PATTERN.matcher(normalized).matches()
                && !".".equals(normalized)
                && !"..".equals(normalized);
    }

    /**
     * Returns the trimmed id, or {@code defaultId} when {@code value} is blank.
     *
     * @throws IllegalArgumentException
     *             if the id does not match the contract
     */
    public static String normalizeOrDefault(String value, String defaultId) {
        String normalized = normalize(value);
        if (normalized == null) {
            return defaultId;
        }
        if (!isValid(normalized)) {
            throw new IllegalArgumentException("session id must match ^[a-zA-Z0-9._-]{1,64}$");
        }
        return normalized;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String candidate = value.trim();
        return candidate.isEmpty() ? null : candidate;
    }
}
