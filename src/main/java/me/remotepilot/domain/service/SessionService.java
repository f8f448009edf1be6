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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.remotepilot.domain.model.SessionState;
import me.remotepilot.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads, caches and persists {@link SessionState}.
 *
 * <p>
 * Sessions are created lazily on first access and never destroyed. Each is
 * stored as {@code sessions/<id>.json} with an atomic write. The in-memory
 * copy is authoritative for the running process: a failed write is logged and
 * retried on the next save.
 *
 * <p>
 * Callers must only touch a session from inside its actor, see
 * {@link SessionActorRegistry}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionService {

    private static final String SESSIONS_DIR = "sessions";
    private static final String JSON_EXTENSION = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, SessionState> sessionCache = new ConcurrentHashMap<>();

    public SessionState getOrCreate(String sessionId) {
        return sessionCache.computeIfAbsent(sessionId, id -> {
            Optional<SessionState> existing = load(id);
            if (existing.isPresent()) {
                log.debug("Loaded existing session: {}", id);
                return existing.get();
            }
            log.info("Created new session: {}", id);
            return SessionState.create(id, clock.instant());
        });
    }

    public void save(SessionState session) {
        sessionCache.put(session.getId(), session);
        try {
            String json = objectMapper.writeValueAsString(session);
            storagePort.putTextAtomic(SESSIONS_DIR, session.getId() + JSON_EXTENSION, json, false).join();
            log.debug("Saved session: {}", session.getId());
        } catch (Exception e) { // NOSONAR - in-memory state stays authoritative
            log.error("[Storage] Failed to save session: {}", session.getId(), e);
        }
    }

    /**
     * Load every persisted session into the cache. Used on startup to re-arm
     * schedules.
     */
    public List<SessionState> loadAll() {
        try {
            List<String> files = storagePort.listObjects(SESSIONS_DIR, "").join();
            for (String file : files) {
                if (!file.endsWith(JSON_EXTENSION) || file.contains("/") || file.contains("\\")) {
                    continue;
                }
                String id = file.substring(0, file.length() - JSON_EXTENSION.length());
                if (SessionIdValidator.isValid(id)) {
                    getOrCreate(id);
                }
            }
        } catch (Exception e) { // NOSONAR
            log.warn("[Storage] Failed to scan sessions directory: {}", e.getMessage());
        }
        return new ArrayList<>(sessionCache.values());
    }

    private Optional<SessionState> load(String sessionId) {
        try {
            String json = storagePort.getText(SESSIONS_DIR, sessionId + JSON_EXTENSION).join();
            if (json == null || json.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, SessionState.class));
        } catch (Exception e) { // NOSONAR - corrupt file falls back to a fresh session
            log.warn("[Storage] Failed to load session {}: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }
}
