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

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable state of one user session.
 *
 * <p>
 * The state is mutated only through the transition methods below, always from
 * inside the session's actor, so none of them synchronize. Collections are
 * exposed as read-only views. Jackson reads and writes the fields directly;
 * the whole object is persisted as one JSON document per session.
 *
 * <p>
 * Invariants:
 * <ul>
 * <li>history holds at most {@link #MAX_HISTORY} entries, oldest evicted
 * first</li>
 * <li>at most one pending action</li>
 * <li>schedule ids are unique</li>
 * </ul>
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY, getterVisibility = JsonAutoDetect.Visibility.NONE, isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class SessionState {

    public static final int MAX_HISTORY = 50;

    private String id;
    private List<HistoryEntry> history = new ArrayList<>();
    private Map<String, String> preferences = new LinkedHashMap<>();
    private PendingAction pendingAction;
    private RateLimitWindow rateLimit;
    private List<ScheduleRecord> schedules = new ArrayList<>();
    private Instant lastActive;

    SessionState() {
        // for Jackson
    }

    private SessionState(String id, Instant now) {
        this.id = id;
        this.lastActive = now;
    }

    public static SessionState create(String id, Instant now) {
        return new SessionState(id, now);
    }

    // ===== Read access =====

    public String getId() {
        return id;
    }

    public List<HistoryEntry> getHistory() {
        return Collections.unmodifiableList(history);
    }

    /**
     * The most recent {@code limit} history entries, oldest first.
     */
    public List<HistoryEntry> recentHistory(int limit) {
        int from = Math.max(0, history.size() - limit);
        return List.copyOf(history.subList(from, history.size()));
    }

    public Map<String, String> getPreferences() {
        return Collections.unmodifiableMap(preferences);
    }

    public Optional<PendingAction> getPendingAction() {
        return Optional.ofNullable(pendingAction);
    }

    public RateLimitWindow getRateLimit() {
        return rateLimit;
    }

    public List<ScheduleRecord> getSchedules() {
        return Collections.unmodifiableList(schedules);
    }

    public Optional<ScheduleRecord> findSchedule(String scheduleId) {
        return schedules.stream()
                .filter(record -> record.getId().equals(scheduleId))
                .findFirst();
    }

    public Instant getLastActive() {
        return lastActive;
    }

    @JsonIgnore
    public boolean hasPendingAction() {
        return pendingAction != null;
    }

    // ===== Transitions =====

    public void appendHistory(HistoryEntry entry, Instant now) {
        history.add(entry);
        while (history.size() > MAX_HISTORY) {
            history.remove(0);
        }
        touch(now);
    }

    public void putPreference(String key, String value, Instant now) {
        preferences.put(key, value);
        touch(now);
    }

    /**
     * Holds an action for the user's reply. Replaces any action already held.
     */
    public void holdPendingAction(PendingAction action, Instant now) {
        this.pendingAction = action;
        touch(now);
    }

    public Optional<PendingAction> clearPendingAction(Instant now) {
        PendingAction previous = pendingAction;
        this.pendingAction = null;
        touch(now);
        return Optional.ofNullable(previous);
    }

    public void registerSchedule(ScheduleRecord record, Instant now) {
        if (findSchedule(record.getId()).isPresent()) {
            throw new IllegalStateException("Duplicate schedule id: " + record.getId());
        }
        schedules.add(record);
        touch(now);
    }

    public Optional<ScheduleRecord> removeSchedule(String scheduleId, Instant now) {
        Optional<ScheduleRecord> removed = findSchedule(scheduleId);
        removed.ifPresent(record -> {
            schedules.remove(record);
            touch(now);
        });
        return removed;
    }

    public void applyRateLimit(RateLimitWindow window) {
        this.rateLimit = window;
    }

    /**
     * Clears history, pending action, rate window and schedules. Preferences
     * survive.
     */
    public void reset(Instant now) {
        history.clear();
        pendingAction = null;
        rateLimit = null;
        schedules.clear();
        touch(now);
    }

    public void clearHistory(Instant now) {
        history.clear();
        touch(now);
    }

    public void touch(Instant now) {
        this.lastActive = now;
    }
}
