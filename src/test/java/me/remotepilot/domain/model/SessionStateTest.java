package me.remotepilot.domain.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionStateTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    private SessionState session;

    @BeforeEach
    void setUp() {
        session = SessionState.create("main", NOW);
    }

    @Test
    void shouldCapHistoryDroppingOldestEntries() {
        for (int i = 0; i < 60; i++) {
            session.appendHistory(HistoryEntry.user("m" + i), NOW);
        }

        assertEquals(SessionState.MAX_HISTORY, session.getHistory().size());
        assertEquals("m10", session.getHistory().get(0).getContent());
        assertEquals("m59", session.getHistory().get(49).getContent());
    }

    @Test
    void shouldReturnMostRecentHistory() {
        session.appendHistory(HistoryEntry.user("a"), NOW);
        session.appendHistory(HistoryEntry.assistant("b"), NOW);
        session.appendHistory(HistoryEntry.user("c"), NOW);

        assertEquals(2, session.recentHistory(2).size());
        assertEquals("b", session.recentHistory(2).get(0).getContent());
        assertEquals(3, session.recentHistory(10).size());
    }

    @Test
    void shouldKeepPreferencesOnReset() {
        session.appendHistory(HistoryEntry.user("hi"), NOW);
        session.putPreference("music", "jazz", NOW);
        session.holdPendingAction(PendingAction.builder().tool("sleep_mac").build(), NOW);
        session.applyRateLimit(new RateLimitWindow(3, NOW.plusSeconds(60)));
        session.registerSchedule(record("sched-1"), NOW);

        Instant later = NOW.plusSeconds(5);
        session.reset(later);

        assertTrue(session.getHistory().isEmpty());
        assertFalse(session.hasPendingAction());
        assertNull(session.getRateLimit());
        assertTrue(session.getSchedules().isEmpty());
        assertEquals(Map.of("music", "jazz"), session.getPreferences());
        assertEquals(later, session.getLastActive());
    }

    @Test
    void shouldBeIdempotentOnRepeatedReset() {
        session.putPreference("name", "Sam", NOW);
        session.reset(NOW);
        session.reset(NOW);

        assertEquals(Map.of("name", "Sam"), session.getPreferences());
        assertTrue(session.getHistory().isEmpty());
    }

    @Test
    void shouldRejectDuplicateScheduleId() {
        session.registerSchedule(record("sched-1"), NOW);

        assertThrows(IllegalStateException.class, () -> session.registerSchedule(record("sched-1"), NOW));
    }

    @Test
    void shouldRemoveScheduleById() {
        session.registerSchedule(record("sched-1"), NOW);

        assertTrue(session.removeSchedule("sched-1", NOW).isPresent());
        assertTrue(session.removeSchedule("sched-1", NOW).isEmpty());
    }

    @Test
    void shouldRoundTripThroughJson() throws Exception {
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        session.appendHistory(HistoryEntry.user("hi"), NOW);
        session.putPreference("music", "jazz", NOW);
        session.registerSchedule(record("sched-1"), NOW);

        String json = mapper.writeValueAsString(session);
        SessionState restored = mapper.readValue(json, SessionState.class);

        assertTrue(json.contains("\"role\":\"user\""));
        assertTrue(json.contains("\"type\":\"one-time\""));
        assertEquals("main", restored.getId());
        assertEquals("hi", restored.getHistory().get(0).getContent());
        assertEquals("jazz", restored.getPreferences().get("music"));
        assertEquals(NOW.plusSeconds(60), restored.findSchedule("sched-1").orElseThrow().getAt());
    }

    private static ScheduleRecord record(String id) {
        return ScheduleRecord.builder()
                .id(id)
                .at(NOW.plusSeconds(60))
                .tool("battery_status")
                .args(Map.of())
                .description("battery")
                .createdAt(NOW)
                .type(ScheduleRecord.ScheduleType.ONE_TIME)
                .build();
    }
}
