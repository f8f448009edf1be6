package me.remotepilot.domain.service;

import me.remotepilot.domain.model.PendingAction;
import me.remotepilot.domain.model.PendingState;
import me.remotepilot.domain.model.SessionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PendingActionStateMachineTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    private PendingActionStateMachine stateMachine;
    private SessionState session;

    @BeforeEach
    void setUp() {
        stateMachine = new PendingActionStateMachine();
        session = SessionState.create("main", NOW);
    }

    @ParameterizedTest
    @ValueSource(strings = { "yes", "Yes!", "yeah", "ok.", "send it", "go ahead", "Y", " sure " })
    void shouldRecognizeConfirmations(String message) {
        assertTrue(PendingActionStateMachine.isConfirmation(message));
        assertFalse(PendingActionStateMachine.isCancellation(message));
    }

    @ParameterizedTest
    @ValueSource(strings = { "no", "Nope", "cancel", "never mind", "abort!", "n" })
    void shouldRecognizeCancellations(String message) {
        assertTrue(PendingActionStateMachine.isCancellation(message));
        assertFalse(PendingActionStateMachine.isConfirmation(message));
    }

    @Test
    void shouldNotTreatSentencesAsConfirmation() {
        assertFalse(PendingActionStateMachine.isConfirmation("yes but change the text"));
        assertFalse(PendingActionStateMachine.isConfirmation(null));
    }

    @Test
    void shouldStayIdleWithoutPendingAction() {
        PendingActionStateMachine.Transition transition = stateMachine.onMessage(session, "yes", NOW);

        assertEquals(PendingActionStateMachine.Kind.IDLE, transition.kind());
        assertNull(transition.action());
    }

    @Test
    void shouldConfirmAndClearPendingAction() {
        PendingAction action = confirmation();
        stateMachine.hold(session, action, NOW);

        PendingActionStateMachine.Transition transition = stateMachine.onMessage(session, "yes", NOW);

        assertEquals(PendingActionStateMachine.Kind.CONFIRMED, transition.kind());
        assertSame(action, transition.action());
        assertFalse(session.hasPendingAction());
    }

    @Test
    void shouldCancelAndClearPendingAction() {
        stateMachine.hold(session, confirmation(), NOW);

        PendingActionStateMachine.Transition transition = stateMachine.onMessage(session, "no", NOW);

        assertEquals(PendingActionStateMachine.Kind.CANCELLED, transition.kind());
        assertFalse(session.hasPendingAction());
    }

    @Test
    void shouldDiscardPendingActionOnUnrelatedMessage() {
        stateMachine.hold(session, confirmation(), NOW);

        PendingActionStateMachine.Transition transition = stateMachine.onMessage(session, "what's the weather", NOW);

        assertEquals(PendingActionStateMachine.Kind.DISCARDED, transition.kind());
        assertFalse(session.hasPendingAction());
    }

    @Test
    void shouldFillMissingFieldAndAwaitConfirmation() {
        stateMachine.hold(session, clarification(), NOW);

        PendingActionStateMachine.Transition transition = stateMachine.onMessage(session, "  running late ", NOW);

        assertEquals(PendingActionStateMachine.Kind.CLARIFIED, transition.kind());
        PendingAction held = session.getPendingAction().orElseThrow();
        assertEquals(PendingState.CONFIRMATION, held.getAwaiting());
        assertNull(held.getMissingField());
        assertEquals("running late", held.getArgs().get("message"));
        assertEquals("+15551234567", held.getArgs().get("to"));
        assertSame(held, transition.action());
    }

    @Test
    void shouldTakeConfirmationWordAsClarificationText() {
        stateMachine.hold(session, clarification(), NOW);

        PendingActionStateMachine.Transition transition = stateMachine.onMessage(session, "yes", NOW);

        assertEquals(PendingActionStateMachine.Kind.CLARIFIED, transition.kind());
        assertEquals("yes", transition.action().getArgs().get("message"));
    }

    @Test
    void shouldCancelDuringClarification() {
        stateMachine.hold(session, clarification(), NOW);

        assertEquals(PendingActionStateMachine.Kind.CANCELLED, stateMachine.onMessage(session, "cancel", NOW).kind());
        assertFalse(session.hasPendingAction());
    }

    @Test
    void shouldReplacePreviouslyHeldAction() {
        stateMachine.hold(session, confirmation(), NOW);
        PendingAction replacement = PendingAction.builder().tool("sleep_mac").build();

        stateMachine.hold(session, replacement, NOW);

        assertSame(replacement, session.getPendingAction().orElseThrow());
    }

    private static PendingAction confirmation() {
        return PendingAction.builder()
                .tool("send_imessage")
                .args(new LinkedHashMap<>(Map.of("to", "+15551234567", "message", "hi")))
                .build();
    }

    private static PendingAction clarification() {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("to", "+15551234567");
        args.put("message", "");
        return PendingAction.builder()
                .tool("send_imessage")
                .args(args)
                .awaiting(PendingState.CLARIFICATION)
                .missingField("message")
                .build();
    }
}
