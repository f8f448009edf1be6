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

import lombok.extern.slf4j.Slf4j;
import me.remotepilot.domain.model.PendingAction;
import me.remotepilot.domain.model.SessionState;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Human-in-the-loop gate for held actions.
 *
 * <p>
 * States: idle (no pending action), awaiting confirmation, awaiting
 * clarification. {@link #onMessage} consumes the user's reply and moves the
 * session to the next state; the caller acts on the returned
 * {@link Transition}:
 * <ul>
 * <li>{@code CONFIRMED} - execute the returned action</li>
 * <li>{@code CANCELLED} - reply "Cancelled."</li>
 * <li>{@code CLARIFIED} - the missing field was filled, ask for
 * confirmation</li>
 * <li>{@code DISCARDED} / {@code IDLE} - process the message normally</li>
 * </ul>
 */
@Component
@Slf4j
public class PendingActionStateMachine {

    private static final Pattern CONFIRMATION = Pattern.compile(
            "^(yes|yeah|yep|yup|sure|ok|okay|do it|send it|confirm|go ahead|please|y)\\.?!?$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern CANCELLATION = Pattern.compile(
            "^(no|nope|cancel|stop|don't|nevermind|never mind|abort|n)\\.?!?$",
            Pattern.CASE_INSENSITIVE);

    public static boolean isConfirmation(String message) {
        return message != null && CONFIRMATION.matcher(message.trim()).matches();
    }

    public static boolean isCancellation(String message) {
        return message != null && CANCELLATION.matcher(message.trim()).matches();
    }

    /**
     * Hold {@code action} for the user's reply. Replaces any action already
     * held.
     */
    public void hold(SessionState state, PendingAction action, Instant now) {
        state.getPendingAction().ifPresent(previous -> log.info(
                "[Chat] Pending {} superseded by {} in session {}", previous.getTool(), action.getTool(),
                state.getId()));
        state.holdPendingAction(action, now);
        log.info("[Chat] Holding {} for {} in session {}", action.getTool(), action.getAwaiting(), state.getId());
    }

    public Transition onMessage(SessionState state, String message, Instant now) {
        Optional<PendingAction> held = state.getPendingAction();
        if (held.isEmpty()) {
            return Transition.idle();
        }
        PendingAction pending = held.get();

        if (isCancellation(message)) {
            state.clearPendingAction(now);
            log.info("[Chat] Pending {} cancelled in session {}", pending.getTool(), state.getId());
            return new Transition(Kind.CANCELLED, pending);
        }

        if (pending.isAwaitingClarification()) {
            if (message == null || message.isBlank()) {
                state.clearPendingAction(now);
                return new Transition(Kind.DISCARDED, pending);
            }
            PendingAction clarified = pending.withClarification(message.trim());
            state.holdPendingAction(clarified, now);
            return new Transition(Kind.CLARIFIED, clarified);
        }

        if (isConfirmation(message)) {
            state.clearPendingAction(now);
            log.info("[Chat] Pending {} confirmed in session {}", pending.getTool(), state.getId());
            return new Transition(Kind.CONFIRMED, pending);
        }

        state.clearPendingAction(now);
        log.debug("[Chat] Pending {} dropped, reply is a new command", pending.getTool());
        return new Transition(Kind.DISCARDED, pending);
    }

    public enum Kind {
        IDLE, CONFIRMED, CANCELLED, CLARIFIED, DISCARDED
    }

    /**
     * Outcome of a reply to a held action. {@code action} is the action the
     * outcome refers to, or {@code null} when idle.
     */
    public record Transition(Kind kind, PendingAction action) {

        static Transition idle() {
            return new Transition(Kind.IDLE, null);
        }
    }
}
