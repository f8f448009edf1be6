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
import me.remotepilot.domain.model.ActionResult;
import me.remotepilot.domain.model.ChatResponse;
import me.remotepilot.domain.model.CompletionRequest;
import me.remotepilot.domain.model.Directive;
import me.remotepilot.domain.model.HistoryEntry;
import me.remotepilot.domain.model.ParsedResponse;
import me.remotepilot.domain.model.PendingAction;
import me.remotepilot.domain.model.PendingState;
import me.remotepilot.domain.model.ScheduleRecord;
import me.remotepilot.domain.model.SessionState;
import me.remotepilot.domain.model.ToolDefinition;
import me.remotepilot.domain.model.ToolResult;
import me.remotepilot.infrastructure.config.PilotProperties;
import me.remotepilot.port.outbound.CompletionPort;
import me.remotepilot.port.outbound.ExecutionAgentPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * Handles one chat message against a session.
 *
 * <p>
 * Must run inside the session's actor. A held action is resolved first (see
 * {@link PendingActionStateMachine}); otherwise the message goes to the
 * completion service with the tool catalog and recent history, and the
 * returned directives are applied: preference stored, schedule registered,
 * actions executed in order. Sensitive actions and contact lookups that found
 * a phone number stop processing and wait for the user's reply.
 */
@Service
@Slf4j
public class SessionOrchestrator {

    static final String REPLY_SENT = "Sent!";
    static final String REPLY_DONE = "Done!";
    static final String REPLY_FAILED = "Failed.";
    static final String REPLY_CANCELLED = "Cancelled.";
    static final String COMPLETION_FAILURE = "Sorry, I couldn't reach the assistant: ";
    static final String VISION_PROMPT = "Describe what the image shows in the context of the user's request. "
            + "Be brief.";

    private final PendingActionStateMachine stateMachine;
    private final ToolConfirmationPolicy confirmationPolicy;
    private final SystemPromptBuilder promptBuilder;
    private final DirectiveParser directiveParser;
    private final ContactMessageFlow contactFlow;
    private final ScheduleService scheduleService;
    private final ExecutionAgentPort executionAgent;
    private final CompletionPort completionPort;
    private final PilotProperties properties;
    private final Clock clock;

    public SessionOrchestrator(PendingActionStateMachine stateMachine, ToolConfirmationPolicy confirmationPolicy,
            SystemPromptBuilder promptBuilder, DirectiveParser directiveParser, ContactMessageFlow contactFlow,
            ScheduleService scheduleService, ExecutionAgentPort executionAgent, CompletionPort completionPort,
            PilotProperties properties, Clock clock) {
        this.stateMachine = stateMachine;
        this.confirmationPolicy = confirmationPolicy;
        this.promptBuilder = promptBuilder;
        this.directiveParser = directiveParser;
        this.contactFlow = contactFlow;
        this.scheduleService = scheduleService;
        this.executionAgent = executionAgent;
        this.completionPort = completionPort;
        this.properties = properties;
        this.clock = clock;
    }

    public ChatResponse handle(SessionState session, String message) {
        PendingActionStateMachine.Transition transition = stateMachine.onMessage(session, message, clock.instant());
        return switch (transition.kind()) {
        case CONFIRMED -> executeConfirmed(session, message, transition.action());
        case CANCELLED -> reply(session, message, REPLY_CANCELLED);
        case CLARIFIED -> reply(session, message, confirmationPolicy.confirmationPrompt(transition.action()));
        case IDLE, DISCARDED -> converse(session, message);
        };
    }

    /**
     * Run a tool without involving the completion service. Nothing is
     * recorded in history.
     */
    public ToolResult executeDirect(String tool, Map<String, Object> args) {
        log.info("[Chat] Direct execution: {}", tool);
        return executionAgent.invoke(tool, args != null ? args : Map.of()).join();
    }

    /**
     * Clear history, pending action, rate window and schedules, cancelling
     * their triggers. Preferences survive.
     */
    public void reset(SessionState session) {
        scheduleService.cancelAll(session);
        session.reset(clock.instant());
        log.info("[Chat] Session {} reset", session.getId());
    }

    private ChatResponse converse(SessionState session, String message) {
        List<ToolDefinition> tools = executionAgent.listTools().join();
        String systemPrompt = promptBuilder.build(tools, session.getPreferences());

        List<HistoryEntry> messages = new ArrayList<>(
                session.recentHistory(properties.getSession().getPromptHistory()));
        messages.add(HistoryEntry.user(message));

        String raw;
        try {
            raw = completionPort.complete(CompletionRequest.builder()
                    .systemPrompt(systemPrompt)
                    .messages(messages)
                    .build()).join();
        } catch (CompletionException e) {
            String cause = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
            log.warn("[LLM] Completion failed in session {}: {}", session.getId(), cause);
            String text = COMPLETION_FAILURE + cause;
            record(session, message, text);
            return ChatResponse.builder().message(text).error(true).build();
        }

        ParsedResponse parsed = directiveParser.parse(raw);
        Instant now = clock.instant();

        parsed.preference().ifPresent(preference -> {
            session.putPreference(preference.key(), preference.value(), now);
            log.info("[Chat] Preference stored in session {}: {}", session.getId(), preference.key());
        });

        ChatResponse.ScheduledSummary scheduled = null;
        Optional<Directive.Schedule> schedule = parsed.schedule();
        if (schedule.isPresent()) {
            ScheduleRecord record = scheduleService.schedule(session, schedule.get());
            scheduled = new ChatResponse.ScheduledSummary(record.getId(), schedule.get().when(),
                    record.getDescription());
        }

        String text = parsed.text();
        List<ActionResult> results = new ArrayList<>();
        for (Directive.Action action : parsed.actions()) {
            if (confirmationPolicy.requiresConfirmation(action.tool())) {
                return holdForConfirmation(session, message, action, results, scheduled);
            }

            ToolResult result = executionAgent.invoke(action.tool(), action.args()).join();
            results.add(ActionResult.of(action.tool(), action.args(), result));

            if (contactFlow.handles(action)) {
                Optional<ContactMessageFlow.HeldMessage> held = contactFlow.prepare(action, result, message);
                if (held.isPresent()) {
                    stateMachine.hold(session, held.get().action(), clock.instant());
                    record(session, message, held.get().reply());
                    return ChatResponse.builder()
                            .message(held.get().reply())
                            .actions(results)
                            .scheduled(scheduled)
                            .build();
                }
            }

            if (result.getImage() != null) {
                text = describeImage(message, result.getImage()).orElse(text);
            }
        }

        record(session, message, text);
        return ChatResponse.builder()
                .message(text)
                .action(results.isEmpty() ? null : results.get(0))
                .actions(results)
                .scheduled(scheduled)
                .build();
    }

    private ChatResponse executeConfirmed(SessionState session, String message, PendingAction action) {
        ToolResult result = executionAgent.invoke(action.getTool(), action.getArgs()).join();
        String success = ToolConfirmationPolicy.SEND_MESSAGE_TOOL.equals(action.getTool()) ? REPLY_SENT : REPLY_DONE;

        Instant now = clock.instant();
        session.appendHistory(HistoryEntry.user(message), now);
        session.appendHistory(HistoryEntry.assistant(result.isSuccess() ? success : REPLY_FAILED), now);

        return ChatResponse.builder()
                .message(result.isSuccess() ? success : "Failed: " + result.getError())
                .action(ActionResult.of(action.getTool(), action.getArgs(), result))
                .build();
    }

    private ChatResponse holdForConfirmation(SessionState session, String message, Directive.Action action,
            List<ActionResult> results, ChatResponse.ScheduledSummary scheduled) {
        PendingAction pending = PendingAction.builder()
                .tool(action.tool())
                .args(new LinkedHashMap<>(action.args()))
                .originalRequest(message)
                .build();

        String prompt;
        if (ToolConfirmationPolicy.SEND_MESSAGE_TOOL.equals(action.tool()) && isBlank(action.args().get("message"))) {
            pending = pending.toBuilder()
                    .awaiting(PendingState.CLARIFICATION)
                    .missingField("message")
                    .build();
            prompt = "What message should I send to " + action.args().getOrDefault("to", "them") + "?";
        } else {
            prompt = confirmationPolicy.confirmationPrompt(pending);
        }

        stateMachine.hold(session, pending, clock.instant());
        record(session, message, prompt);
        return ChatResponse.builder()
                .message(prompt)
                .actions(results)
                .scheduled(scheduled)
                .build();
    }

    private Optional<String> describeImage(String message, ToolResult.ToolImage image) {
        String visionModel = properties.getLlm().getVisionModel();
        if (visionModel == null || visionModel.isBlank()) {
            return Optional.empty();
        }
        try {
            String description = completionPort.complete(CompletionRequest.builder()
                    .systemPrompt(VISION_PROMPT)
                    .messages(List.of(HistoryEntry.user(message)))
                    .model(visionModel)
                    .image(image)
                    .build()).join();
            return description != null && !description.isBlank() ? Optional.of(description) : Optional.empty();
        } catch (CompletionException e) {
            log.warn("[LLM] Image description failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private ChatResponse reply(SessionState session, String message, String text) {
        record(session, message, text);
        return ChatResponse.text(text);
    }

    private void record(SessionState session, String message, String assistantText) {
        Instant now = clock.instant();
        session.appendHistory(HistoryEntry.user(message), now);
        session.appendHistory(HistoryEntry.assistant(assistantText), now);
    }

    private static boolean isBlank(Object value) {
        return value == null || value.toString().isBlank();
    }
}
