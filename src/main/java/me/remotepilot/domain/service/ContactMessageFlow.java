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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.remotepilot.domain.model.CompletionRequest;
import me.remotepilot.domain.model.Directive;
import me.remotepilot.domain.model.HistoryEntry;
import me.remotepilot.domain.model.PendingAction;
import me.remotepilot.domain.model.PendingState;
import me.remotepilot.domain.model.ToolResult;
import me.remotepilot.port.outbound.CompletionPort;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a successful contact lookup into a held {@code send_imessage} action.
 *
 * <p>
 * The first phone number in the lookup result becomes the recipient. The
 * message body is the lookup's {@code message} argument, else whatever follows
 * "say"/"saying"/"that"/"to say" in the user's request. When the user asked
 * to make up, create, write or generate a message, the completion service
 * drafts it instead.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContactMessageFlow {

    static final String SEARCH_TOOL = "search_contacts";
    static final String DRAFT_PROMPT = "Write a short, friendly message. Just the text, nothing else.";

    private static final Pattern PHONE = Pattern.compile(
            "[+]?1?[\\s\\-.]?\\(?\\d{3}\\)?[\\s\\-.]?\\d{3}[\\s\\-.]?\\d{4}");
    private static final Pattern PHONE_PUNCTUATION = Pattern.compile("[\\s\\-.()]");
    private static final List<Pattern> BODY_PATTERNS = List.of(
            Pattern.compile("(?:saying|say)\\s+[\"']?(.+?)[\"']?$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:that|to say)\\s+[\"']?(.+?)[\"']?$", Pattern.CASE_INSENSITIVE));
    private static final Pattern SURROUNDING_QUOTES = Pattern.compile("^[\"']|[\"']$");
    private static final Pattern DRAFT_REQUEST = Pattern.compile("make\\s*up|create|write|generate",
            Pattern.CASE_INSENSITIVE);

    private final CompletionPort completionPort;

    public boolean handles(Directive.Action action) {
        return SEARCH_TOOL.equals(action.tool());
    }

    /**
     * Build the held message for a contact lookup, if the lookup found a phone
     * number.
     */
    public Optional<HeldMessage> prepare(Directive.Action action, ToolResult lookup, String userMessage) {
        if (!lookup.isSuccess() || lookup.getResult() == null
                || lookup.getResult().toLowerCase(Locale.ROOT).contains("error")) {
            return Optional.empty();
        }
        Optional<String> phone = extractPhone(lookup.getResult());
        if (phone.isEmpty()) {
            log.debug("[Chat] Contact lookup returned no phone number");
            return Optional.empty();
        }

        String contact = lookup.getResult();
        String body = messageBody(action.args(), userMessage);

        if (userMessage != null && DRAFT_REQUEST.matcher(userMessage).find()) {
            Optional<String> drafted = draft(userMessage);
            if (drafted.isPresent()) {
                PendingAction pending = pending(phone.get(), drafted.get(), contact, userMessage,
                        PendingState.CONFIRMATION);
                return Optional.of(new HeldMessage(pending,
                        "Found: **" + contact + "**\n\n> \"" + drafted.get() + "\"\n\nSend"
                                + ToolConfirmationPolicy.CONFIRM_SUFFIX));
            }
        }

        if (body.isEmpty()) {
            PendingAction pending = pending(phone.get(), "", contact, userMessage, PendingState.CLARIFICATION);
            return Optional.of(new HeldMessage(pending, "Found: **" + contact + "**\n\nWhat message?"));
        }
        PendingAction pending = pending(phone.get(), body, contact, userMessage, PendingState.CONFIRMATION);
        return Optional.of(new HeldMessage(pending,
                "Found: **" + contact + "**\n\nSend \"" + body + "\"" + ToolConfirmationPolicy.CONFIRM_SUFFIX));
    }

    static Optional<String> extractPhone(String text) {
        Matcher matcher = PHONE.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(PHONE_PUNCTUATION.matcher(matcher.group()).replaceAll(""));
    }

    static String messageBody(Map<String, Object> args, String userMessage) {
        Object fromArgs = args != null ? args.get("message") : null;
        if (fromArgs != null && !fromArgs.toString().isBlank()) {
            return fromArgs.toString();
        }
        if (userMessage == null) {
            return "";
        }
        for (Pattern pattern : BODY_PATTERNS) {
            Matcher matcher = pattern.matcher(userMessage);
            if (matcher.find() && !matcher.group(1).isEmpty()) {
                return SURROUNDING_QUOTES.matcher(matcher.group(1).trim()).replaceAll("");
            }
        }
        return "";
    }

    private Optional<String> draft(String userMessage) {
        CompletionRequest request = CompletionRequest.builder()
                .systemPrompt(DRAFT_PROMPT)
                .messages(List.of(HistoryEntry.user("Write: \"" + userMessage + "\"")))
                .build();
        try {
            String drafted = completionPort.complete(request).join();
            return drafted != null && !drafted.isBlank() ? Optional.of(drafted.trim()) : Optional.empty();
        } catch (CompletionException e) {
            log.warn("[LLM] Failed to draft message: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private PendingAction pending(String phone, String body, String contact, String userMessage,
            PendingState awaiting) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("to", phone);
        args.put("message", body);
        return PendingAction.builder()
                .tool(ToolConfirmationPolicy.SEND_MESSAGE_TOOL)
                .args(args)
                .context(contact)
                .originalRequest(userMessage)
                .awaiting(awaiting)
                .missingField(awaiting == PendingState.CLARIFICATION ? "message" : null)
                .build();
    }

    /**
     * A send action held for the user's reply, with the prompt to show.
     */
    public record HeldMessage(PendingAction action, String reply) {
    }
}
