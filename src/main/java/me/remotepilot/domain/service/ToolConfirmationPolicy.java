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
import me.remotepilot.infrastructure.config.PilotProperties;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Decides which tool calls wait for an explicit yes/no from the user and
 * phrases the question.
 *
 * <p>
 * Sensitive tools are listed in {@code pilot.confirmation.sensitive-tools}.
 * {@code send_imessage} is always added to that list.
 */
@Component
@Slf4j
public class ToolConfirmationPolicy {

    static final String SEND_MESSAGE_TOOL = "send_imessage";
    static final String CONFIRM_SUFFIX = "? *(yes/no)*";

    private static final String UNKNOWN = "unknown";

    private final Set<String> sensitiveTools;

    public ToolConfirmationPolicy(PilotProperties properties) {
        Set<String> tools = new HashSet<>(properties.getConfirmation().getSensitiveTools());
        tools.add(SEND_MESSAGE_TOOL);
        this.sensitiveTools = Set.copyOf(tools);
        log.info("ToolConfirmationPolicy sensitive tools: {}", sensitiveTools);
    }

    public boolean requiresConfirmation(String tool) {
        return sensitiveTools.contains(tool);
    }

    /**
     * Human-readable description of the action, without the trailing question.
     */
    public String describeAction(String tool, Map<String, Object> args) {
        return switch (tool) {
        case SEND_MESSAGE_TOOL -> "Send \"" + arg(args, "message") + "\" to " + arg(args, "to");
        case "finder_trash" -> "Move " + arg(args, "path") + " to Trash";
        case "sleep_mac" -> "Put the Mac to sleep";
        default -> args == null || args.isEmpty() ? "Run " + tool : "Run " + tool + " " + args;
        };
    }

    /**
     * The yes/no question shown while {@code action} awaits confirmation.
     */
    public String confirmationPrompt(PendingAction action) {
        return describeAction(action.getTool(), action.getArgs()) + CONFIRM_SUFFIX;
    }

    private static String arg(Map<String, Object> args, String key) {
        Object value = args != null ? args.get(key) : null;
        return value != null ? value.toString() : UNKNOWN;
    }
}
