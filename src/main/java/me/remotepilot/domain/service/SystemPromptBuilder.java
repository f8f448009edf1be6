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
import me.remotepilot.domain.model.ToolDefinition;
import me.remotepilot.infrastructure.config.PilotProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the system prompt for a chat turn from the tool catalog and the
 * session's preferences.
 *
 * <p>
 * Tools are split into core tools (no underscore, or one of the built-in
 * prefixes) listed by description, and extension tools listed with their
 * argument hints ({@code name*} marks a required argument). The internal
 * {@code send_imessage} tool is never shown: messaging goes through
 * {@code search_contacts} and the pending-action flow.
 */
@Component
@RequiredArgsConstructor
public class SystemPromptBuilder {

    static final String HIDDEN_TOOL = ToolConfirmationPolicy.SEND_MESSAGE_TOOL;

    private static final List<String> CORE_PREFIXES = List.of(
            "music_", "volume_", "calendar_", "reminders_", "battery_", "wifi_", "storage_", "running_",
            "front_", "brightness_", "dark_mode_", "dnd_", "lock_", "sleep_", "notes_", "finder_",
            "shortcut_", "browser_", "clipboard_", "search_");

    private static final String TEMPLATE = """
            You are %s, a personal AI assistant that controls a Mac remotely. Be helpful and concise.

            USER PREFERENCES:
            %s

            AVAILABLE TOOLS:
            %s%s

            IMPORTANT: For Raycast extensions, use the EXACT tool name from the list above (like "slack_send_message", "linear_create_issue"). Do NOT use the generic "raycast" tool - use the specific extension tools instead.

            ===== QUICK REFERENCE =====

            MUSIC: music_play, music_pause, music_next, music_previous, music_current
            VOLUME: volume_up, volume_down, volume_set, volume_mute, volume_get
            MESSAGING (iMessage/SMS):
              ONLY way to send messages: use search_contacts tool
              NEVER use applescript to send messages - it won't work!

              Flow:
              1. If user uses a nickname (wife, mom, boss), check USER PREFERENCES for the real name
              2. Call search_contacts with the real name AND the message to send
              3. System handles confirmation and sending automatically

              IMPORTANT: Rewrite the message from the sender's perspective!
              - "tell her I love her" -> "I love you" (speaking TO her, not about her)
              - "let him know I'm running late" -> "I'm running late"
              - "ask her if she wants dinner" -> "Do you want dinner?"

              Example: "text my wife and tell her I love her"
              - Check USER PREFERENCES: wife -> (stored name)
              - Rewrite message for recipient: "I love you"
              - Call: {"tool": "search_contacts", "args": {"query": "(name)", "message": "I love you"}}
            CALENDAR: calendar_today, calendar_upcoming, calendar_next, calendar_create
            REMINDERS: reminders_list, reminders_create, reminders_complete
            SYSTEM: battery_status, wifi_status, storage_status, running_apps, front_app
            DISPLAY: brightness_set, dark_mode_toggle, dark_mode_status, dnd_toggle
            SCREEN: lock_screen, sleep_display, sleep_mac
            NOTES: notes_list, notes_search, notes_create, notes_read, notes_append
            FILES: finder_search, finder_downloads, finder_desktop, finder_reveal, finder_trash
            SHORTCUTS: shortcut_run, shortcut_list
            BROWSER: browser_url, browser_tabs
            APPS: open_app, open_url
            OTHER: screenshot, notify, say, clipboard_get, clipboard_set

            ===== ACTION FORMAT =====

            ```action
            {"tool": "music_play", "args": {"query": "Resonance"}}
            ```

            Multiple actions (separate blocks):
            ```action
            {"tool": "open_app", "args": {"name": "Chrome"}}
            ```
            ```action
            {"tool": "battery_status", "args": {}}
            ```

            Raycast extensions with arguments:
            ```action
            {"tool": "linear_create_issue_for_myself", "args": {"title": "Fix the bug"}}
            ```

            ===== SCHEDULING =====

            For future tasks, use schedule blocks (not action blocks):

            ```schedule
            {"when": "in 5 minutes", "tool": "notify", "args": {"message": "Hi"}, "description": "Reminder"}
            ```

            ```schedule
            {"when": "every day at 5pm", "tool": "music_play", "args": {"query": "chill"}, "description": "Daily music"}
            ```

            Supported: "in X minutes/hours", "every day at Xpm", "every morning/evening", "every hour", "every weekday at X", cron syntax

            ===== PREFERENCES =====
            ```preference
            {"key": "name", "value": "value"}
            ```

            Be brief. Don't explain - just do it.""";

    private final PilotProperties properties;

    public String build(List<ToolDefinition> tools, Map<String, String> preferences) {
        List<ToolDefinition> core = new ArrayList<>();
        List<ToolDefinition> extensions = new ArrayList<>();
        for (ToolDefinition tool : tools) {
            String name = tool.getName();
            if (name == null || HIDDEN_TOOL.equals(name)) {
                continue;
            }
            if (isCoreTool(name)) {
                core.add(tool);
            } else {
                extensions.add(tool);
            }
        }

        String coreDescription = core.stream()
                .map(tool -> "- " + tool.getName() + ": " + tool.getDescription())
                .collect(Collectors.joining("\n"));
        String extensionDescription = extensions.isEmpty()
                ? ""
                : "\n\nRAYCAST EXTENSIONS (use these exact tool names):\n" + extensions.stream()
                        .map(SystemPromptBuilder::describeExtension)
                        .collect(Collectors.joining("\n"));

        return TEMPLATE.formatted(properties.getLlm().getAssistantName(), describePreferences(preferences),
                coreDescription, extensionDescription);
    }

    static boolean isCoreTool(String name) {
        return !name.contains("_") || CORE_PREFIXES.stream().anyMatch(name::startsWith);
    }

    private static String describePreferences(Map<String, String> preferences) {
        if (preferences == null || preferences.isEmpty()) {
            return "None";
        }
        return preferences.entrySet().stream()
                .map(entry -> "- " + entry.getKey() + ": " + entry.getValue())
                .collect(Collectors.joining("\n"));
    }

    @SuppressWarnings("unchecked")
    private static String describeExtension(ToolDefinition tool) {
        Map<String, Object> schema = tool.getInputSchema() != null ? tool.getInputSchema() : Map.of();
        Object rawProperties = schema.get("properties");
        Object rawRequired = schema.get("required");
        Map<String, Object> props = rawProperties instanceof Map<?, ?> map
                ? (Map<String, Object>) map
                : Map.of();
        List<Object> required = rawRequired instanceof List<?> list ? (List<Object>) list : List.of();

        String args = props.entrySet().stream()
                .filter(entry -> !"text".equals(entry.getKey()))
                .map(entry -> entry.getKey() + (required.contains(entry.getKey()) ? "*" : "") + ": "
                        + argumentDescription(entry.getKey(), entry.getValue()))
                .collect(Collectors.joining(", "));
        return "- " + tool.getName() + (args.isEmpty() ? "" : " (" + args + ")");
    }

    private static String argumentDescription(String key, Object spec) {
        if (spec instanceof Map<?, ?> map && map.get("description") instanceof String description
                && !description.isEmpty()) {
            return description;
        }
        return key;
    }
}
