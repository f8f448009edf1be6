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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.remotepilot.domain.model.Directive;
import me.remotepilot.domain.model.ParsedResponse;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts directive blocks from the assistant's reply.
 *
 * <p>
 * Recognized blocks are fenced code blocks tagged {@code action},
 * {@code schedule} or {@code preference} whose body is a JSON object. Every
 * action block is used; only the first schedule and the first preference block
 * are. Blocks are parsed independently, so a malformed block is dropped without
 * affecting the others. Consumed blocks are removed from the display text,
 * which falls back to {@value #EMPTY_TEXT_FALLBACK} when nothing else is left.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DirectiveParser {

    static final String EMPTY_TEXT_FALLBACK = "Done!";

    private static final Pattern ACTION_BLOCK = blockPattern("action");
    private static final Pattern SCHEDULE_BLOCK = blockPattern("schedule");
    private static final Pattern PREFERENCE_BLOCK = blockPattern("preference");

    private final ObjectMapper objectMapper;

    public ParsedResponse parse(String content) {
        String raw = content != null ? content : "";
        List<Directive> directives = new ArrayList<>();

        Matcher actions = ACTION_BLOCK.matcher(raw);
        while (actions.find()) {
            Directive.Action action = parseAction(actions.group(1));
            if (action != null) {
                directives.add(action);
            }
        }
        String text = ACTION_BLOCK.matcher(raw).replaceAll("");

        Matcher schedule = SCHEDULE_BLOCK.matcher(raw);
        if (schedule.find()) {
            Directive.Schedule parsed = parseSchedule(schedule.group(1));
            if (parsed != null) {
                directives.add(parsed);
            }
            text = SCHEDULE_BLOCK.matcher(text).replaceFirst("");
        }

        Matcher preference = PREFERENCE_BLOCK.matcher(raw);
        if (preference.find()) {
            Directive.Preference parsed = parsePreference(preference.group(1));
            if (parsed != null) {
                directives.add(parsed);
            }
            text = PREFERENCE_BLOCK.matcher(text).replaceFirst("");
        }

        text = text.trim();
        return new ParsedResponse(text.isEmpty() ? EMPTY_TEXT_FALLBACK : text, directives);
    }

    private Directive.Action parseAction(String body) {
        JsonNode node = readObject("action", body);
        if (node == null) {
            return null;
        }
        String tool = textField(node, "tool");
        if (tool == null) {
            log.debug("[Chat] Dropped action block without tool");
            return null;
        }
        return new Directive.Action(tool, argsField(node));
    }

    private Directive.Schedule parseSchedule(String body) {
        JsonNode node = readObject("schedule", body);
        if (node == null) {
            return null;
        }
        String when = textField(node, "when");
        String tool = textField(node, "tool");
        if (when == null || tool == null) {
            log.debug("[Chat] Dropped schedule block without when/tool");
            return null;
        }
        return new Directive.Schedule(when, tool, argsField(node), textField(node, "description"));
    }

    private Directive.Preference parsePreference(String body) {
        JsonNode node = readObject("preference", body);
        if (node == null) {
            return null;
        }
        String key = textField(node, "key");
        JsonNode value = node.get("value");
        if (key == null || value == null || value.isNull()) {
            log.debug("[Chat] Dropped preference block without key/value");
            return null;
        }
        return new Directive.Preference(key, value.isTextual() ? value.asText() : value.toString());
    }

    private JsonNode readObject(String kind, String body) {
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node == null || !node.isObject()) {
                log.debug("[Chat] Dropped {} block: not a JSON object", kind);
                return null;
            }
            return node;
        } catch (JsonProcessingException e) {
            log.debug("[Chat] Dropped malformed {} block: {}", kind, e.getOriginalMessage());
            return null;
        }
    }

    private static String textField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private Map<String, Object> argsField(JsonNode node) {
        JsonNode args = node.get("args");
        if (args == null || !args.isObject()) {
            return Map.of();
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> converted = objectMapper.convertValue(args, LinkedHashMap.class);
        return converted;
    }

    private static Pattern blockPattern(String tag) {
        return Pattern.compile("```" + tag + "\\n?([\\s\\S]*?)\\n?```");
    }
}
