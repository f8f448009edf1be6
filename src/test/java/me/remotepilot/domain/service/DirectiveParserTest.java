package me.remotepilot.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.remotepilot.domain.model.Directive;
import me.remotepilot.domain.model.ParsedResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DirectiveParserTest {

    private DirectiveParser parser;

    @BeforeEach
    void setUp() {
        parser = new DirectiveParser(new ObjectMapper());
    }

    @Test
    void shouldReturnPlainTextUnchanged() {
        ParsedResponse parsed = parser.parse("  Just chatting.  ");

        assertEquals("Just chatting.", parsed.text());
        assertTrue(parsed.directives().isEmpty());
    }

    @Test
    void shouldExtractActionAndStripBlock() {
        String content = """
                Checking the battery.
                ```action
                {"tool": "battery_status", "args": {}}
                ```""";

        ParsedResponse parsed = parser.parse(content);

        assertEquals("Checking the battery.", parsed.text());
        assertEquals(List.of(new Directive.Action("battery_status", Map.of())), parsed.actions());
    }

    @Test
    void shouldKeepEveryActionInOrder() {
        String content = "```action\n{\"tool\":\"volume_set\",\"args\":{\"level\":30}}\n```\n"
                + "```action\n{\"tool\":\"music_play\"}\n```";

        List<Directive.Action> actions = parser.parse(content).actions();

        assertEquals(2, actions.size());
        assertEquals("volume_set", actions.get(0).tool());
        assertEquals(30, actions.get(0).args().get("level"));
        assertEquals("music_play", actions.get(1).tool());
        assertTrue(actions.get(1).args().isEmpty());
    }

    @Test
    void shouldFallBackToDoneWhenOnlyBlocksPresent() {
        ParsedResponse parsed = parser.parse("```action\n{\"tool\":\"lock_screen\"}\n```");

        assertEquals("Done!", parsed.text());
        assertEquals(1, parsed.actions().size());
    }

    @Test
    void shouldFallBackToDoneForNullContent() {
        assertEquals("Done!", parser.parse(null).text());
    }

    @Test
    void shouldDropMalformedActionButStripIt() {
        ParsedResponse parsed = parser.parse("On it.\n```action\n{not json}\n```");

        assertEquals("On it.", parsed.text());
        assertTrue(parsed.actions().isEmpty());
    }

    @Test
    void shouldDropActionWithoutTool() {
        assertTrue(parser.parse("```action\n{\"args\":{\"x\":1}}\n```").actions().isEmpty());
    }

    @Test
    void shouldParseScheduleWithDescriptionDefaultingToTool() {
        String content = "Scheduled.\n```schedule\n{\"when\":\"every day at 9am\",\"tool\":\"battery_status\"}\n```";

        ParsedResponse parsed = parser.parse(content);

        Directive.Schedule schedule = parsed.schedule().orElseThrow();
        assertEquals("every day at 9am", schedule.when());
        assertEquals("battery_status", schedule.tool());
        assertEquals("battery_status", schedule.description());
        assertEquals("Scheduled.", parsed.text());
    }

    @Test
    void shouldDropScheduleWithoutWhenButStripIt() {
        ParsedResponse parsed = parser.parse("Ok\n```schedule\n{\"tool\":\"battery_status\"}\n```");

        assertTrue(parsed.schedule().isEmpty());
        assertEquals("Ok", parsed.text());
    }

    @Test
    void shouldParsePreferenceAndStringifyNonTextValues() {
        ParsedResponse text = parser.parse("Noted.\n```preference\n{\"key\":\"music\",\"value\":\"jazz\"}\n```");
        ParsedResponse number = parser.parse("```preference\n{\"key\":\"volume\",\"value\":40}\n```");

        assertEquals(new Directive.Preference("music", "jazz"), text.preference().orElseThrow());
        assertEquals("Noted.", text.text());
        assertEquals("40", number.preference().orElseThrow().value());
    }

    @Test
    void shouldDropPreferenceWithNullValue() {
        assertTrue(parser.parse("```preference\n{\"key\":\"music\",\"value\":null}\n```").preference().isEmpty());
    }

    @Test
    void shouldHandleAllDirectiveKindsTogether() {
        String content = """
                All set.
                ```preference
                {"key":"name","value":"Sam"}
                ```
                ```schedule
                {"when":"in 5 minutes","tool":"notify","args":{"text":"stretch"},"description":"Stretch reminder"}
                ```
                ```action
                {"tool":"battery_status"}
                ```""";

        ParsedResponse parsed = parser.parse(content);

        assertEquals("All set.", parsed.text());
        assertEquals(3, parsed.directives().size());
        assertEquals("Stretch reminder", parsed.schedule().orElseThrow().description());
        assertEquals("stretch", parsed.schedule().orElseThrow().args().get("text"));
    }
}
