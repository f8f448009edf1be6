package me.remotepilot.domain.service;

import me.remotepilot.domain.model.PendingAction;
import me.remotepilot.infrastructure.config.PilotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolConfirmationPolicyTest {

    private ToolConfirmationPolicy policy;

    @BeforeEach
    void setUp() {
        policy = new ToolConfirmationPolicy(new PilotProperties());
    }

    @Test
    void shouldRequireConfirmationForDefaultSensitiveTools() {
        assertTrue(policy.requiresConfirmation("send_imessage"));
        assertTrue(policy.requiresConfirmation("finder_trash"));
        assertTrue(policy.requiresConfirmation("sleep_mac"));
        assertFalse(policy.requiresConfirmation("battery_status"));
    }

    @Test
    void shouldHonorConfiguredToolList() {
        PilotProperties properties = new PilotProperties();
        properties.getConfirmation().getSensitiveTools().clear();
        properties.getConfirmation().getSensitiveTools().add("shutdown");

        ToolConfirmationPolicy custom = new ToolConfirmationPolicy(properties);

        assertTrue(custom.requiresConfirmation("shutdown"));
        assertFalse(custom.requiresConfirmation("sleep_mac"));
    }

    @Test
    void shouldAlwaysConfirmOutgoingMessages() {
        PilotProperties properties = new PilotProperties();
        properties.getConfirmation().getSensitiveTools().clear();

        ToolConfirmationPolicy custom = new ToolConfirmationPolicy(properties);

        assertTrue(custom.requiresConfirmation("send_imessage"));
        assertFalse(custom.requiresConfirmation("finder_trash"));
    }

    @Test
    void shouldDescribeKnownTools() {
        assertEquals("Send \"hi\" to +15551234567",
                policy.describeAction("send_imessage", Map.of("to", "+15551234567", "message", "hi")));
        assertEquals("Move ~/old.txt to Trash", policy.describeAction("finder_trash", Map.of("path", "~/old.txt")));
        assertEquals("Put the Mac to sleep", policy.describeAction("sleep_mac", Map.of()));
        assertEquals("Run lock_screen", policy.describeAction("lock_screen", null));
    }

    @Test
    void shouldUseUnknownForMissingArgs() {
        assertEquals("Move unknown to Trash", policy.describeAction("finder_trash", Map.of()));
    }

    @Test
    void shouldAppendYesNoToPrompt() {
        PendingAction action = PendingAction.builder().tool("sleep_mac").build();

        assertEquals("Put the Mac to sleep? *(yes/no)*", policy.confirmationPrompt(action));
    }
}
