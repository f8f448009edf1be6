package me.remotepilot.domain.service;

import me.remotepilot.domain.model.CompletionRequest;
import me.remotepilot.domain.model.Directive;
import me.remotepilot.domain.model.PendingAction;
import me.remotepilot.domain.model.PendingState;
import me.remotepilot.domain.model.ToolResult;
import me.remotepilot.port.outbound.CompletionPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ContactMessageFlowTest {

    private static final String CONTACT = "John Smith: (555) 123-4567";

    private CompletionPort completionPort;
    private ContactMessageFlow flow;

    @BeforeEach
    void setUp() {
        completionPort = mock(CompletionPort.class);
        flow = new ContactMessageFlow(completionPort);
    }

    @Test
    void shouldHandleOnlyContactSearch() {
        assertTrue(flow.handles(new Directive.Action("search_contacts", Map.of())));
        assertFalse(flow.handles(new Directive.Action("battery_status", Map.of())));
    }

    @Test
    void shouldExtractAndNormalizePhone() {
        assertEquals(Optional.of("5551234567"), ContactMessageFlow.extractPhone(CONTACT));
        assertEquals(Optional.of("+15551234567"), ContactMessageFlow.extractPhone("Jane: +1 555-123-4567"));
        assertTrue(ContactMessageFlow.extractPhone("No contacts found").isEmpty());
    }

    @Test
    void shouldPreferMessageArgumentOverUserText() {
        assertEquals("I love you",
                ContactMessageFlow.messageBody(Map.of("message", "I love you"), "text John saying hi"));
    }

    @Test
    void shouldExtractBodyFromUserText() {
        assertEquals("hello there", ContactMessageFlow.messageBody(Map.of(), "text John saying hello there"));
        assertEquals("on my way", ContactMessageFlow.messageBody(Map.of(), "text John saying 'on my way'"));
        assertEquals("", ContactMessageFlow.messageBody(Map.of(), "text John"));
    }

    @Test
    void shouldHoldMessageForConfirmation() {
        Directive.Action action = new Directive.Action("search_contacts",
                Map.of("query", "John", "message", "running late"));

        ContactMessageFlow.HeldMessage held = flow.prepare(action, ToolResult.success(CONTACT), "text John")
                .orElseThrow();

        PendingAction pending = held.action();
        assertEquals("send_imessage", pending.getTool());
        assertEquals("5551234567", pending.getArgs().get("to"));
        assertEquals("running late", pending.getArgs().get("message"));
        assertEquals(PendingState.CONFIRMATION, pending.getAwaiting());
        assertEquals(CONTACT, pending.getContext());
        assertEquals("Found: **" + CONTACT + "**\n\nSend \"running late\"? *(yes/no)*", held.reply());
    }

    @Test
    void shouldAskForMessageWhenBodyMissing() {
        Directive.Action action = new Directive.Action("search_contacts", Map.of("query", "John"));

        ContactMessageFlow.HeldMessage held = flow.prepare(action, ToolResult.success(CONTACT), "text John")
                .orElseThrow();

        assertEquals(PendingState.CLARIFICATION, held.action().getAwaiting());
        assertEquals("message", held.action().getMissingField());
        assertEquals("", held.action().getArgs().get("message"));
        assertTrue(held.reply().endsWith("What message?"));
    }

    @Test
    void shouldDraftMessageWhenAskedToWriteOne() {
        when(completionPort.complete(any())).thenReturn(CompletableFuture.completedFuture("  Happy birthday!  "));
        Directive.Action action = new Directive.Action("search_contacts", Map.of("query", "John"));

        ContactMessageFlow.HeldMessage held = flow.prepare(action, ToolResult.success(CONTACT),
                "write John a birthday message").orElseThrow();

        assertEquals("Happy birthday!", held.action().getArgs().get("message"));
        assertTrue(held.reply().contains("> \"Happy birthday!\""));
        ArgumentCaptor<CompletionRequest> captor = ArgumentCaptor.forClass(CompletionRequest.class);
        verify(completionPort).complete(captor.capture());
        assertEquals(ContactMessageFlow.DRAFT_PROMPT, captor.getValue().getSystemPrompt());
    }

    @Test
    void shouldFallBackWhenDraftFails() {
        when(completionPort.complete(any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("offline")));
        Directive.Action action = new Directive.Action("search_contacts", Map.of("query", "John"));

        ContactMessageFlow.HeldMessage held = flow.prepare(action, ToolResult.success(CONTACT),
                "write John saying see you at 8").orElseThrow();

        assertEquals("see you at 8", held.action().getArgs().get("message"));
        assertEquals(PendingState.CONFIRMATION, held.action().getAwaiting());
    }

    @Test
    void shouldNotHoldWhenLookupFailedOrFoundNothing() {
        Directive.Action action = new Directive.Action("search_contacts", Map.of("query", "John"));

        assertTrue(flow.prepare(action, ToolResult.failure("Timeout"), "text John").isEmpty());
        assertTrue(flow.prepare(action, ToolResult.success("Error: contacts locked 555-123-4567"), "text John")
                .isEmpty());
        assertTrue(flow.prepare(action, ToolResult.success("No contacts found"), "text John").isEmpty());
        verify(completionPort, never()).complete(any());
    }
}
