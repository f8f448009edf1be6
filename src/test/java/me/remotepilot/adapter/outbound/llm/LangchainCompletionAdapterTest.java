package me.remotepilot.adapter.outbound.llm;

import me.remotepilot.infrastructure.config.PilotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LangchainCompletionAdapterTest {

    private PilotProperties properties;
    private LangchainCompletionAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new PilotProperties();
        adapter = new LangchainCompletionAdapter(properties, Runnable::run);
    }

    @Test
    void shouldSupportAnthropicAndOpenAi() {
        assertTrue(adapter.supports("anthropic"));
        assertTrue(adapter.supports("openai"));
        assertFalse(adapter.supports("custom"));
        assertFalse(adapter.supports("none"));
    }

    @Test
    void shouldTakeProviderFromConfigurationOnInitialize() {
        properties.getLlm().setProvider("openai");

        adapter.initialize();

        assertEquals("openai", adapter.getProviderId());
    }

    @Test
    void shouldBeAvailableOnlyWithApiKeyForActiveProvider() {
        properties.getLlm().setProvider("openai");
        properties.getLlm().getAnthropic().setApiKey("sk-ant");
        adapter.initialize();

        assertFalse(adapter.isAvailable());

        properties.getLlm().getOpenai().setApiKey("sk-openai");
        assertTrue(adapter.isAvailable());
    }
}
