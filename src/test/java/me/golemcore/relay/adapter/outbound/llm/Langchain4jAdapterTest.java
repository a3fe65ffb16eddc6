package me.golemcore.relay.adapter.outbound.llm;

import me.golemcore.relay.domain.model.LlmRequest;
import me.golemcore.relay.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class Langchain4jAdapterTest {

    private BotProperties properties;
    private Langchain4jAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        adapter = new Langchain4jAdapter(properties);
    }

    @Test
    void shouldResolveProviderFromModelPrefix() {
        assertEquals("anthropic", Langchain4jAdapter.providerOf("anthropic/claude-sonnet-4"));
        assertEquals("openai", Langchain4jAdapter.providerOf("openai/gpt-4o-mini"));
        assertEquals("openai", Langchain4jAdapter.providerOf("gpt-4o-mini"));
        assertEquals("openai", Langchain4jAdapter.providerOf(null));
    }

    @Test
    void shouldStripProviderPrefix() {
        assertEquals("gpt-4o-mini", Langchain4jAdapter.stripProviderPrefix("openai/gpt-4o-mini"));
        assertEquals("gpt-4o-mini", Langchain4jAdapter.stripProviderPrefix("gpt-4o-mini"));
    }

    @Test
    void shouldBeUnavailableWithoutApiKey() {
        assertFalse(adapter.isAvailable());

        BotProperties.ProviderProperties openai = new BotProperties.ProviderProperties();
        openai.setApiKey(" ");
        properties.getLlm().getLangchain4j().getProviders().put("openai", openai);
        assertFalse(adapter.isAvailable());
    }

    @Test
    void shouldBeAvailableWithApiKeyForModelProvider() {
        properties.getLlm().getLangchain4j().setModel("anthropic/claude-sonnet-4");
        BotProperties.ProviderProperties anthropic = new BotProperties.ProviderProperties();
        anthropic.setApiKey("sk-test");
        properties.getLlm().getLangchain4j().getProviders().put("anthropic", anthropic);

        assertTrue(adapter.isAvailable());
        assertEquals("langchain4j", adapter.getProviderId());
    }

    @Test
    void shouldFailChatWhenProviderNotConfigured() {
        adapter.initialize();

        CompletionException error = assertThrows(CompletionException.class,
                () -> adapter.chat(LlmRequest.builder().prompt("hi").build()).join());

        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertEquals("openai/gpt-4o-mini", adapter.getCurrentModel());
    }
}
