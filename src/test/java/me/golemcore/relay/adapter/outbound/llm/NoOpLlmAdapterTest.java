package me.golemcore.relay.adapter.outbound.llm;

import me.golemcore.relay.domain.model.LlmRequest;
import me.golemcore.relay.domain.model.LlmResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NoOpLlmAdapterTest {

    private NoOpLlmAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new NoOpLlmAdapter();
    }

    @Test
    void shouldReturnPlaceholderResponseFromChat() throws Exception {
        LlmRequest request = LlmRequest.builder()
                .prompt("Analyze this")
                .build();

        CompletableFuture<LlmResponse> future = adapter.chat(request);
        LlmResponse response = future.get();

        assertEquals("[No LLM configured]", response.getContent());
        assertEquals("none", response.getModel());
        assertEquals("stop", response.getFinishReason());
    }

    @Test
    void shouldReturnCompletedFutureFromChat() {
        CompletableFuture<LlmResponse> future = adapter.chat(LlmRequest.builder().build());

        assertTrue(future.isDone());
        assertFalse(future.isCompletedExceptionally());
    }

    @Test
    void shouldReportUnavailable() {
        assertFalse(adapter.isAvailable());
        assertEquals("none", adapter.getProviderId());
        assertEquals("none", adapter.getCurrentModel());
    }

    @Test
    void shouldNotThrowWhenInitializeCalled() {
        assertDoesNotThrow(adapter::initialize);
    }
}
