package me.golemcore.relay.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.relay.domain.model.Intent;
import me.golemcore.relay.domain.model.LlmRequest;
import me.golemcore.relay.domain.model.LlmResponse;
import me.golemcore.relay.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class LlmIntentExtractorTest {

    private LlmPort llmPort;
    private LlmIntentExtractor extractor;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        ObjectMapper objectMapper = new ObjectMapper();
        extractor = new LlmIntentExtractor(llmPort, new StructuredResponseParser(objectMapper), objectMapper);
    }

    @Test
    void shouldExtractIntentsFromArray() {
        givenResponse("""
                ```json
                [
                  {"type": "question", "confidence": 0.9, "parameters": {"topic": "java"}},
                  {"type": "greeting", "confidence": 0.6, "action": "remember_user"}
                ]
                ```""");

        List<Intent> intents = extractor.extract("hi, how do records work?").join();

        assertEquals(2, intents.size());
        assertEquals("question", intents.get(0).getKind());
        assertEquals(0.9, intents.get(0).getConfidence(), 1e-9);
        assertEquals("java", intents.get(0).getParameters().get("topic"));
        assertFalse(intents.get(0).hasAction());
        assertEquals("greeting", intents.get(1).getKind());
        assertEquals("remember_user", intents.get(1).getAction());
    }

    @Test
    void shouldAcceptWrappedIntentsObject() {
        givenResponse("{\"intents\": [{\"type\": \"request\", \"confidence\": 0.8}]}");

        List<Intent> intents = extractor.extract("please post this").join();

        assertEquals(1, intents.size());
        assertEquals("request", intents.get(0).getKind());
    }

    @Test
    void shouldSkipMalformedEntriesAndClampConfidence() {
        List<Intent> intents = extractor.parseIntents("""
                [
                  "not an object",
                  {"confidence": 0.5},
                  {"type": "  ", "confidence": 0.5},
                  {"type": "complaint", "confidence": 1.7},
                  {"type": "praise", "confidence": -2}
                ]""");

        assertEquals(2, intents.size());
        assertEquals(1.0, intents.get(0).getConfidence(), 1e-9);
        assertEquals(0.0, intents.get(1).getConfidence(), 1e-9);
    }

    @Test
    void shouldReturnEmptyListOnUnparseableResponse() {
        givenResponse("I think the user is asking a question.");

        List<Intent> intents = extractor.extract("what?").join();

        assertTrue(intents.isEmpty());
    }

    @Test
    void shouldReturnEmptyListWhenCompletionFails() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));

        List<Intent> intents = extractor.extract("what?").join();

        assertTrue(intents.isEmpty());
    }

    @Test
    void shouldReturnEmptyListWhenCompletionThrowsSynchronously() {
        when(llmPort.chat(any())).thenThrow(new IllegalStateException("not initialized"));

        List<Intent> intents = assertDoesNotThrow(() -> extractor.extract("what?").join());

        assertTrue(intents.isEmpty());
    }

    @Test
    void shouldUsePromptOverrideWhenGiven() {
        givenResponse("[]");

        extractor.extract("hello", "Classify this:").join();

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        assertTrue(captor.getValue().getPrompt().startsWith("Classify this:"));
        assertTrue(captor.getValue().getPrompt().endsWith("hello"));
        assertTrue(captor.getValue().isStructuredOutput());
    }

    @Test
    void shouldUseDefaultInstructionsWithoutOverride() {
        givenResponse("[]");

        extractor.extract("hello").join();

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        assertTrue(captor.getValue().getPrompt().startsWith("Identify the intents"));
        assertEquals(0.3, captor.getValue().getTemperature(), 1e-9);
    }

    private void givenResponse(String content) {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content(content).build()));
    }
}
