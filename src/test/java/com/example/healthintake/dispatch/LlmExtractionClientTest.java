package com.example.healthintake.dispatch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Answers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmExtractionClientTest {

    @Mock(answer = Answers.RETURNS_DEEP_STUBS)
    private ChatClient chatClient;

    private ExecutorService executor;

    private LlmExtractionClient client;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        client = new LlmExtractionClient(chatClient, executor);
        ReflectionTestUtils.setField(client, "timeoutMs", 200L);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testComplete_ReturnsModelText() {
        // Given
        when(chatClient.prompt(any(Prompt.class)).call().content()).thenReturn("{\"capa\": 2}");

        // When
        String content = client.complete("system", "{\"mensaje\":\"hola\"}");

        // Then
        assertEquals("{\"capa\": 2}", content);
    }

    @Test
    void testComplete_TimeoutRaisesExtractionFailed() {
        // Given
        when(chatClient.prompt(any(Prompt.class)).call().content()).thenAnswer(invocation -> {
            Thread.sleep(5000);
            return "{}";
        });

        // When / Then
        assertThrows(ExtractionFailedException.class, () -> client.complete("system", "{}"));
    }

    @Test
    void testComplete_BlankOutputRaisesExtractionFailed() {
        // Given
        when(chatClient.prompt(any(Prompt.class)).call().content()).thenReturn("  ");

        // When / Then
        assertThrows(ExtractionFailedException.class, () -> client.complete("system", "{}"));
    }

    @Test
    void testComplete_ModelErrorRaisesExtractionFailed() {
        // Given
        when(chatClient.prompt(any(Prompt.class)).call().content()).thenThrow(new IllegalStateException("throttled"));

        // When
        ExtractionFailedException e = assertThrows(ExtractionFailedException.class, () -> client.complete("system", "{}"));

        // Then
        assertTrue(e.getMessage().contains("throttled"));
    }
}
