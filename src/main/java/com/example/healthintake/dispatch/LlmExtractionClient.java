package com.example.healthintake.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single-shot LLM completion with a bounded wait.
 *
 * <p>Messages are passed as a ready {@link Prompt} so the JSON examples in the system prompts are
 * never run through template rendering.
 */
@Component
public class LlmExtractionClient {

    private static final Logger logger = LoggerFactory.getLogger(LlmExtractionClient.class);

    private final ChatClient chatClient;
    private final ExecutorService extractionExecutor;

    @Value("${app.extraction.timeout-ms:15000}")
    private long timeoutMs;

    public LlmExtractionClient(ChatClient chatClient,
                               @Qualifier("extractionExecutor") ExecutorService extractionExecutor) {
        this.chatClient = chatClient;
        this.extractionExecutor = extractionExecutor;
    }

    public String complete(String systemPrompt, String userPayload) {
        long started = System.nanoTime();
        CompletableFuture<String> call = CompletableFuture.supplyAsync(() -> chatClient
                .prompt(new Prompt(List.of(new SystemMessage(systemPrompt), new UserMessage(userPayload))))
                .call()
                .content(), extractionExecutor);

        String content;
        try {
            content = call.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new ExtractionFailedException("LLM call timed out after " + timeoutMs + "ms", e);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new IntakeAbortedException("Interrupted while waiting for the LLM", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ExtractionFailedException("LLM call failed: " + cause.getMessage(), cause);
        }

        if (content == null || content.isBlank()) {
            throw new ExtractionFailedException("LLM returned no text content");
        }
        logger.debug("LLM call completed in {}ms", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        return content;
    }
}
