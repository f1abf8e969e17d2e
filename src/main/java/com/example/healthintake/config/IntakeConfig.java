package com.example.healthintake.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class IntakeConfig {

    @Bean
    public ChatClient chatClient(ChatClient.Builder builder) {
        return builder.build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Pool the LLM calls run on. Callers wait on it with the extraction timeout.
     */
    @Bean(name = "extractionExecutor", destroyMethod = "shutdownNow")
    public ExecutorService extractionExecutor(@Value("${app.extraction.max-threads:8}") int maxThreads) {
        int threadCount = maxThreads > 0 ? maxThreads : 8;
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threadCount, r -> {
            Thread t = new Thread(r, "llm-extraction-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
