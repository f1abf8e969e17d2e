package com.example.healthintake.dispatch;

import com.example.healthintake.model.ExtractionRequest;
import com.example.healthintake.model.ExtractionResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.Resource;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Extraction shared by all interpreters: a static system prompt plus the request as JSON.
 */
public abstract class AbstractLlmInterpreter implements Interpreter {

    private final LlmExtractionClient llm;
    private final ExtractionParser parser;
    private final ObjectMapper objectMapper;
    private final String systemPrompt;

    protected AbstractLlmInterpreter(LlmExtractionClient llm, ExtractionParser parser,
                                     ObjectMapper objectMapper, Resource systemPrompt) {
        this.llm = llm;
        this.parser = parser;
        this.objectMapper = objectMapper;
        this.systemPrompt = loadPrompt(systemPrompt);
    }

    @Override
    public ExtractionResult extract(ExtractionRequest request) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new ExtractionFailedException("Could not serialize extraction request", e);
        }
        return parser.parse(target(), llm.complete(systemPrompt, payload));
    }

    static String loadPrompt(Resource resource) {
        try {
            return StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read prompt " + resource.getDescription(), e);
        }
    }
}
