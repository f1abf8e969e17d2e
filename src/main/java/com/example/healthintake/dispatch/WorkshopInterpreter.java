package com.example.healthintake.dispatch;

import com.example.healthintake.model.AccumulatedContext;
import com.example.healthintake.model.Fields;
import com.example.healthintake.model.Target;
import com.example.healthintake.store.DirectoryClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class WorkshopInterpreter extends AbstractLlmInterpreter {

    private static final Logger logger = LoggerFactory.getLogger(WorkshopInterpreter.class);

    static final String TOPIC_QUESTION = "¿Sobre qué tema te interesa el taller: manejo del estrés, higiene del "
            + "sueño, nutrición, manejo de la ansiedad o bienestar general?";

    private final DirectoryClient directory;

    @Value("${app.directory.max-results:5}")
    private int maxResults;

    public WorkshopInterpreter(LlmExtractionClient llm, ExtractionParser parser, ObjectMapper objectMapper,
                               DirectoryClient directory,
                               @Value("classpath:prompts/workshops.txt") Resource systemPrompt) {
        super(llm, parser, objectMapper, systemPrompt);
        this.directory = directory;
    }

    @Override
    public Target target() {
        return Target.WORKSHOPS;
    }

    @Override
    public List<String> missingCriteria(AccumulatedContext context) {
        return context.missing(List.of(Fields.TOPIC));
    }

    @Override
    public String questionFor(List<String> missingCriteria) {
        return missingCriteria.contains(Fields.TOPIC) ? TOPIC_QUESTION : null;
    }

    @Override
    public Map<String, List<Map<String, Object>>> lookup(AccumulatedContext context) {
        Map<String, Object> filters = new LinkedHashMap<>();
        for (String field : List.of(Fields.TOPIC, Fields.MODALITY, Fields.DATE)) {
            if (context.has(field)) {
                filters.put(field, context.value(field));
            }
        }
        if (filters.isEmpty()) {
            return Map.of();
        }
        try {
            return Map.of("talleres", directory.findWorkshops(filters, maxResults));
        } catch (RuntimeException e) {
            logger.warn("Workshop lookup failed for {}: {}", filters, e.getMessage());
            return Map.of();
        }
    }
}
