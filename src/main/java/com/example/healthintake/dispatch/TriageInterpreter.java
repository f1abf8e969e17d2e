package com.example.healthintake.dispatch;

import com.example.healthintake.model.Target;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Symptom interpretation. Produces the raw tier, reasons and suggestions; escalation happens later.
 */
@Component
public class TriageInterpreter extends AbstractLlmInterpreter {

    static final String SYMPTOM_QUESTION =
            "¿Puedes contarme qué síntomas tienes, desde cuándo y qué tan intensos son?";

    /** Action mandated for each reported tier. */
    static final Map<Integer, String> TIER_ACTIONS = Map.of(
            1, "contactar_medico_virtual",
            2, "solicitar_medico_a_domicilio",
            3, "consulta_presencial",
            4, "llamar_emergencias");

    public TriageInterpreter(LlmExtractionClient llm, ExtractionParser parser, ObjectMapper objectMapper,
                             @Value("classpath:prompts/triage.txt") Resource systemPrompt) {
        super(llm, parser, objectMapper, systemPrompt);
    }

    @Override
    public Target target() {
        return Target.TRIAGE;
    }

    @Override
    public String questionFor(List<String> missingCriteria) {
        return SYMPTOM_QUESTION;
    }

    public static String actionFor(int tier) {
        return TIER_ACTIONS.get(tier);
    }
}
