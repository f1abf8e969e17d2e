package com.example.healthintake.dispatch;

import com.example.healthintake.context.FieldValues;
import com.example.healthintake.model.ExtractionResult;
import com.example.healthintake.model.Fields;
import com.example.healthintake.model.RiskState;
import com.example.healthintake.model.Target;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw LLM text into an {@link ExtractionResult}, keeping only the target's schema fields.
 */
@Component
public class ExtractionParser {

    private final ObjectMapper objectMapper;

    public ExtractionParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ExtractionResult parse(Target target, String text) {
        JsonNode root = readObject(text);
        JsonNode source = fieldSource(target, root);

        Map<String, Object> fields = new LinkedHashMap<>();
        for (String field : target.getFields()) {
            if (Fields.CAPA.equals(field)) {
                continue;
            }
            Object value = toValue(source.get(field));
            if (!FieldValues.isAbsent(value)) {
                fields.put(field, value);
            }
        }

        Integer riskTier = null;
        if (target == Target.TRIAGE) {
            List<String> reasons = FieldValues.toStringList(toValue(root.get(Fields.RAZONES)));
            if (!reasons.isEmpty()) {
                fields.put(Fields.RAZONES, reasons);
            }
            riskTier = RiskState.tierOf(toValue(root.get(Fields.CAPA)));
        }

        JsonNode question = root.get("pregunta_pendiente");
        String pendingQuestion = question != null && question.isTextual() && !FieldValues.isAbsent(question.asText())
                ? question.asText().trim() : null;

        return ExtractionResult.builder()
                .target(target)
                .fields(fields)
                .pendingQuestion(pendingQuestion)
                .riskTier(riskTier)
                .requiresMoreInformation(root.path("requiere_mas_informacion").asBoolean(false))
                .failed(false)
                .build();
    }

    /**
     * Reads the JSON object between the first '{' and the last '}', ignoring any prose around it.
     */
    public JsonNode readObject(String text) {
        if (text == null) {
            throw new ExtractionFailedException("No LLM output to parse");
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new ExtractionFailedException("LLM output contains no JSON object");
        }
        try {
            JsonNode node = objectMapper.readTree(text.substring(start, end + 1));
            if (node == null || !node.isObject()) {
                throw new ExtractionFailedException("LLM output is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new ExtractionFailedException("Unparseable LLM output: " + e.getOriginalMessage(), e);
        }
    }

    private static JsonNode fieldSource(Target target, JsonNode root) {
        String container;
        switch (target) {
            case DOCTORS:
                container = "criterios";
                break;
            case WORKSHOPS:
                container = "filters";
                break;
            default:
                return root;
        }
        JsonNode nested = root.get(container);
        return nested != null && nested.isObject() ? nested : root;
    }

    private Object toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return objectMapper.convertValue(node, Object.class);
    }
}
