package com.example.healthintake.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Payload sent to an interpreter's LLM extraction. Serialized as the user message.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExtractionRequest {
    @JsonProperty("mensaje")
    String message;
    @JsonProperty("fecha_actual")
    String currentDate;
    @JsonProperty("contexto_acumulado")
    Map<String, Object> accumulatedContext;
    @JsonProperty("razones_acumuladas")
    List<String> accumulatedReasons;
    @JsonProperty("pregunta_pendiente")
    String pendingQuestion;
    /** Triage only. */
    @JsonProperty("capa_previa")
    Integer priorRiskTier;
}
