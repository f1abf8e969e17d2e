package com.example.healthintake.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IntakeResponse {

    public static final String DISCLAIMER = "Este asistente no reemplaza una evaluación médica profesional. "
            + "Si tus síntomas empeoran o presentas signos de alarma (dificultad para respirar, dolor de pecho "
            + "intenso, confusión, sangrado abundante, pérdida de conciencia), acude de inmediato a un servicio "
            + "de emergencia.";

    @JsonProperty("user_id")
    private String userId;
    private String endpoint;
    private Double confidence;
    private String reasoning;

    /** Merged criteria for this turn. */
    private Map<String, Object> criterios;

    // triage
    private Integer capa;
    @JsonProperty("capa_extraida")
    private Integer rawTier;
    @JsonProperty("escalado_por_combinacion")
    private Boolean escalatedByCombination;
    private List<String> razones;
    @JsonProperty("accion_recomendada")
    private String accionRecomendada;

    @JsonProperty("requiere_mas_informacion")
    private boolean requiresMoreInformation;
    @JsonProperty("pregunta_pendiente")
    private String pendingQuestion;
    @JsonProperty("criterios_faltantes")
    private List<String> missingCriteria;

    /** Structured lookup results keyed by collection, e.g. doctores, horarios, talleres. */
    private Map<String, List<Map<String, Object>>> resultados;

    @Builder.Default
    private String advertencia = DISCLAIMER;
}
