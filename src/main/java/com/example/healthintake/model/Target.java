package com.example.healthintake.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * The three interpreters a message can be dispatched to, with the field schema each one extracts.
 */
public enum Target {
    TRIAGE("triage", "triage/interpret", List.of(
            Fields.CAPA, Fields.ESPECIALIDAD_SUGERIDA, Fields.TALLER_SUGERIDO, Fields.ACCION_RECOMENDADA)),
    DOCTORS("doctors", "doctors/interpret", List.of(
            Fields.ESPECIALIDAD, Fields.SUBESPECIALIDAD, Fields.GENERO_PREFERIDO, Fields.IDIOMA_PREFERIDO,
            Fields.MODALIDAD, Fields.FECHA, Fields.DIA_SEMANA, Fields.HORA_PREFERIDA,
            Fields.DEPARTAMENTO, Fields.DISTRITO)),
    WORKSHOPS("workshops", "workshops/interpret", List.of(
            Fields.TOPIC, Fields.DATE, Fields.TIME_OF_DAY, Fields.MODALITY, Fields.LOCATION));

    private final String wireName;
    private final String endpoint;
    private final List<String> fields;

    Target(String wireName, String endpoint, List<String> fields) {
        this.wireName = wireName;
        this.endpoint = endpoint;
        this.fields = fields;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getEndpoint() {
        return endpoint;
    }

    /**
     * Scalar fields this target extracts, in a fixed order. Triage reasons are carried separately.
     */
    public List<String> getFields() {
        return fields;
    }

    /**
     * Targets whose turns feed this target's accumulated context. Triage turns are visible to the
     * doctors interpreter so a suggested specialty carries over; workshop turns stay isolated.
     */
    public Set<Target> contextSources() {
        switch (this) {
            case DOCTORS:
                return EnumSet.of(DOCTORS, TRIAGE);
            case WORKSHOPS:
                return EnumSet.of(WORKSHOPS);
            default:
                return EnumSet.of(TRIAGE);
        }
    }

    public boolean collectsReasons() {
        return contextSources().contains(TRIAGE);
    }

    @JsonCreator
    public static Target fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Target must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        for (Target target : values()) {
            if (target.wireName.equals(normalized) || target.endpoint.equals(normalized)
                    || target.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return target;
            }
        }
        throw new IllegalArgumentException("Unknown target: " + value);
    }
}
