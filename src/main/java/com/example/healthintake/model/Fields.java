package com.example.healthintake.model;

/**
 * Wire names of the extracted fields. They match the JSON keys the interpreters produce.
 */
public final class Fields {

    // triage
    public static final String CAPA = "capa";
    public static final String RAZONES = "razones";
    public static final String ESPECIALIDAD_SUGERIDA = "especialidad_sugerida";
    public static final String TALLER_SUGERIDO = "taller_sugerido";
    public static final String ACCION_RECOMENDADA = "accion_recomendada";

    // doctors
    public static final String ESPECIALIDAD = "especialidad";
    public static final String SUBESPECIALIDAD = "subespecialidad";
    public static final String GENERO_PREFERIDO = "genero_preferido";
    public static final String IDIOMA_PREFERIDO = "idioma_preferido";
    public static final String MODALIDAD = "modalidad";
    public static final String FECHA = "fecha";
    public static final String DIA_SEMANA = "dia_semana";
    public static final String HORA_PREFERIDA = "hora_preferida";
    public static final String DEPARTAMENTO = "departamento";
    public static final String DISTRITO = "distrito";

    // workshops
    public static final String TOPIC = "topic";
    public static final String DATE = "date";
    public static final String TIME_OF_DAY = "time_of_day";
    public static final String MODALITY = "modality";
    public static final String LOCATION = "location";

    private Fields() {
    }
}
