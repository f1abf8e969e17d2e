package com.example.healthintake.dispatch;

import com.example.healthintake.context.FieldValues;
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

import java.util.*;

/**
 * Doctor search. A triage specialty suggestion stands in for an explicit specialty.
 */
@Component
public class DoctorInterpreter extends AbstractLlmInterpreter {

    private static final Logger logger = LoggerFactory.getLogger(DoctorInterpreter.class);

    static final Map<String, String> QUESTIONS = Map.of(
            Fields.ESPECIALIDAD, "¿Con qué especialidad médica te gustaría atenderte?",
            Fields.MODALIDAD, "¿Prefieres una consulta presencial o virtual?",
            Fields.DISTRITO, "¿En qué distrito o departamento te gustaría atenderte?");

    private static final List<String> DOCTOR_FILTERS = List.of(
            Fields.ESPECIALIDAD, Fields.SUBESPECIALIDAD, Fields.DEPARTAMENTO, Fields.DISTRITO,
            Fields.GENERO_PREFERIDO, Fields.IDIOMA_PREFERIDO, Fields.MODALIDAD);

    private final DirectoryClient directory;

    @Value("${app.directory.max-results:5}")
    private int maxResults;

    public DoctorInterpreter(LlmExtractionClient llm, ExtractionParser parser, ObjectMapper objectMapper,
                             DirectoryClient directory,
                             @Value("classpath:prompts/doctors.txt") Resource systemPrompt) {
        super(llm, parser, objectMapper, systemPrompt);
        this.directory = directory;
    }

    @Override
    public Target target() {
        return Target.DOCTORS;
    }

    @Override
    public List<String> missingCriteria(AccumulatedContext context) {
        List<String> missing = new ArrayList<>();
        if (!context.has(Fields.ESPECIALIDAD) && !context.has(Fields.ESPECIALIDAD_SUGERIDA)) {
            missing.add(Fields.ESPECIALIDAD);
        }
        if (!context.has(Fields.MODALIDAD)) {
            missing.add(Fields.MODALIDAD);
        } else if (isInPerson(context.stringValue(Fields.MODALIDAD))
                && !context.has(Fields.DISTRITO) && !context.has(Fields.DEPARTAMENTO)) {
            missing.add(Fields.DISTRITO);
        }
        return missing;
    }

    @Override
    public String questionFor(List<String> missingCriteria) {
        return missingCriteria.isEmpty() ? null : QUESTIONS.get(missingCriteria.get(0));
    }

    @Override
    public Map<String, List<Map<String, Object>>> lookup(AccumulatedContext context) {
        Map<String, Object> criteria = new LinkedHashMap<>();
        for (String field : DOCTOR_FILTERS) {
            if (context.has(field)) {
                criteria.put(field, context.value(field));
            }
        }
        if (!criteria.containsKey(Fields.ESPECIALIDAD) && context.has(Fields.ESPECIALIDAD_SUGERIDA)) {
            criteria.put(Fields.ESPECIALIDAD, context.value(Fields.ESPECIALIDAD_SUGERIDA));
        }
        if (criteria.isEmpty()) {
            return Map.of();
        }
        if (context.has(Fields.DIA_SEMANA)) {
            criteria.put(Fields.DIA_SEMANA, context.value(Fields.DIA_SEMANA));
        }

        try {
            List<Map<String, Object>> doctors = directory.findDoctors(criteria, maxResults);
            List<String> ids = new ArrayList<>();
            for (Map<String, Object> doctor : doctors) {
                Object id = doctor.get("doctor_id");
                if (id != null) ids.add(id.toString());
            }
            List<Map<String, Object>> schedules = directory.findSchedules(ids, criteria, maxResults * 4);
            logger.debug("Doctor lookup {} -> {} doctors, {} schedules", criteria, doctors.size(), schedules.size());

            Map<String, List<Map<String, Object>>> results = new LinkedHashMap<>();
            results.put("doctores", doctors);
            results.put("horarios", schedules);
            return results;
        } catch (RuntimeException e) {
            logger.warn("Doctor lookup failed for {}: {}", criteria, e.getMessage());
            return Map.of();
        }
    }

    private static boolean isInPerson(String modality) {
        String normalized = modality == null ? "" : FieldValues.normalize(modality);
        return normalized.equals("presencial") || normalized.equals("in person");
    }
}
