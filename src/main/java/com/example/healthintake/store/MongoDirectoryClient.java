package com.example.healthintake.store;

import com.example.healthintake.context.FieldValues;
import com.example.healthintake.model.Fields;
import org.bson.Document;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Component
public class MongoDirectoryClient implements DirectoryClient {

    static final String DOCTORS = "doctores";
    static final String SCHEDULES = "horarios_doctores";
    static final String WORKSHOPS = "talleres";
    static final String EVENTS = "events";

    private static final Map<Character, String> ACCENT_CLASSES = Map.of(
            'a', "[aáàä]", 'e', "[eéèë]", 'i', "[iíìï]", 'o', "[oóòö]", 'u', "[uúùü]", 'n', "[nñ]");

    private final MongoTemplate mongo;

    @Autowired
    public MongoDirectoryClient(MongoTemplate mongo) {
        this.mongo = mongo;
    }

    @Override
    public List<Map<String, Object>> findDoctors(Map<String, Object> criteria, int limit) {
        List<Criteria> filters = new ArrayList<>();
        equalsIgnoringAccents(filters, "especialidad", criteria.get(Fields.ESPECIALIDAD));
        equalsIgnoringAccents(filters, "subespecialidad", criteria.get(Fields.SUBESPECIALIDAD));
        equalsIgnoringAccents(filters, "departamento", criteria.get(Fields.DEPARTAMENTO));
        equalsIgnoringAccents(filters, "distrito", criteria.get(Fields.DISTRITO));
        equalsIgnoringAccents(filters, "genero", criteria.get(Fields.GENERO_PREFERIDO));
        containsIgnoringAccents(filters, "idiomas", criteria.get(Fields.IDIOMA_PREFERIDO));
        containsIgnoringAccents(filters, "tipo_consulta", criteria.get(Fields.MODALIDAD));

        Query q = query(filters).with(Sort.by(Sort.Direction.ASC, "doctor_id"));
        return find(q, limit, DOCTORS);
    }

    @Override
    public List<Map<String, Object>> findSchedules(Collection<String> doctorIds, Map<String, Object> criteria, int limit) {
        if (doctorIds == null || doctorIds.isEmpty()) {
            return List.of();
        }
        List<Criteria> filters = new ArrayList<>();
        filters.add(Criteria.where("doctor_id").in(doctorIds));
        equalsIgnoringAccents(filters, "dia_semana", criteria.get(Fields.DIA_SEMANA));
        containsIgnoringAccents(filters, "modo", criteria.get(Fields.MODALIDAD));

        Query q = query(filters).with(Sort.by(Sort.Direction.ASC, "doctor_id", "dia_semana", "hora_inicio"));
        return find(q, limit, SCHEDULES);
    }

    @Override
    public List<Map<String, Object>> findWorkshops(Map<String, Object> filters, int limit) {
        List<Criteria> criteria = new ArrayList<>();
        containsIgnoringAccents(criteria, "topic", filters.get(Fields.TOPIC));
        containsIgnoringAccents(criteria, "modality", filters.get(Fields.MODALITY));
        Object date = filters.get(Fields.DATE);
        if (isFilterValue(date)) {
            criteria.add(Criteria.where("date").is(date.toString().trim()));
        }

        Query q = query(criteria).with(Sort.by(Sort.Direction.ASC, "date", "start_time"));
        return find(q, limit, WORKSHOPS);
    }

    @Override
    public void appendEvent(String userId, Map<String, Object> event) {
        Document e = new Document(event);
        e.put("userId", userId);
        e.put("ts", new Date());
        mongo.insert(e, EVENTS);
    }

    @Override
    public boolean ping() {
        Document reply = mongo.executeCommand(new Document("ping", 1));
        Object ok = reply.get("ok");
        return ok instanceof Number && ((Number) ok).doubleValue() == 1.0;
    }

    private List<Map<String, Object>> find(Query q, int limit, String collection) {
        if (limit > 0) q.limit(limit);
        q.fields().exclude("_id");
        List<Document> docs = mongo.find(q, Document.class, collection);
        return docs.stream().map(d -> (Map<String, Object>) d).collect(Collectors.toList());
    }

    private static Query query(List<Criteria> filters) {
        return filters.isEmpty()
                ? new Query()
                : new Query(new Criteria().andOperator(filters.toArray(new Criteria[0])));
    }

    private static void equalsIgnoringAccents(List<Criteria> filters, String field, Object value) {
        if (isFilterValue(value)) {
            filters.add(Criteria.where(field).regex("^" + accentInsensitive(value.toString()) + "$", "i"));
        }
    }

    private static void containsIgnoringAccents(List<Criteria> filters, String field, Object value) {
        if (isFilterValue(value)) {
            filters.add(Criteria.where(field).regex(accentInsensitive(value.toString()), "i"));
        }
    }

    private static boolean isFilterValue(Object value) {
        if (value == null || value instanceof Collection || value instanceof Map || FieldValues.isAbsent(value)) {
            return false;
        }
        String normalized = FieldValues.normalize(value.toString());
        return !normalized.equals("any") && !normalized.equals("cualquiera");
    }

    /**
     * Regex matching the text with or without Spanish accents, everything else quoted literally.
     */
    static String accentInsensitive(String text) {
        String stripped = Normalizer.normalize(text.trim(), Normalizer.Form.NFD)
                .replaceAll("\\p{M}", "")
                .toLowerCase(Locale.ROOT);
        StringBuilder regex = new StringBuilder();
        for (char c : stripped.toCharArray()) {
            String cls = ACCENT_CLASSES.get(c);
            regex.append(cls != null ? cls : Pattern.quote(String.valueOf(c)));
        }
        return regex.toString();
    }
}
