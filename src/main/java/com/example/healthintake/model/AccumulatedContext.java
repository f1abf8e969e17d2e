package com.example.healthintake.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Effective fact set handed to an interpreter. Derived from the session, never persisted.
 */
@Value
public class AccumulatedContext {
    Target target;
    Map<String, FieldValue> fields;
    /** Ordered, de-duplicated union of every triage reason seen in the session. */
    List<String> reasons;
    /** Question asked on the newest turn, which the incoming message is expected to answer. */
    String pendingQuestion;

    public AccumulatedContext(Target target, Map<String, FieldValue> fields, List<String> reasons,
                              String pendingQuestion) {
        this.target = target;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.reasons = List.copyOf(reasons);
        this.pendingQuestion = pendingQuestion;
    }

    public static AccumulatedContext empty(Target target) {
        return new AccumulatedContext(target, Map.of(), List.of(), null);
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public Object value(String field) {
        FieldValue fieldValue = fields.get(field);
        return fieldValue != null ? fieldValue.getValue() : null;
    }

    public String stringValue(String field) {
        Object value = value(field);
        return value != null ? value.toString() : null;
    }

    public boolean isEmpty() {
        return fields.isEmpty() && reasons.isEmpty();
    }

    /**
     * Flat field to value view, with the reasons under {@link Fields#RAZONES} when present.
     */
    public Map<String, Object> asValueMap() {
        Map<String, Object> values = new LinkedHashMap<>();
        fields.forEach((name, fieldValue) -> values.put(name, fieldValue.getValue()));
        if (!reasons.isEmpty()) {
            values.put(Fields.RAZONES, reasons);
        }
        return values;
    }

    public List<String> missing(Collection<String> required) {
        List<String> missing = new ArrayList<>();
        for (String field : required) {
            if (!has(field)) {
                missing.add(field);
            }
        }
        return missing;
    }
}
