package com.example.healthintake.context;

import com.example.healthintake.model.AccumulatedContext;
import com.example.healthintake.model.FieldValue;
import com.example.healthintake.model.Target;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CriteriaAccumulatorTest {

    private final CriteriaAccumulator accumulator = new CriteriaAccumulator();

    @Test
    void testAccumulate_FieldPersistsWhenTurnOmitsIt() {
        // Given
        AccumulatedContext prior = doctorsContext(Map.of("especialidad", FieldValue.fromTurn("Cardiología", 0)));

        // When
        AccumulatedContext merged = accumulator.accumulate(prior, Map.of("modalidad", "virtual"));

        // Then
        assertEquals("Cardiología", merged.value("especialidad"));
        assertEquals(0, merged.getFields().get("especialidad").getSourceTurn());
        assertEquals("virtual", merged.value("modalidad"));
        assertTrue(merged.getFields().get("modalidad").isFromCurrentTurn());
    }

    @Test
    void testAccumulate_ContradictionOverrides() {
        // Given
        AccumulatedContext prior = doctorsContext(Map.of("especialidad", FieldValue.fromTurn("Cardiología", 0)));

        // When
        AccumulatedContext merged = accumulator.accumulate(prior, Map.of("especialidad", "Neurología"));

        // Then
        assertEquals("Neurología", merged.value("especialidad"));
        assertTrue(merged.getFields().get("especialidad").isFromCurrentTurn());
    }

    @Test
    void testAccumulate_SameMeaningKeepsPriorProvenance() {
        // Given
        AccumulatedContext prior = doctorsContext(Map.of("especialidad", FieldValue.fromTurn("Cardiología", 2)));

        // When
        AccumulatedContext merged = accumulator.accumulate(prior, Map.of("especialidad", "cardiologia"));

        // Then
        assertEquals("Cardiología", merged.value("especialidad"));
        assertEquals(2, merged.getFields().get("especialidad").getSourceTurn());
    }

    @Test
    void testAccumulate_NeverFabricatesFields() {
        // Given
        AccumulatedContext prior = doctorsContext(Map.of("especialidad", FieldValue.fromTurn("Cardiología", 0)));
        Map<String, Object> current = new LinkedHashMap<>();
        current.put("distrito", null);
        current.put("fecha", " ");

        // When
        AccumulatedContext merged = accumulator.accumulate(prior, current);

        // Then
        assertFalse(merged.getFields().containsKey("distrito"));
        assertFalse(merged.getFields().containsKey("fecha"));
        assertFalse(merged.getFields().containsKey("modalidad"));
        assertEquals(1, merged.getFields().size());
    }

    @Test
    void testAccumulate_AbsentValueDoesNotEraseCorrection() {
        // Given
        AccumulatedContext prior = doctorsContext(Map.of("modalidad", FieldValue.fromTurn("presencial", 1)));

        // When
        AccumulatedContext merged = accumulator.accumulate(prior, Map.of("modalidad", "null"));

        // Then
        assertEquals("presencial", merged.value("modalidad"));
    }

    @Test
    void testAccumulate_ReasonsAreUnioned() {
        // Given
        AccumulatedContext prior = new AccumulatedContext(Target.TRIAGE, Map.of(), List.of("fiebre alta"), null);

        // When
        AccumulatedContext merged = accumulator.accumulate(prior,
                Map.of("razones", List.of("Fiebre  alta", "dolor de cabeza")));

        // Then
        assertEquals(List.of("fiebre alta", "dolor de cabeza"), merged.getReasons());
        assertFalse(merged.has("razones"));
    }

    @Test
    void testAccumulate_IsDeterministic() {
        // Given
        AccumulatedContext prior = doctorsContext(Map.of(
                "especialidad", FieldValue.fromTurn("Cardiología", 0),
                "distrito", FieldValue.fromTurn("Miraflores", 1)));
        Map<String, Object> current = Map.of("distrito", "San Isidro", "modalidad", "presencial", "fecha", "2025-03-07");

        // When
        AccumulatedContext first = accumulator.accumulate(prior, current);
        AccumulatedContext second = accumulator.accumulate(prior, new LinkedHashMap<>(current));

        // Then
        assertEquals(first, second);
        assertEquals("San Isidro", first.value("distrito"));
    }

    @Test
    void testAccumulate_NumericTierComparedByValue() {
        // Given
        AccumulatedContext prior = new AccumulatedContext(Target.TRIAGE,
                Map.of("capa", FieldValue.fromTurn(3, 0)), List.of(), null);

        // When
        AccumulatedContext merged = accumulator.accumulate(prior, Map.of("capa", 3L));

        // Then
        assertEquals(0, merged.getFields().get("capa").getSourceTurn());
    }

    private static AccumulatedContext doctorsContext(Map<String, FieldValue> fields) {
        return new AccumulatedContext(Target.DOCTORS, fields, List.of(), null);
    }
}
