package com.example.healthintake.risk;

import com.example.healthintake.config.DangerCombinationProperties;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DangerCombinationTableTest {

    @Test
    void testMatch_SubsetInAnyOrder() {
        // Given
        DangerCombinationTable table = table(List.of(List.of("Dolor de pecho", "sudoración fría")));

        // When
        Optional<Set<String>> match = table.match(List.of("sudoracion fria", "náuseas", "dolor de pecho intenso"));

        // Then
        assertTrue(match.isPresent());
        assertEquals(Set.of("dolor de pecho", "sudoracion fria"), match.get());
    }

    @Test
    void testMatch_PartialCombinationDoesNotMatch() {
        DangerCombinationTable table = table(List.of(List.of("fiebre alta", "dolor de cabeza", "rigidez de cuello")));

        assertTrue(table.match(List.of("fiebre alta", "dolor de cabeza")).isEmpty());
    }

    @Test
    void testMatch_RequiresWholeWords() {
        DangerCombinationTable table = table(List.of(List.of("fiebre", "convulsiones")));

        assertTrue(table.match(List.of("fiebres", "convulsiones")).isEmpty());
    }

    @Test
    void testConstructor_SkipsEmptyCombinations() {
        DangerCombinationTable table = table(List.of(List.of(" "), List.of("fiebre alta", "convulsiones")));

        assertEquals(1, table.size());
    }

    private static DangerCombinationTable table(List<List<String>> combinations) {
        DangerCombinationProperties properties = new DangerCombinationProperties();
        properties.setDangerCombinations(combinations);
        return new DangerCombinationTable(properties);
    }
}
