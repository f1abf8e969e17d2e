package com.example.healthintake.risk;

import com.example.healthintake.config.DangerCombinationProperties;
import com.example.healthintake.model.RiskDecision;
import com.example.healthintake.model.RiskState;
import com.example.healthintake.model.SessionRecord;
import com.example.healthintake.model.Target;
import com.example.healthintake.model.Turn;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RiskEscalationStateMachineTest {

    private RiskEscalationStateMachine stateMachine;

    @BeforeEach
    void setUp() {
        DangerCombinationProperties properties = new DangerCombinationProperties();
        properties.setDangerCombinations(List.of(
                List.of("fiebre alta", "dolor de cabeza", "rigidez de cuello"),
                List.of("dolor de pecho", "sudoración fría")));
        stateMachine = new RiskEscalationStateMachine(new DangerCombinationTable(properties));
    }

    @Test
    void testEvaluate_ReportedTierNeverDecreases() {
        // Given
        int[] rawTiers = {2, 2, 4, 1, 3};
        RiskState state = RiskState.initial();
        List<Integer> reported = new ArrayList<>();

        // When
        for (int raw : rawTiers) {
            RiskDecision decision = stateMachine.evaluate(state, raw, List.of());
            reported.add(decision.getReportedTier());
            state = decision.toState();
        }

        // Then
        assertEquals(List.of(2, 2, 4, 4, 4), reported);
    }

    @Test
    void testEvaluate_LowerRawTierReportsHighWaterMark() {
        // Given
        RiskState prior = new RiskState(3, List.of("dolor de pecho"));

        // When
        RiskDecision decision = stateMachine.evaluate(prior, 1, List.of("cansancio"));

        // Then
        assertEquals(3, decision.getReportedTier());
        assertEquals(1, decision.getRawTier());
        assertTrue(decision.overridesExtraction());
        assertFalse(decision.isEscalatedByCombination());
    }

    @Test
    void testEvaluate_CombinationForcesEmergencyOnThirdTurn() {
        // Given
        RiskState state = RiskState.initial();

        // When
        RiskDecision first = stateMachine.evaluate(state, 2, List.of("fiebre alta"));
        RiskDecision second = stateMachine.evaluate(first.toState(), 2, List.of("dolor de cabeza"));
        RiskDecision third = stateMachine.evaluate(second.toState(), 1, List.of("Rigidez de cuello desde ayer"));

        // Then
        assertEquals(2, first.getReportedTier());
        assertEquals(2, second.getReportedTier());
        assertFalse(second.isEscalatedByCombination());
        assertEquals(4, third.getReportedTier());
        assertTrue(third.isEscalatedByCombination());
        assertEquals(1, third.getRawTier());
        assertTrue(third.getMatchedTrigger().contains("rigidez de cuello"));
        assertEquals(List.of("fiebre alta", "dolor de cabeza", "Rigidez de cuello desde ayer"), third.getReasons());
    }

    @Test
    void testEvaluate_MissingTierKeepsHighWaterMark() {
        // Given
        RiskState prior = new RiskState(3, List.of());

        // When
        RiskDecision decision = stateMachine.evaluate(prior, null, List.of());

        // Then
        assertEquals(3, decision.getReportedTier());
        assertTrue(decision.isTierMissing());
        assertNull(decision.getRawTier());
    }

    @Test
    void testEvaluate_MalformedTierTreatedAsMissing() {
        // Given
        RiskState prior = new RiskState(2, List.of());

        // When
        RiskDecision decision = stateMachine.evaluate(prior, 7, List.of());

        // Then
        assertEquals(2, decision.getReportedTier());
        assertTrue(decision.isTierMissing());
    }

    @Test
    void testEvaluate_AlreadyEmergencyIsNotFlaggedAsCombination() {
        // Given
        RiskState prior = new RiskState(4, List.of("dolor de pecho"));

        // When
        RiskDecision decision = stateMachine.evaluate(prior, 2, List.of("sudoracion fria"));

        // Then
        assertEquals(4, decision.getReportedTier());
        assertFalse(decision.isEscalatedByCombination());
        assertNotNull(decision.getMatchedTrigger());
    }

    @Test
    void testCurrentState_UsesCarriedFloorAndWindowTurns() {
        // Given
        SessionRecord session = SessionRecord.builder()
                .turns(List.of(
                        Turn.builder().message("a").target(Target.TRIAGE).field("capa", 2)
                                .field("razones", List.of("tos")).build(),
                        Turn.builder().message("b").target(Target.DOCTORS).field("especialidad", "Neumología").build()))
                .riskHighWaterMark(3)
                .dangerReasons(new ArrayList<>(List.of("fiebre alta")))
                .build();

        // When
        RiskState state = stateMachine.currentState(session);

        // Then
        assertEquals(3, state.getHighWaterMark());
        assertEquals(List.of("fiebre alta", "tos"), state.getReasons());
    }

    @Test
    void testCurrentState_NoSessionStartsAtLowestTier() {
        RiskState state = stateMachine.currentState(null);

        assertEquals(RiskState.MIN_TIER, state.getHighWaterMark());
        assertTrue(state.getReasons().isEmpty());
    }
}
