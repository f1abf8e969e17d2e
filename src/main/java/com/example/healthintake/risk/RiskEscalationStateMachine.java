package com.example.healthintake.risk;

import com.example.healthintake.context.FieldValues;
import com.example.healthintake.model.Fields;
import com.example.healthintake.model.RiskDecision;
import com.example.healthintake.model.RiskState;
import com.example.healthintake.model.SessionRecord;
import com.example.healthintake.model.Target;
import com.example.healthintake.model.Turn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Monotonic urgency tracking for a session.
 *
 * <p>The tier reported for a turn is {@code max(highWaterMark, newTier)}, so a session never
 * de-escalates. When the reasons accumulated across the whole session cover a danger combination,
 * the tier is forced to {@link RiskState#EMERGENCY_TIER}. A missing or malformed tier keeps the
 * current high-water mark. Tier 4 is terminal until the session expires.
 */
@Component
public class RiskEscalationStateMachine {

    private static final Logger logger = LoggerFactory.getLogger(RiskEscalationStateMachine.class);

    private final DangerCombinationTable dangerCombinations;

    public RiskEscalationStateMachine(DangerCombinationTable dangerCombinations) {
        this.dangerCombinations = dangerCombinations;
    }

    /**
     * Risk state of a session snapshot: the carried floor plus whatever triage turns are still in the window.
     */
    public RiskState currentState(SessionRecord session) {
        if (session == null || !session.hasTurns()) {
            return RiskState.initial();
        }
        int highWaterMark = RiskState.MIN_TIER;
        if (RiskState.isValidTier(session.getRiskHighWaterMark())) {
            highWaterMark = session.getRiskHighWaterMark();
        }
        List<String> reasons = session.getDangerReasons() != null ? session.getDangerReasons() : List.of();
        for (Turn turn : session.getTurns()) {
            if (turn.getTarget() != Target.TRIAGE) {
                continue;
            }
            Integer tier = RiskState.tierOf(turn.getFields().get(Fields.CAPA));
            if (tier != null) {
                highWaterMark = Math.max(highWaterMark, tier);
            }
            reasons = FieldValues.unionReasons(reasons, FieldValues.toStringList(turn.getFields().get(Fields.RAZONES)));
        }
        return new RiskState(highWaterMark, reasons);
    }

    /**
     * Applies one turn's raw extraction to the prior state.
     *
     * @param prior          state before this turn
     * @param rawTier        tier the extraction produced for this turn alone, may be null
     * @param currentReasons reasons extracted from this turn
     */
    public RiskDecision evaluate(RiskState prior, Integer rawTier, List<String> currentReasons) {
        RiskState state = prior != null ? prior : RiskState.initial();
        List<String> reasons = FieldValues.unionReasons(state.getReasons(),
                currentReasons != null ? currentReasons : List.of());

        Integer validTier = RiskState.isValidTier(rawTier) ? rawTier : null;
        boolean tierMissing = validTier == null;
        if (tierMissing) {
            logger.warn("Risk tier missing or malformed ({}), keeping high-water mark {}", rawTier, state.getHighWaterMark());
        }

        int candidate = tierMissing ? state.getHighWaterMark() : validTier;
        Optional<Set<String>> trigger = dangerCombinations.match(reasons);
        boolean escalatedByCombination = false;
        if (trigger.isPresent() && Math.max(candidate, state.getHighWaterMark()) < RiskState.EMERGENCY_TIER) {
            escalatedByCombination = true;
            candidate = RiskState.EMERGENCY_TIER;
            logger.info("Danger combination {} matched, forcing tier {}", trigger.get(), RiskState.EMERGENCY_TIER);
        }

        int reported = Math.max(state.getHighWaterMark(), candidate);
        if (!tierMissing && reported > validTier) {
            logger.info("Reporting tier {} instead of extracted tier {}", reported, validTier);
        }

        return RiskDecision.builder()
                .reportedTier(reported)
                .rawTier(validTier)
                .tierMissing(tierMissing)
                .escalatedByCombination(escalatedByCombination)
                .matchedTrigger(trigger.orElse(null))
                .reasons(reasons)
                .build();
    }
}
