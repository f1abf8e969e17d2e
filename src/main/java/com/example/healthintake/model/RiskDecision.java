package com.example.healthintake.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Outcome of one escalation step for the current triage turn.
 */
@Value
@Builder
public class RiskDecision {
    /** Tier reported to the user: the new high-water mark. */
    int reportedTier;
    /** Tier the extraction produced for this turn in isolation, null when missing or malformed. */
    Integer rawTier;
    boolean tierMissing;
    boolean escalatedByCombination;
    Set<String> matchedTrigger;
    List<String> reasons;

    public RiskState toState() {
        return new RiskState(reportedTier, reasons);
    }

    /**
     * True when the reported tier differs from what the extraction said on its own, so any action the
     * extraction attached to its tier no longer applies.
     */
    public boolean overridesExtraction() {
        return rawTier == null || reportedTier != rawTier;
    }
}
