package com.example.healthintake.model;

import lombok.Value;

import java.util.List;

/**
 * Highest urgency tier observed in a session and the reasons that contributed to it.
 */
@Value
public class RiskState {

    public static final int MIN_TIER = 1;
    public static final int EMERGENCY_TIER = 4;

    int highWaterMark;
    List<String> reasons;

    public RiskState(int highWaterMark, List<String> reasons) {
        this.highWaterMark = highWaterMark;
        this.reasons = List.copyOf(reasons);
    }

    public static RiskState initial() {
        return new RiskState(MIN_TIER, List.of());
    }

    public boolean isEmergency() {
        return highWaterMark >= EMERGENCY_TIER;
    }

    public static boolean isValidTier(Integer tier) {
        return tier != null && tier >= MIN_TIER && tier <= EMERGENCY_TIER;
    }

    /**
     * Reads a tier from an extracted value (number or numeric text). Returns null for anything that
     * is not a whole tier between 1 and 4.
     */
    public static Integer tierOf(Object value) {
        Integer tier = null;
        if (value instanceof Number) {
            double number = ((Number) value).doubleValue();
            if (number == Math.rint(number)) {
                tier = (int) number;
            }
        } else if (value instanceof String) {
            try {
                tier = Integer.valueOf(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return isValidTier(tier) ? tier : null;
    }
}
