package com.example.healthintake.model;

import lombok.Value;

/**
 * An accumulated field value together with the turn it came from.
 */
@Value
public class FieldValue {

    /** Source index used for values supplied by the turn being processed. */
    public static final int CURRENT_TURN = -1;

    Object value;
    /** Index into the session's turn list, or {@link #CURRENT_TURN}. */
    int sourceTurn;

    public static FieldValue fromTurn(Object value, int turnIndex) {
        return new FieldValue(value, turnIndex);
    }

    public static FieldValue fromCurrentTurn(Object value) {
        return new FieldValue(value, CURRENT_TURN);
    }

    public boolean isFromCurrentTurn() {
        return sourceTurn == CURRENT_TURN;
    }
}
