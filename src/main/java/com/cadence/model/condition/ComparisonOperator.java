package com.cadence.model.condition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ComparisonOperator {
    EQ,
    NEQ,
    GT,
    GTE,
    LT,
    LTE,
    CONTAINS,
    NOT_CONTAINS;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns null for an operator outside the vocabulary; the evaluator
     * treats that as a false comparison.
     */
    @JsonCreator
    public static ComparisonOperator fromWireName(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ComparisonOperator op : values()) {
            if (op.name().equals(normalized)) {
                return op;
            }
        }
        return null;
    }
}
