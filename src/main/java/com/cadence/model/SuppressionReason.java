package com.cadence.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SuppressionReason {
    HARD_BOUNCE,
    SPAM_COMPLAINT,
    UNSUBSCRIBED,
    MANUAL,
    FREQUENCY_CAP,
    DOMAIN_THROTTLE;

    /**
     * Derived from recent send volume rather than stored; lifts on its own.
     */
    public boolean isRateLimit() {
        return this == FREQUENCY_CAP || this == DOMAIN_THROTTLE;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SuppressionReason fromWireName(String value) {
        return value == null ? MANUAL : SuppressionReason.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
