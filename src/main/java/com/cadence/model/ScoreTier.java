package com.cadence.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse engagement bucket derived from a lead score.
 *
 * Boundaries are inclusive upper bounds:
 *   0–20   COLD
 *   21–60  WARM
 *   61–120 HOT
 *   121+   SALES_READY
 *
 * {@link #of(int)} is the only place a tier is ever computed. Stored tiers,
 * API responses and branch conditions all go through it.
 */
public enum ScoreTier {
    COLD,
    WARM,
    HOT,
    SALES_READY;

    public static ScoreTier of(int score) {
        if (score <= 20) return COLD;
        if (score <= 60) return WARM;
        if (score <= 120) return HOT;
        return SALES_READY;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
