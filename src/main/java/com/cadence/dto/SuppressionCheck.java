package com.cadence.dto;

import com.cadence.model.SuppressionReason;
import lombok.*;

import java.time.Instant;

@Getter @AllArgsConstructor @ToString
public class SuppressionCheck {

    private static final SuppressionCheck CLEAR = new SuppressionCheck(false, null, null);

    private final boolean suppressed;
    private final SuppressionReason reason;
    private final Instant expiresAt;

    public static SuppressionCheck clear() {
        return CLEAR;
    }

    public static SuppressionCheck suppressed(SuppressionReason reason, Instant expiresAt) {
        return new SuppressionCheck(true, reason, expiresAt);
    }
}
