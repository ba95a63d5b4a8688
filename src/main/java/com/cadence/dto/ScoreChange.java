package com.cadence.dto;

import com.cadence.model.ScoreTier;
import lombok.*;

/**
 * Result of a non-zero score update: the decayed score it started from,
 * the persisted result, and the delta applied.
 */
@Getter @AllArgsConstructor @ToString
public class ScoreChange {
    private final int previous;
    private final int score;
    private final ScoreTier tier;
    private final int delta;
}
