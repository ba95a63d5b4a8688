package com.cadence.dto;

import com.cadence.model.ScoreTier;
import lombok.*;

import java.time.Instant;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class LeadScoreResponse {
    private String entityId;
    // Decayed, as used by branch conditions
    private int score;
    private ScoreTier tier;
    // As stored at lastActivityAt
    private int rawScore;
    private Instant lastActivityAt;
}
