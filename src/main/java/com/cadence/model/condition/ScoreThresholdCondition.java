package com.cadence.model.condition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

/**
 * Compares the lead's current decayed score against a number.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScoreThresholdCondition implements Condition {

    private ComparisonOperator operator;

    private double value;
}
