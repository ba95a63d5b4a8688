package com.cadence.model.condition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

/**
 * Compares a field of the enrollment's state snapshot against a literal.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class FieldCompareCondition implements Condition {

    private String field;

    private ComparisonOperator operator;

    private Object value;
}
