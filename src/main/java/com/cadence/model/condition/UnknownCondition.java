package com.cadence.model.condition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

/**
 * Placeholder for a condition whose type is outside the supported vocabulary.
 * Always evaluates to false.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UnknownCondition implements Condition {

    private String type;
}
