package com.cadence.model.condition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * True when any sub-condition is true. Evaluation stops at the first true.
 * An empty list is false.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class OrCondition implements Condition {

    @Builder.Default
    private List<Condition> conditions = new ArrayList<>();
}
