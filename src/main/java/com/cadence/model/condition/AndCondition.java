package com.cadence.model.condition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * True when every sub-condition is true. Evaluation stops at the first false.
 * An empty list is true.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class AndCondition implements Condition {

    @Builder.Default
    private List<Condition> conditions = new ArrayList<>();
}
