package com.cadence.service;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

/**
 * What a condition is evaluated against: the lead (for event-window and score
 * lookups) and the enrollment's state snapshot (for field comparisons).
 */
@Getter
@AllArgsConstructor
public class EvaluationContext {

    private final String tenantId;
    private final String entityId;
    private final Map<String, Object> fields;
}
