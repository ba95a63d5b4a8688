package com.cadence.model.condition;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A node of a declarative condition tree, as stored in branch and wait node config.
 *
 * The set of variants is closed and keyed by the "type" property:
 *   {"type": "always_true"}
 *   {"type": "and", "conditions": [...]}
 *   {"type": "or", "conditions": [...]}
 *   {"type": "event_window", "event_type": "email_replied", "window_ms": 604800000, "min_count": 1}
 *   {"type": "field_compare", "field": "industry", "operator": "eq", "value": "saas"}
 *   {"type": "score_threshold", "operator": "gte", "value": 60}
 *
 * Anything else (or a missing type) reads as {@link UnknownCondition}.
 */
@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.PROPERTY,
        property = "type",
        visible = true,
        defaultImpl = UnknownCondition.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = AlwaysTrueCondition.class, name = "always_true"),
        @JsonSubTypes.Type(value = AndCondition.class, name = "and"),
        @JsonSubTypes.Type(value = OrCondition.class, name = "or"),
        @JsonSubTypes.Type(value = EventWindowCondition.class, name = "event_window"),
        @JsonSubTypes.Type(value = FieldCompareCondition.class, name = "field_compare"),
        @JsonSubTypes.Type(value = ScoreThresholdCondition.class, name = "score_threshold")
})
public interface Condition {
}
