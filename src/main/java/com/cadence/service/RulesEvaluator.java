package com.cadence.service;

import com.cadence.model.condition.*;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Answers yes/no questions about a lead from a declarative condition tree.
 *
 * Supported conditions:
 *   - always_true                          → true
 *   - and / or                             → short-circuit over sub-conditions
 *   - event_window(type, window, min)      → count of the lead's events in the window >= min
 *   - field_compare(field, op, value)      → snapshot field vs literal
 *   - score_threshold(op, value)           → current decayed score vs number
 *
 * Operators: eq, neq, gt, gte, lt, lte, contains, not_contains.
 *
 * Evaluation only reads. A condition that cannot be understood (unknown type,
 * unknown operator, malformed config) evaluates to false and is logged, so a
 * bad configuration degrades one branch instead of halting the engine.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RulesEvaluator {

    private final EventIngestionService eventStore;
    private final LeadScoringService leadScoring;
    private final ObjectMapper objectMapper;

    public boolean evaluate(Condition condition, EvaluationContext ctx) {
        if (condition == null) {
            log.warn("Missing condition for {}:{}, evaluating to false", ctx.getTenantId(), ctx.getEntityId());
            return false;
        }
        if (condition instanceof AlwaysTrueCondition) {
            return true;
        }
        if (condition instanceof AndCondition) {
            for (Condition child : nonNull(((AndCondition) condition).getConditions())) {
                if (!evaluate(child, ctx)) {
                    return false;
                }
            }
            return true;
        }
        if (condition instanceof OrCondition) {
            for (Condition child : nonNull(((OrCondition) condition).getConditions())) {
                if (evaluate(child, ctx)) {
                    return true;
                }
            }
            return false;
        }
        if (condition instanceof EventWindowCondition) {
            return evaluateEventWindow((EventWindowCondition) condition, ctx);
        }
        if (condition instanceof FieldCompareCondition) {
            FieldCompareCondition fc = (FieldCompareCondition) condition;
            Object actual = ctx.getFields() == null ? null : ctx.getFields().get(fc.getField());
            return compare(actual, fc.getOperator(), fc.getValue());
        }
        if (condition instanceof ScoreThresholdCondition) {
            ScoreThresholdCondition st = (ScoreThresholdCondition) condition;
            int score = leadScoring.getLeadScore(ctx.getTenantId(), ctx.getEntityId());
            return compare(score, st.getOperator(), st.getValue());
        }

        String type = condition instanceof UnknownCondition
                ? ((UnknownCondition) condition).getType()
                : condition.getClass().getSimpleName();
        log.warn("Unknown condition type '{}', evaluating to false", type);
        return false;
    }

    /**
     * Reads a condition tree from node config (a JSON map). Anything that does
     * not bind reads as an {@link UnknownCondition}.
     */
    public Condition parse(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Condition) {
            return (Condition) raw;
        }
        try {
            return objectMapper.convertValue(raw, Condition.class);
        } catch (IllegalArgumentException e) {
            log.warn("Malformed condition {}: {}", raw, e.getMessage());
            return new UnknownCondition("malformed");
        }
    }

    private boolean evaluateEventWindow(EventWindowCondition condition, EvaluationContext ctx) {
        if (condition.getEventType() == null || condition.getWindowMs() <= 0) {
            log.warn("event_window condition without event_type or window_ms, evaluating to false");
            return false;
        }
        int count = eventStore.getEventsInWindow(ctx.getTenantId(), ctx.getEntityId(),
                condition.getEventType(), Duration.ofMillis(condition.getWindowMs())).size();
        return count >= condition.effectiveMinCount();
    }

    boolean compare(Object actual, ComparisonOperator operator, Object expected) {
        if (operator == null) {
            log.warn("Unknown comparison operator, evaluating to false");
            return false;
        }
        return switch (operator) {
            case EQ -> valuesEqual(actual, expected);
            case NEQ -> !valuesEqual(actual, expected);
            case GT, GTE, LT, LTE -> compareOrdered(actual, expected, operator);
            case CONTAINS -> actual != null && String.valueOf(actual).contains(String.valueOf(expected));
            case NOT_CONTAINS -> actual == null || !String.valueOf(actual).contains(String.valueOf(expected));
        };
    }

    private boolean valuesEqual(Object actual, Object expected) {
        if (actual instanceof Number && expected instanceof Number) {
            return Double.compare(((Number) actual).doubleValue(), ((Number) expected).doubleValue()) == 0;
        }
        return Objects.equals(actual, expected);
    }

    private boolean compareOrdered(Object actual, Object expected, ComparisonOperator operator) {
        if (actual == null || expected == null) {
            return false;
        }
        int cmp;
        Double a = asNumber(actual);
        Double e = asNumber(expected);
        if (a != null && e != null) {
            cmp = Double.compare(a, e);
        } else if (actual instanceof String && expected instanceof String) {
            cmp = ((String) actual).compareTo((String) expected);
        } else {
            return false;
        }
        return switch (operator) {
            case GT -> cmp > 0;
            case GTE -> cmp >= 0;
            case LT -> cmp < 0;
            case LTE -> cmp <= 0;
            default -> false;
        };
    }

    private Double asNumber(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    private static List<Condition> nonNull(List<Condition> conditions) {
        return conditions == null ? List.of() : conditions;
    }
}
