package com.cadence.service;

import com.cadence.model.CrmEvent;
import com.cadence.model.EventType;
import com.cadence.model.condition.*;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the RulesEvaluator: every branch in a workflow is decided here,
 * so each condition type, operator and degradation path is covered.
 */
@ExtendWith(MockitoExtension.class)
class RulesEvaluatorTest {

    private static final String TENANT = "acme";
    private static final String LEAD = "lead-1";

    @Mock private EventIngestionService eventStore;
    @Mock private LeadScoringService leadScoring;
    @Spy  private ObjectMapper objectMapper = new ObjectMapper();

    @InjectMocks
    private RulesEvaluator evaluator;

    private EvaluationContext ctx(Map<String, Object> fields) {
        return new EvaluationContext(TENANT, LEAD, fields);
    }

    private static FieldCompareCondition field(String name, ComparisonOperator op, Object value) {
        return new FieldCompareCondition(name, op, value);
    }

    @Nested
    @DisplayName("Composites")
    class CompositeTests {

        @Test
        @DisplayName("always_true is true")
        void alwaysTrue() {
            assertTrue(evaluator.evaluate(new AlwaysTrueCondition(), ctx(Map.of())));
        }

        @Test
        @DisplayName("and stops at the first false child")
        void andShortCircuits() {
            AndCondition and = new AndCondition(List.of(
                    field("plan", ComparisonOperator.EQ, "pro"),
                    new ScoreThresholdCondition(ComparisonOperator.GTE, 60)));

            assertFalse(evaluator.evaluate(and, ctx(Map.of("plan", "free"))));
            verifyNoInteractions(leadScoring);
        }

        @Test
        @DisplayName("or stops at the first true child")
        void orShortCircuits() {
            OrCondition or = new OrCondition(List.of(
                    new AlwaysTrueCondition(),
                    new ScoreThresholdCondition(ComparisonOperator.GTE, 60)));

            assertTrue(evaluator.evaluate(or, ctx(Map.of())));
            verifyNoInteractions(leadScoring);
        }

        @Test
        @DisplayName("Empty and is true, empty or is false")
        void emptyComposites() {
            assertTrue(evaluator.evaluate(new AndCondition(List.of()), ctx(Map.of())));
            assertFalse(evaluator.evaluate(new OrCondition(List.of()), ctx(Map.of())));
        }
    }

    @Nested
    @DisplayName("event_window")
    class EventWindowTests {

        @Test
        @DisplayName("Reply inside the window satisfies min_count 1")
        void replyInWindow() {
            when(eventStore.getEventsInWindow(TENANT, LEAD, EventType.EMAIL_REPLIED, Duration.ofDays(7)))
                    .thenReturn(List.of(new CrmEvent()));

            EventWindowCondition condition = new EventWindowCondition(
                    EventType.EMAIL_REPLIED, Duration.ofDays(7).toMillis(), null);

            assertTrue(evaluator.evaluate(condition, ctx(Map.of())));
        }

        @Test
        @DisplayName("Fewer events than min_count is false")
        void belowMinCount() {
            when(eventStore.getEventsInWindow(eq(TENANT), eq(LEAD), eq(EventType.EMAIL_OPENED), any()))
                    .thenReturn(List.of(new CrmEvent(), new CrmEvent()));

            EventWindowCondition condition = new EventWindowCondition(EventType.EMAIL_OPENED, 3_600_000L, 3);

            assertFalse(evaluator.evaluate(condition, ctx(Map.of())));
        }

        @Test
        @DisplayName("Missing window reads as false without querying")
        void missingWindow() {
            EventWindowCondition condition = new EventWindowCondition(EventType.EMAIL_OPENED, 0L, 1);

            assertFalse(evaluator.evaluate(condition, ctx(Map.of())));
            verifyNoInteractions(eventStore);
        }
    }

    @Nested
    @DisplayName("field_compare")
    class FieldCompareTests {

        @Test
        @DisplayName("eq / neq on strings")
        void stringEquality() {
            Map<String, Object> fields = Map.of("industry", "saas");
            assertTrue(evaluator.evaluate(field("industry", ComparisonOperator.EQ, "saas"), ctx(fields)));
            assertFalse(evaluator.evaluate(field("industry", ComparisonOperator.NEQ, "saas"), ctx(fields)));
        }

        @Test
        @DisplayName("eq compares numbers by value across types")
        void numericEquality() {
            assertTrue(evaluator.evaluate(field("seats", ComparisonOperator.EQ, 10.0), ctx(Map.of("seats", 10))));
        }

        @Test
        @DisplayName("Ordering operators compare numerically")
        void ordering() {
            Map<String, Object> fields = Map.of("seats", 50);
            assertTrue(evaluator.evaluate(field("seats", ComparisonOperator.GT, 10), ctx(fields)));
            assertTrue(evaluator.evaluate(field("seats", ComparisonOperator.GTE, 50), ctx(fields)));
            assertFalse(evaluator.evaluate(field("seats", ComparisonOperator.LT, 50), ctx(fields)));
            assertTrue(evaluator.evaluate(field("seats", ComparisonOperator.LTE, "50"), ctx(fields)));
        }

        @Test
        @DisplayName("contains / not_contains on the string form")
        void contains() {
            Map<String, Object> fields = Map.of("title", "VP of Sales");
            assertTrue(evaluator.evaluate(field("title", ComparisonOperator.CONTAINS, "Sales"), ctx(fields)));
            assertTrue(evaluator.evaluate(field("title", ComparisonOperator.NOT_CONTAINS, "CTO"), ctx(fields)));
        }

        @Test
        @DisplayName("Missing field is not greater than anything")
        void missingField() {
            assertFalse(evaluator.evaluate(field("seats", ComparisonOperator.GT, 1), ctx(Map.of())));
            assertTrue(evaluator.evaluate(field("seats", ComparisonOperator.NEQ, 1), ctx(Map.of())));
        }
    }

    @Nested
    @DisplayName("score_threshold")
    class ScoreThresholdTests {

        @Test
        @DisplayName("Compares against the decayed score")
        void againstScore() {
            when(leadScoring.getLeadScore(TENANT, LEAD)).thenReturn(80);

            assertTrue(evaluator.evaluate(new ScoreThresholdCondition(ComparisonOperator.GTE, 60), ctx(Map.of())));
        }

        @Test
        @DisplayName("Score of 0 is below the threshold")
        void zeroScore() {
            when(leadScoring.getLeadScore(TENANT, LEAD)).thenReturn(0);

            assertFalse(evaluator.evaluate(new ScoreThresholdCondition(ComparisonOperator.GTE, 60), ctx(Map.of())));
        }
    }

    @Nested
    @DisplayName("Degradation")
    class DegradationTests {

        @Test
        @DisplayName("Unknown condition type is false")
        void unknownType() {
            assertFalse(evaluator.evaluate(new UnknownCondition("moon_phase"), ctx(Map.of())));
        }

        @Test
        @DisplayName("Unknown operator is false")
        void unknownOperator() {
            assertFalse(evaluator.evaluate(field("plan", null, "pro"), ctx(Map.of("plan", "pro"))));
        }

        @Test
        @DisplayName("Null condition is false")
        void nullCondition() {
            assertFalse(evaluator.evaluate(null, ctx(Map.of())));
        }

        @Test
        @DisplayName("parse reads node config maps into conditions")
        void parseConfigMap() {
            Condition parsed = evaluator.parse(Map.of("type", "score_threshold", "operator", "gte", "value", 60));

            assertInstanceOf(ScoreThresholdCondition.class, parsed);
        }

        @Test
        @DisplayName("parse turns malformed config into an unknown condition")
        void parseMalformed() {
            Condition parsed = evaluator.parse(Map.of("type", "event_window", "event_type", "carrier_pigeon"));

            assertInstanceOf(UnknownCondition.class, parsed);
            assertFalse(evaluator.evaluate(parsed, ctx(Map.of())));
        }
    }
}
