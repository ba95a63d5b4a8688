package com.cadence.service;

import com.cadence.dto.EnrollResult;
import com.cadence.dto.IncomingEvent;
import com.cadence.dto.IngestResult;
import com.cadence.dto.SuppressionCheck;
import com.cadence.exception.WorkflowNotFoundException;
import com.cadence.model.Enrollment;
import com.cadence.model.EntityType;
import com.cadence.model.EventType;
import com.cadence.model.NodeType;
import com.cadence.model.WorkflowNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs a single workflow node against an enrollment.
 *
 * Effects are applied to the enrollment passed in (snapshot, nextCheckAt);
 * persisting it is the caller's job. The returned {@link NodeOutcome} tells the
 * caller where to go next.
 *
 *   wait   → arm (SUSPEND), keep waiting (IDLE), or release via "default" / "met"
 *   send   → suppression check, then pending-send intent + email_sent event, "default";
 *            the intent is published only when the event was newly recorded
 *   branch → condition → "yes" / "no" (no condition counts as false)
 *   update → merge fields, optional score delta, "default"
 *   notify → alert, "default"
 *   enrol  → enroll the lead in another workflow, "default"
 *   stop   → STOP with config.reason
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NodeExecutor {

    static final String ENGINE_SOURCE = "workflow_engine";
    static final String DEFAULT_STOP_REASON = "stopped";
    static final String DEFAULT_ALERT_CHANNEL = "sales";

    private final RulesEvaluator rulesEvaluator;
    private final SuppressionLedger suppressionLedger;
    private final LeadScoringService leadScoring;
    private final EventIngestionService eventIngestion;
    private final EnrollmentService enrollmentService;
    private final OutboundPublisher outboundPublisher;
    private final Clock clock;

    public NodeOutcome execute(Enrollment enrollment, WorkflowNode node, int hop) {
        NodeType type = node.getType() != null ? node.getType() : NodeType.UNKNOWN;
        return switch (type) {
            case WAIT -> executeWait(enrollment, node);
            case SEND -> executeSend(enrollment, node, hop);
            case BRANCH -> executeBranch(enrollment, node);
            case UPDATE -> executeUpdate(enrollment, node);
            case NOTIFY -> executeNotify(enrollment, node);
            case ENROL -> executeEnrol(enrollment, node);
            case STOP -> NodeOutcome.stop(stringConfig(node, "reason", DEFAULT_STOP_REASON));
            case UNKNOWN -> {
                log.warn("Unknown node type at {} in {} v{}, following default edge",
                        node.getNodeId(), enrollment.getWorkflowId(), enrollment.getWorkflowVersion());
                yield NodeOutcome.advance(node.edge(WorkflowNode.EDGE_DEFAULT));
            }
        };
    }

    private NodeOutcome executeWait(Enrollment enrollment, WorkflowNode node) {
        Map<String, Object> snapshot = enrollment.getStateSnapshot();
        Instant now = clock.instant();

        if (!node.getNodeId().equals(snapshot.get(Enrollment.SNAPSHOT_WAIT_NODE))) {
            Instant until = now.plus(waitDuration(node));
            snapshot.put(Enrollment.SNAPSHOT_WAIT_NODE, node.getNodeId());
            enrollment.setNextCheckAt(until);
            log.info("Enrollment {} waiting at {} until {}", enrollment.getEnrollmentId(), node.getNodeId(), until);
            return NodeOutcome.suspend();
        }

        if (enrollment.getNextCheckAt() == null || !now.isBefore(enrollment.getNextCheckAt())) {
            snapshot.remove(Enrollment.SNAPSHOT_WAIT_NODE);
            return NodeOutcome.advance(node.edge(WorkflowNode.EDGE_DEFAULT));
        }

        Object until = node.configValue("until");
        if (until != null && rulesEvaluator.evaluate(rulesEvaluator.parse(until), contextOf(enrollment))) {
            snapshot.remove(Enrollment.SNAPSHOT_WAIT_NODE);
            log.info("Enrollment {} released early from {}", enrollment.getEnrollmentId(), node.getNodeId());
            return NodeOutcome.advance(node.edgeOrDefault(WorkflowNode.EDGE_MET));
        }
        return NodeOutcome.idle();
    }

    private NodeOutcome executeSend(Enrollment enrollment, WorkflowNode node, int hop) {
        Map<String, Object> snapshot = enrollment.getStateSnapshot();
        String address = recipientOf(snapshot);
        if (address == null) {
            log.warn("No email address for {} at send node {}, skipping send",
                    enrollment.getEntityId(), node.getNodeId());
            return NodeOutcome.advance(node.edge(WorkflowNode.EDGE_DEFAULT));
        }

        SuppressionCheck check = suppressionLedger.check(enrollment.getTenantId(), address);
        if (check.isSuppressed()) {
            log.info("Send suppressed for {} ({}) at {}", address,
                    check.getReason().wireName(), node.getNodeId());
            return NodeOutcome.advance(node.edgeOrDefault(WorkflowNode.EDGE_SUPPRESSED));
        }

        Map<String, Object> pendingSend = new LinkedHashMap<>();
        pendingSend.put("template_id", node.configValue("template_id"));
        pendingSend.put("subject", node.configValue("subject"));
        pendingSend.put("body", node.configValue("body"));
        pendingSend.put("to", address);
        snapshot.put(Enrollment.SNAPSHOT_PENDING_SEND, pendingSend);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("to", address);
        payload.put("template_id", node.configValue("template_id"));
        payload.put("enrollment_id", enrollment.getEnrollmentId().toString());

        IngestResult recorded = eventIngestion.ingest(IncomingEvent.builder()
                .eventType(EventType.EMAIL_SENT)
                .entityType(EntityType.LEAD)
                .entityId(enrollment.getEntityId())
                .tenantId(enrollment.getTenantId())
                .source(ENGINE_SOURCE)
                .dedupeKey(sendDedupeKey(enrollment, node, hop))
                .payload(payload)
                .build());
        if (recorded.isDuplicate()) {
            // Recorded by an earlier pass that committed; its intent already went out
            log.info("Send at {} already recorded for enrollment {} ({}), not publishing again",
                    node.getNodeId(), enrollment.getEnrollmentId(), recorded.getDedupeKey());
            return NodeOutcome.advance(node.edge(WorkflowNode.EDGE_DEFAULT));
        }

        outboundPublisher.publishSendIntent(enrollment.getTenantId(), enrollment.getEntityId(),
                enrollment.getEnrollmentId(), pendingSend);
        return NodeOutcome.advance(node.edge(WorkflowNode.EDGE_DEFAULT));
    }

    private NodeOutcome executeBranch(Enrollment enrollment, WorkflowNode node) {
        Object condition = node.configValue("condition");
        if (condition == null) {
            log.warn("Branch {} has no condition, taking the no edge", node.getNodeId());
            return NodeOutcome.advance(node.edge(WorkflowNode.EDGE_NO));
        }
        boolean result = rulesEvaluator.evaluate(rulesEvaluator.parse(condition), contextOf(enrollment));
        log.debug("Branch {} for enrollment {} → {}", node.getNodeId(), enrollment.getEnrollmentId(), result);
        return NodeOutcome.advance(node.edge(result ? WorkflowNode.EDGE_YES : WorkflowNode.EDGE_NO));
    }

    private NodeOutcome executeUpdate(Enrollment enrollment, WorkflowNode node) {
        Object fields = node.configValue("fields");
        if (fields instanceof Map) {
            for (Map.Entry<?, ?> field : ((Map<?, ?>) fields).entrySet()) {
                enrollment.getStateSnapshot().put(String.valueOf(field.getKey()), field.getValue());
            }
        }
        Object scoreDelta = node.configValue("score_delta");
        if (scoreDelta instanceof Number && ((Number) scoreDelta).doubleValue() != 0) {
            leadScoring.applyScoreEvent(enrollment.getTenantId(), enrollment.getEntityId(),
                    EventType.SCORE_ADJUSTMENT, Map.of("delta", scoreDelta));
        }
        return NodeOutcome.advance(node.edge(WorkflowNode.EDGE_DEFAULT));
    }

    private NodeOutcome executeNotify(Enrollment enrollment, WorkflowNode node) {
        String label = node.getLabel() != null ? node.getLabel() : node.getNodeId();
        String message = stringConfig(node, "message", "Lead reached " + label);
        outboundPublisher.publishAlert(enrollment.getTenantId(), enrollment.getEntityId(),
                enrollment.getEnrollmentId(), stringConfig(node, "channel", DEFAULT_ALERT_CHANNEL), message);
        return NodeOutcome.advance(node.edge(WorkflowNode.EDGE_DEFAULT));
    }

    private NodeOutcome executeEnrol(Enrollment enrollment, WorkflowNode node) {
        String target = stringConfig(node, "target_workflow_id", null);
        if (target == null) {
            log.warn("Enrol node {} has no target_workflow_id, skipping", node.getNodeId());
        } else {
            try {
                EnrollResult result = enrollmentService.enroll(enrollment.getTenantId(), target,
                        enrollment.getEntityId(), new LinkedHashMap<>(enrollment.getStateSnapshot()));
                log.info("Enrollment {} handed {} to {} (enrollment={}, new={})",
                        enrollment.getEnrollmentId(), enrollment.getEntityId(), target,
                        result.getEnrollment().getEnrollmentId(), result.isCreated());
            } catch (WorkflowNotFoundException | IllegalStateException e) {
                log.warn("Enrol node {} could not enroll {} in {}: {}",
                        node.getNodeId(), enrollment.getEntityId(), target, e.getMessage());
            }
        }
        return NodeOutcome.advance(node.edge(WorkflowNode.EDGE_DEFAULT));
    }

    /**
     * Wait length from duration_days, duration_hours and duration_minutes
     * (summed). One day when none is configured.
     */
    static Duration waitDuration(WorkflowNode node) {
        long millis = 0;
        millis += toMillis(node.configValue("duration_days"), Duration.ofDays(1));
        millis += toMillis(node.configValue("duration_hours"), Duration.ofHours(1));
        millis += toMillis(node.configValue("duration_minutes"), Duration.ofMinutes(1));
        return millis > 0 ? Duration.ofMillis(millis) : Duration.ofDays(1);
    }

    static String sendDedupeKey(Enrollment enrollment, WorkflowNode node, int hop) {
        return "email_sent:" + enrollment.getEnrollmentId() + ":" + node.getNodeId()
                + ":" + enrollment.getVersion() + ":" + hop;
    }

    private static long toMillis(Object amount, Duration unit) {
        if (!(amount instanceof Number)) {
            return 0;
        }
        return Math.max(0, Math.round(((Number) amount).doubleValue() * unit.toMillis()));
    }

    private static String recipientOf(Map<String, Object> snapshot) {
        for (String key : new String[]{"email", "primaryEmail"}) {
            Object value = snapshot.get(key);
            if (value instanceof String && !((String) value).isBlank()) {
                return ((String) value).trim();
            }
        }
        return null;
    }

    private static String stringConfig(WorkflowNode node, String key, String fallback) {
        Object value = node.configValue(key);
        return value != null && !String.valueOf(value).isBlank() ? String.valueOf(value) : fallback;
    }

    private static EvaluationContext contextOf(Enrollment enrollment) {
        return new EvaluationContext(enrollment.getTenantId(), enrollment.getEntityId(),
                enrollment.getStateSnapshot());
    }
}
