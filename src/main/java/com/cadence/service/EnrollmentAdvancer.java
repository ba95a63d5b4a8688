package com.cadence.service;

import com.cadence.config.CadenceProperties;
import com.cadence.model.Enrollment;
import com.cadence.model.EnrollmentStatus;
import com.cadence.model.WorkflowDefinition;
import com.cadence.model.WorkflowGraph;
import com.cadence.model.WorkflowNode;
import com.cadence.repository.EnrollmentRepository;
import com.cadence.repository.WorkflowDefinitionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Optional;
import java.util.UUID;

/**
 * The advancement routine: moves one enrollment through its graph as far as
 * it can go in a single pass.
 *
 * FLOW:
 *   1. Load the enrollment; anything but ACTIVE → nothing to do
 *   2. Load the workflow version it was created on
 *   3. Loop: execute current node → follow the chosen edge
 *        - wait armed / still waiting → halt
 *        - stop                       → STOPPED with the node's reason
 *        - no edge                    → COMPLETED, outcome "completed"
 *        - hop cap reached            → persist position, due again immediately
 *   4. Persist once at the end of the pass
 *
 * Each pass is its own transaction, so one enrollment's failure never rolls
 * back another's progress. Callers serialize passes per enrollment.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EnrollmentAdvancer {

    static final String OUTCOME_COMPLETED = "completed";

    private final EnrollmentRepository enrollmentRepository;
    private final WorkflowDefinitionRepository definitionRepository;
    private final NodeExecutor nodeExecutor;
    private final CadenceProperties properties;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public EnrollmentStatus advance(UUID enrollmentId) {
        Optional<Enrollment> found = enrollmentRepository.findById(enrollmentId);
        if (found.isEmpty()) {
            log.error("Enrollment {} not found", enrollmentId);
            return null;
        }
        Enrollment enrollment = found.get();
        if (!enrollment.isActive()) {
            log.debug("Enrollment {} is {}, not advancing", enrollmentId, enrollment.getStatus());
            return enrollment.getStatus();
        }

        Optional<WorkflowDefinition> definition = definitionRepository.findByTenantIdAndWorkflowIdAndVersion(
                enrollment.getTenantId(), enrollment.getWorkflowId(), enrollment.getWorkflowVersion());
        if (definition.isEmpty()) {
            log.error("Workflow {} v{} not found for enrollment {}",
                    enrollment.getWorkflowId(), enrollment.getWorkflowVersion(), enrollmentId);
            return enrollment.getStatus();
        }
        WorkflowGraph graph = definition.get().getGraph();

        // Work on a copy so the converted JSON column is seen as changed
        enrollment.setStateSnapshot(new LinkedHashMap<>(enrollment.getStateSnapshot()));

        int maxHops = properties.getEngine().getMaxHopsPerPass();
        int hops = 0;
        while (true) {
            if (hops >= maxHops) {
                log.warn("Enrollment {} hit the {}-hop cap at {}, yielding until the next trigger",
                        enrollmentId, maxHops, enrollment.getCurrentNodeId());
                enrollment.setNextCheckAt(clock.instant());
                return persist(enrollment);
            }

            Optional<WorkflowNode> node = graph.node(enrollment.getCurrentNodeId());
            if (node.isEmpty()) {
                log.error("Node {} not found in {} v{} (enrollment={})", enrollment.getCurrentNodeId(),
                        enrollment.getWorkflowId(), enrollment.getWorkflowVersion(), enrollmentId);
                return hops > 0 ? persist(enrollment) : enrollment.getStatus();
            }

            NodeOutcome outcome = nodeExecutor.execute(enrollment, node.get(), hops);
            switch (outcome.getKind()) {
                case SUSPEND -> {
                    return persist(enrollment);
                }
                case IDLE -> {
                    return hops > 0 ? persist(enrollment) : enrollment.getStatus();
                }
                case STOP -> {
                    finish(enrollment, EnrollmentStatus.STOPPED, outcome.getReason());
                    log.info("Enrollment {} stopped at {}: {}", enrollmentId,
                            enrollment.getCurrentNodeId(), outcome.getReason());
                    return persist(enrollment);
                }
                case ADVANCE -> {
                    if (outcome.getNextNodeId() == null) {
                        finish(enrollment, EnrollmentStatus.COMPLETED, OUTCOME_COMPLETED);
                        log.info("Enrollment {} completed at {}", enrollmentId, enrollment.getCurrentNodeId());
                        return persist(enrollment);
                    }
                    enrollment.setCurrentNodeId(outcome.getNextNodeId());
                    enrollment.setLastTransitionAt(clock.instant());
                    hops++;
                }
            }
        }
    }

    private void finish(Enrollment enrollment, EnrollmentStatus status, String outcome) {
        Instant now = clock.instant();
        enrollment.setStatus(status);
        enrollment.setOutcome(outcome);
        enrollment.setLastTransitionAt(now);
        enrollment.setNextCheckAt(null);
        enrollment.getStateSnapshot().remove(Enrollment.SNAPSHOT_WAIT_NODE);
    }

    private EnrollmentStatus persist(Enrollment enrollment) {
        enrollmentRepository.save(enrollment);
        return enrollment.getStatus();
    }
}
