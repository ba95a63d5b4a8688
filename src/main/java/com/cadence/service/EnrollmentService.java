package com.cadence.service;

import com.cadence.dto.EnrollResult;
import com.cadence.exception.EnrollmentNotFoundException;
import com.cadence.exception.WorkflowNotFoundException;
import com.cadence.model.Enrollment;
import com.cadence.model.EnrollmentStatus;
import com.cadence.model.WorkflowDefinition;
import com.cadence.repository.EnrollmentRepository;
import com.cadence.repository.WorkflowDefinitionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates enrollments and applies external control (pause, resume, stop).
 * Moving an enrollment through its graph is the advancer's job.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EnrollmentService {

    public static final String OUTCOME_MANUAL_STOP = "manual_stop";

    private final EnrollmentRepository enrollmentRepository;
    private final WorkflowDefinitionRepository definitionRepository;
    private final PlatformTransactionManager transactionManager;
    private final Clock clock;

    /**
     * Places the lead at the entry node of the workflow's latest version.
     * Idempotent: while the lead holds an ACTIVE enrollment in the workflow,
     * that enrollment is returned and nothing is written.
     *
     * The insert runs in its own transaction against the active_key unique
     * constraint. A concurrent enroll that loses the race gets the winner's
     * enrollment back with created=false, and a caller's transaction (an enrol
     * node's pass) is not marked rollback-only by the failed insert.
     */
    public EnrollResult enroll(String tenantId, String workflowId, String entityId,
                               Map<String, Object> initialFields) {
        Optional<Enrollment> existing = findActive(tenantId, workflowId, entityId);
        if (existing.isPresent()) {
            log.debug("{} already active in {} (enrollment={})",
                    entityId, workflowId, existing.get().getEnrollmentId());
            return new EnrollResult(existing.get(), false);
        }

        WorkflowDefinition definition = definitionRepository
                .findFirstByTenantIdAndWorkflowIdOrderByVersionDesc(tenantId, workflowId)
                .orElseThrow(() -> new WorkflowNotFoundException(tenantId, workflowId));
        if (!definition.getStatus().acceptsEnrollments()) {
            throw new IllegalStateException("Workflow " + workflowId + " is "
                    + definition.getStatus() + " and accepts no new enrollments");
        }

        Instant now = clock.instant();
        Map<String, Object> snapshot = new LinkedHashMap<>();
        if (initialFields != null) {
            snapshot.putAll(initialFields);
        }
        // Engine bookkeeping never carries over from another workflow
        snapshot.remove(Enrollment.SNAPSHOT_PENDING_SEND);
        snapshot.remove(Enrollment.SNAPSHOT_WAIT_NODE);

        Enrollment enrollment = Enrollment.builder()
                .enrollmentId(UUID.randomUUID())
                .workflowId(workflowId)
                .workflowVersion(definition.getVersion())
                .tenantId(tenantId)
                .entityId(entityId)
                .currentNodeId(definition.getGraph().getEntryNodeId())
                .status(EnrollmentStatus.ACTIVE)
                .enteredAt(now)
                .lastTransitionAt(now)
                .nextCheckAt(now)
                .stateSnapshot(snapshot)
                .build();
        try {
            inNewTransaction().executeWithoutResult(tx -> enrollmentRepository.saveAndFlush(enrollment));
        } catch (DataIntegrityViolationException e) {
            Enrollment winner = findActive(tenantId, workflowId, entityId).orElseThrow(() -> e);
            log.info("Concurrent enroll of {} in {} already created enrollment {}, returning it",
                    entityId, workflowId, winner.getEnrollmentId());
            return new EnrollResult(winner, false);
        }

        log.info("Enrolled {} in {} v{} at {} (enrollment={}, tenant={})",
                entityId, workflowId, definition.getVersion(), enrollment.getCurrentNodeId(),
                enrollment.getEnrollmentId(), tenantId);
        return new EnrollResult(enrollment, true);
    }

    @Transactional
    public Enrollment pause(String tenantId, UUID enrollmentId) {
        Enrollment enrollment = get(tenantId, enrollmentId);
        requireNotTerminal(enrollment, "paused");
        if (enrollment.getStatus() == EnrollmentStatus.ACTIVE) {
            enrollment.setStatus(EnrollmentStatus.PAUSED);
            enrollment.setLastTransitionAt(clock.instant());
            log.info("Paused enrollment {}", enrollmentId);
        }
        return enrollmentRepository.save(enrollment);
    }

    /**
     * Re-activates a paused enrollment and makes it due immediately. Refused
     * while the lead was re-enrolled in the same workflow during the pause.
     */
    @Transactional
    public Enrollment resume(String tenantId, UUID enrollmentId) {
        Enrollment enrollment = get(tenantId, enrollmentId);
        requireNotTerminal(enrollment, "resumed");
        if (enrollment.getStatus() == EnrollmentStatus.PAUSED) {
            Optional<Enrollment> active = findActive(tenantId, enrollment.getWorkflowId(), enrollment.getEntityId());
            if (active.isPresent()) {
                throw new IllegalStateException("Lead " + enrollment.getEntityId() + " already has active enrollment "
                        + active.get().getEnrollmentId() + " in " + enrollment.getWorkflowId());
            }
            Instant now = clock.instant();
            enrollment.setStatus(EnrollmentStatus.ACTIVE);
            enrollment.setLastTransitionAt(now);
            enrollment.setNextCheckAt(now);
            log.info("Resumed enrollment {}", enrollmentId);
        }
        return enrollmentRepository.save(enrollment);
    }

    @Transactional
    public Enrollment stop(String tenantId, UUID enrollmentId) {
        Enrollment enrollment = get(tenantId, enrollmentId);
        requireNotTerminal(enrollment, "stopped");
        enrollment.setStatus(EnrollmentStatus.STOPPED);
        enrollment.setOutcome(OUTCOME_MANUAL_STOP);
        enrollment.setLastTransitionAt(clock.instant());
        enrollment.setNextCheckAt(null);
        log.info("Stopped enrollment {} manually", enrollmentId);
        return enrollmentRepository.save(enrollment);
    }

    @Transactional(readOnly = true)
    public Enrollment get(String tenantId, UUID enrollmentId) {
        return enrollmentRepository.findById(enrollmentId)
                .filter(e -> e.getTenantId().equals(tenantId))
                .orElseThrow(() -> new EnrollmentNotFoundException(enrollmentId));
    }

    @Transactional(readOnly = true)
    public List<Enrollment> list(String tenantId, EnrollmentStatus status) {
        return status == null
                ? enrollmentRepository.findTop200ByTenantIdOrderByLastTransitionAtDesc(tenantId)
                : enrollmentRepository.findTop200ByTenantIdAndStatusOrderByLastTransitionAtDesc(tenantId, status);
    }

    private Optional<Enrollment> findActive(String tenantId, String workflowId, String entityId) {
        return enrollmentRepository.findFirstByTenantIdAndWorkflowIdAndEntityIdAndStatus(
                tenantId, workflowId, entityId, EnrollmentStatus.ACTIVE);
    }

    private TransactionTemplate inNewTransaction() {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        return template;
    }

    private void requireNotTerminal(Enrollment enrollment, String action) {
        if (enrollment.getStatus().isTerminal()) {
            throw new IllegalStateException("Enrollment " + enrollment.getEnrollmentId() + " is "
                    + enrollment.getStatus() + " and cannot be " + action);
        }
    }
}
