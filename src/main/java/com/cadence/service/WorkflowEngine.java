package com.cadence.service;

import com.cadence.dto.BatchResult;
import com.cadence.dto.EnrollResult;
import com.cadence.model.CrmEvent;
import com.cadence.model.Enrollment;
import com.cadence.model.EnrollmentStatus;
import com.cadence.model.EventType;
import com.cadence.model.SuppressionReason;
import com.cadence.repository.EnrollmentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Entry points into the state machine. Both triggers converge on
 * {@link #advance(UUID)}:
 *
 *   event-driven:  ingest → CrmEventIngested → handleEvent → advance each active enrollment of the lead
 *   time-driven:   scheduler → processDueEnrollments → advance each due enrollment
 *
 * advance() takes the per-enrollment Redis lock around the advancer's own
 * transaction. A trigger that finds the lock held skips the enrollment; the
 * holder or the next sweep moves it forward.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowEngine {

    public enum AdvanceResult { ADVANCED, SKIPPED }

    static final int MAX_SCORE_ATTEMPTS = 3;

    private final EnrollmentService enrollmentService;
    private final EnrollmentAdvancer advancer;
    private final AdvancementLockService lockService;
    private final EnrollmentRepository enrollmentRepository;
    private final LeadScoringService leadScoring;
    private final SuppressionLedger suppressionLedger;
    private final EventIngestionService eventIngestion;
    private final Clock clock;

    /**
     * Enrolls the lead and, when a new enrollment was created, advances it
     * right away so the caller sees the outcome of the first pass.
     */
    public Enrollment enrollLead(String tenantId, String workflowId, String entityId,
                                 Map<String, Object> initialFields) {
        EnrollResult result = enrollmentService.enroll(tenantId, workflowId, entityId, initialFields);
        UUID enrollmentId = result.getEnrollment().getEnrollmentId();
        if (!result.isCreated()) {
            return result.getEnrollment();
        }
        try {
            advance(enrollmentId);
        } catch (RuntimeException e) {
            // The enrollment exists and is due; the next sweep retries the first pass
            log.error("First pass failed for enrollment {}: {}", enrollmentId, e.getMessage(), e);
        }
        return enrollmentService.get(tenantId, enrollmentId);
    }

    public AdvanceResult advance(UUID enrollmentId) {
        Optional<String> token = lockService.tryAcquire(enrollmentId);
        if (token.isEmpty()) {
            return AdvanceResult.SKIPPED;
        }
        try {
            advancer.advance(enrollmentId);
            return AdvanceResult.ADVANCED;
        } finally {
            lockService.release(enrollmentId, token.get());
        }
    }

    /**
     * Advances every ACTIVE enrollment whose nextCheckAt is unset or has passed.
     * Each enrollment is isolated: a failure is counted and the batch goes on.
     */
    public BatchResult processDueEnrollments() {
        List<UUID> due = enrollmentRepository.findDueEnrollmentIds(EnrollmentStatus.ACTIVE, clock.instant());
        BatchResult result = advanceAll(due);
        if (result.getProcessed() > 0 || result.getErrors() > 0) {
            log.info("Processed {} due enrollments ({} errors, {} skipped)",
                    result.getProcessed(), result.getErrors(), result.getSkipped());
        }
        return result;
    }

    /**
     * Reacts to a freshly ingested event: score, auto-suppression, then wakes
     * the lead's active enrollments. Runs synchronously on the ingesting thread.
     */
    @EventListener
    public void onEventIngested(CrmEventIngested ingested) {
        handleEvent(ingested.getEvent());
    }

    public BatchResult handleEvent(CrmEvent event) {
        boolean scored = applyScore(event);

        applyAutoSuppression(event);

        List<UUID> active = enrollmentRepository
                .findByTenantIdAndEntityIdAndStatus(event.getTenantId(), event.getEntityId(), EnrollmentStatus.ACTIVE)
                .stream()
                .map(Enrollment::getEnrollmentId)
                .collect(Collectors.toList());
        BatchResult result = advanceAll(active);

        if (scored) {
            eventIngestion.markProcessed(event.getEventId());
        }
        return result;
    }

    /**
     * Concurrent events for one lead race on its score row. The loser of a
     * version or insert conflict re-reads and re-applies its delta.
     * Returns false when every attempt conflicted; the event then stays unprocessed.
     */
    private boolean applyScore(CrmEvent event) {
        for (int attempt = 1; attempt <= MAX_SCORE_ATTEMPTS; attempt++) {
            try {
                leadScoring.applyScoreEventInNewTransaction(event.getTenantId(), event.getEntityId(),
                        event.getEventType(), event.getPayload());
                return true;
            } catch (OptimisticLockingFailureException | DataIntegrityViolationException e) {
                log.warn("Score conflict for {}:{} on event {} (attempt {}/{}): {}", event.getTenantId(),
                        event.getEntityId(), event.getEventId(), attempt, MAX_SCORE_ATTEMPTS, e.getMessage());
            }
        }
        log.error("Gave up scoring event {} for {}:{} after {} attempts, left unprocessed",
                event.getEventId(), event.getTenantId(), event.getEntityId(), MAX_SCORE_ATTEMPTS);
        return false;
    }

    private void applyAutoSuppression(CrmEvent event) {
        Map<String, Object> payload = event.getPayload() != null ? event.getPayload() : Map.of();
        EventType type = event.getEventType();

        if (type == EventType.EMAIL_BOUNCED && "hard".equals(payload.get("bounce_type"))) {
            suppressIfAddressed(event, payload.get("to"), SuppressionReason.HARD_BOUNCE);
        } else if (type == EventType.EMAIL_UNSUBSCRIBED) {
            Object address = payload.get("to") != null ? payload.get("to") : payload.get("email");
            suppressIfAddressed(event, address, SuppressionReason.UNSUBSCRIBED);
        } else if (type == EventType.EMAIL_COMPLAINED) {
            suppressIfAddressed(event, payload.get("to"), SuppressionReason.SPAM_COMPLAINT);
        }
    }

    private void suppressIfAddressed(CrmEvent event, Object address, SuppressionReason reason) {
        if (address instanceof String && !((String) address).isBlank()) {
            suppressionLedger.suppress(event.getTenantId(), (String) address, reason);
        } else {
            log.warn("{} event {} carries no address, nothing suppressed",
                    event.getEventType().wireName(), event.getEventId());
        }
    }

    private BatchResult advanceAll(List<UUID> enrollmentIds) {
        int processed = 0;
        int errors = 0;
        int skipped = 0;
        for (UUID enrollmentId : enrollmentIds) {
            try {
                if (advance(enrollmentId) == AdvanceResult.SKIPPED) {
                    skipped++;
                } else {
                    processed++;
                }
            } catch (RuntimeException e) {
                log.error("Error advancing enrollment {}: {}", enrollmentId, e.getMessage(), e);
                errors++;
            }
        }
        return new BatchResult(processed, errors, skipped);
    }
}
