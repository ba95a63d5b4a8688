package com.cadence.service;

import com.cadence.dto.BatchResult;
import com.cadence.dto.EnrollResult;
import com.cadence.model.*;
import com.cadence.repository.EnrollmentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WorkflowEngineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String TENANT = "acme";
    private static final String LEAD = "lead-1";

    @Mock private EnrollmentService enrollmentService;
    @Mock private EnrollmentAdvancer advancer;
    @Mock private AdvancementLockService lockService;
    @Mock private EnrollmentRepository enrollmentRepository;
    @Mock private LeadScoringService leadScoring;
    @Mock private SuppressionLedger suppressionLedger;
    @Mock private EventIngestionService eventIngestion;

    private WorkflowEngine engine;

    @BeforeEach
    void setUp() {
        engine = new WorkflowEngine(enrollmentService, advancer, lockService, enrollmentRepository,
                leadScoring, suppressionLedger, eventIngestion, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Enrollment enrollment() {
        return Enrollment.builder()
                .enrollmentId(UUID.randomUUID())
                .workflowId("cold-outreach")
                .tenantId(TENANT)
                .entityId(LEAD)
                .currentNodeId("send-1")
                .build();
    }

    private static CrmEvent event(EventType type, Map<String, Object> payload) {
        return CrmEvent.builder()
                .eventId(UUID.randomUUID())
                .tenantId(TENANT)
                .eventType(type)
                .entityType(EntityType.LEAD)
                .entityId(LEAD)
                .source("esp")
                .occurredAt(NOW)
                .receivedAt(NOW)
                .payload(payload)
                .dedupeKey(type.wireName() + ":" + LEAD)
                .build();
    }

    @Nested
    @DisplayName("advance")
    class AdvanceTests {

        @Test
        @DisplayName("Runs the pass under the lock and releases it")
        void advancesUnderLock() {
            UUID id = UUID.randomUUID();
            when(lockService.tryAcquire(id)).thenReturn(Optional.of("token"));

            assertEquals(WorkflowEngine.AdvanceResult.ADVANCED, engine.advance(id));

            verify(advancer).advance(id);
            verify(lockService).release(id, "token");
        }

        @Test
        @DisplayName("Lock held elsewhere: skipped, the advancer is never called")
        void skipsWhenLocked() {
            UUID id = UUID.randomUUID();
            when(lockService.tryAcquire(id)).thenReturn(Optional.empty());

            assertEquals(WorkflowEngine.AdvanceResult.SKIPPED, engine.advance(id));

            verifyNoInteractions(advancer);
            verify(lockService, never()).release(any(), any());
        }

        @Test
        @DisplayName("Lock is released when the pass fails")
        void releasesOnFailure() {
            UUID id = UUID.randomUUID();
            when(lockService.tryAcquire(id)).thenReturn(Optional.of("token"));
            when(advancer.advance(id)).thenThrow(new IllegalStateException("boom"));

            assertThrows(IllegalStateException.class, () -> engine.advance(id));
            verify(lockService).release(id, "token");
        }
    }

    @Nested
    @DisplayName("processDueEnrollments")
    @MockitoSettings(strictness = Strictness.LENIENT)
    class SweepTests {

        @Test
        @DisplayName("One failing enrollment is counted and the rest still advance")
        void isolatesFailures() {
            UUID a = UUID.randomUUID();
            UUID b = UUID.randomUUID();
            UUID c = UUID.randomUUID();
            when(enrollmentRepository.findDueEnrollmentIds(EnrollmentStatus.ACTIVE, NOW)).thenReturn(List.of(a, b, c));
            when(lockService.tryAcquire(any())).thenReturn(Optional.of("token"));
            when(advancer.advance(b)).thenThrow(new RuntimeException("db down"));

            BatchResult result = engine.processDueEnrollments();

            assertEquals(new BatchResult(2, 1, 0), result);
            verify(advancer).advance(a);
            verify(advancer).advance(c);
            verify(lockService, times(3)).release(any(), eq("token"));
        }

        @Test
        @DisplayName("Locked enrollments are counted as skipped")
        void countsSkipped() {
            UUID a = UUID.randomUUID();
            UUID b = UUID.randomUUID();
            when(enrollmentRepository.findDueEnrollmentIds(EnrollmentStatus.ACTIVE, NOW)).thenReturn(List.of(a, b));
            when(lockService.tryAcquire(a)).thenReturn(Optional.of("token"));
            when(lockService.tryAcquire(b)).thenReturn(Optional.empty());

            assertEquals(new BatchResult(1, 0, 1), engine.processDueEnrollments());
        }
    }

    @Nested
    @DisplayName("handleEvent")
    class HandleEventTests {

        @Test
        @DisplayName("Scores, wakes every active enrollment of the lead and marks the event processed")
        void scoresAndWakes() {
            CrmEvent opened = event(EventType.EMAIL_OPENED, Map.of());
            Enrollment first = enrollment();
            Enrollment second = enrollment();
            when(enrollmentRepository.findByTenantIdAndEntityIdAndStatus(TENANT, LEAD, EnrollmentStatus.ACTIVE))
                    .thenReturn(List.of(first, second));
            when(lockService.tryAcquire(any())).thenReturn(Optional.of("token"));

            BatchResult result = engine.handleEvent(opened);

            assertEquals(2, result.getProcessed());
            verify(leadScoring).applyScoreEventInNewTransaction(TENANT, LEAD, EventType.EMAIL_OPENED, opened.getPayload());
            verify(advancer).advance(first.getEnrollmentId());
            verify(advancer).advance(second.getEnrollmentId());
            verify(eventIngestion).markProcessed(opened.getEventId());
            verifyNoInteractions(suppressionLedger);
        }

        @Test
        @DisplayName("Score row conflict is retried and the event still marked processed")
        void scoreConflictRetried() {
            CrmEvent replied = event(EventType.EMAIL_REPLIED, Map.of());
            when(leadScoring.applyScoreEventInNewTransaction(TENANT, LEAD, EventType.EMAIL_REPLIED, replied.getPayload()))
                    .thenThrow(new ObjectOptimisticLockingFailureException(LeadScore.class, LEAD))
                    .thenReturn(Optional.empty());

            engine.handleEvent(replied);

            verify(leadScoring, times(2))
                    .applyScoreEventInNewTransaction(TENANT, LEAD, EventType.EMAIL_REPLIED, replied.getPayload());
            verify(eventIngestion).markProcessed(replied.getEventId());
        }

        @Test
        @DisplayName("Lost first insert of a score row is retried")
        void scoreInsertRaceRetried() {
            CrmEvent opened = event(EventType.EMAIL_OPENED, Map.of());
            when(leadScoring.applyScoreEventInNewTransaction(TENANT, LEAD, EventType.EMAIL_OPENED, opened.getPayload()))
                    .thenThrow(new DataIntegrityViolationException("uk_lead_scores"))
                    .thenReturn(Optional.empty());

            engine.handleEvent(opened);

            verify(eventIngestion).markProcessed(opened.getEventId());
        }

        @Test
        @DisplayName("Persistent score conflict leaves the event unprocessed but still wakes enrollments")
        void scoreConflictExhausted() {
            CrmEvent replied = event(EventType.EMAIL_REPLIED, Map.of());
            Enrollment active = enrollment();
            when(leadScoring.applyScoreEventInNewTransaction(any(), any(), any(), any()))
                    .thenThrow(new ObjectOptimisticLockingFailureException(LeadScore.class, LEAD));
            when(enrollmentRepository.findByTenantIdAndEntityIdAndStatus(TENANT, LEAD, EnrollmentStatus.ACTIVE))
                    .thenReturn(List.of(active));
            when(lockService.tryAcquire(active.getEnrollmentId())).thenReturn(Optional.of("token"));

            engine.handleEvent(replied);

            verify(leadScoring, times(WorkflowEngine.MAX_SCORE_ATTEMPTS))
                    .applyScoreEventInNewTransaction(any(), any(), any(), any());
            verify(advancer).advance(active.getEnrollmentId());
            verify(eventIngestion, never()).markProcessed(any());
        }

        @Test
        @DisplayName("Hard bounce suppresses the recipient")
        void hardBounce() {
            engine.handleEvent(event(EventType.EMAIL_BOUNCED, Map.of("bounce_type", "hard", "to", "jane@example.com")));

            verify(suppressionLedger).suppress(TENANT, "jane@example.com", SuppressionReason.HARD_BOUNCE);
        }

        @Test
        @DisplayName("Soft bounce suppresses nothing")
        void softBounce() {
            engine.handleEvent(event(EventType.EMAIL_BOUNCED, Map.of("bounce_type", "soft", "to", "jane@example.com")));

            verifyNoInteractions(suppressionLedger);
        }

        @Test
        @DisplayName("Unsubscribe falls back to the email field")
        void unsubscribe() {
            engine.handleEvent(event(EventType.EMAIL_UNSUBSCRIBED, Map.of("email", "jane@example.com")));

            verify(suppressionLedger).suppress(TENANT, "jane@example.com", SuppressionReason.UNSUBSCRIBED);
        }

        @Test
        @DisplayName("Spam complaint suppresses the recipient")
        void complaint() {
            engine.handleEvent(event(EventType.EMAIL_COMPLAINED, Map.of("to", "jane@example.com")));

            verify(suppressionLedger).suppress(TENANT, "jane@example.com", SuppressionReason.SPAM_COMPLAINT);
        }

        @Test
        @DisplayName("Unsubscribe without an address is logged, not suppressed")
        void unsubscribeWithoutAddress() {
            engine.handleEvent(event(EventType.EMAIL_UNSUBSCRIBED, Map.of()));

            verifyNoInteractions(suppressionLedger);
            verify(eventIngestion).markProcessed(any());
        }
    }

    @Nested
    @DisplayName("enrollLead")
    class EnrollLeadTests {

        @Test
        @DisplayName("New enrollment gets its first pass right away")
        void newEnrollmentAdvanced() {
            Enrollment created = enrollment();
            Enrollment afterPass = enrollment();
            when(enrollmentService.enroll(TENANT, "cold-outreach", LEAD, Map.of()))
                    .thenReturn(new EnrollResult(created, true));
            when(lockService.tryAcquire(created.getEnrollmentId())).thenReturn(Optional.of("token"));
            when(enrollmentService.get(TENANT, created.getEnrollmentId())).thenReturn(afterPass);

            Enrollment result = engine.enrollLead(TENANT, "cold-outreach", LEAD, Map.of());

            assertSame(afterPass, result);
            verify(advancer).advance(created.getEnrollmentId());
        }

        @Test
        @DisplayName("Existing active enrollment is returned untouched")
        void existingNotAdvanced() {
            Enrollment existing = enrollment();
            when(enrollmentService.enroll(TENANT, "cold-outreach", LEAD, Map.of()))
                    .thenReturn(new EnrollResult(existing, false));

            assertSame(existing, engine.enrollLead(TENANT, "cold-outreach", LEAD, Map.of()));
            verifyNoInteractions(advancer, lockService);
        }

        @Test
        @DisplayName("A failed first pass still returns the stored enrollment")
        void firstPassFailure() {
            Enrollment created = enrollment();
            when(enrollmentService.enroll(TENANT, "cold-outreach", LEAD, Map.of()))
                    .thenReturn(new EnrollResult(created, true));
            when(lockService.tryAcquire(created.getEnrollmentId())).thenReturn(Optional.of("token"));
            when(advancer.advance(created.getEnrollmentId())).thenThrow(new RuntimeException("kafka down"));
            when(enrollmentService.get(TENANT, created.getEnrollmentId())).thenReturn(created);

            assertSame(created, engine.enrollLead(TENANT, "cold-outreach", LEAD, Map.of()));
        }
    }
}
