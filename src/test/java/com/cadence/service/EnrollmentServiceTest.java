package com.cadence.service;

import com.cadence.dto.EnrollResult;
import com.cadence.exception.EnrollmentNotFoundException;
import com.cadence.exception.WorkflowNotFoundException;
import com.cadence.model.*;
import com.cadence.repository.EnrollmentRepository;
import com.cadence.repository.WorkflowDefinitionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;

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
class EnrollmentServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String TENANT = "acme";

    @Mock private EnrollmentRepository enrollmentRepository;
    @Mock private WorkflowDefinitionRepository definitionRepository;
    @Mock private PlatformTransactionManager transactionManager;

    private EnrollmentService enrollmentService;

    @BeforeEach
    void setUp() {
        enrollmentService = new EnrollmentService(enrollmentRepository, definitionRepository, transactionManager,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private WorkflowDefinition definition(WorkflowStatus status) {
        WorkflowNode stop = WorkflowNode.builder().nodeId("end").type(NodeType.STOP).build();
        return WorkflowDefinition.builder()
                .workflowId("cold-outreach")
                .tenantId(TENANT)
                .name("Cold outreach")
                .version(3)
                .status(status)
                .graph(WorkflowGraph.builder().entryNodeId("end").nodes(List.of(stop)).build())
                .build();
    }

    private Enrollment enrollment(EnrollmentStatus status) {
        return Enrollment.builder()
                .enrollmentId(UUID.randomUUID())
                .workflowId("cold-outreach")
                .tenantId(TENANT)
                .entityId("lead-1")
                .currentNodeId("end")
                .status(status)
                .enteredAt(NOW)
                .lastTransitionAt(NOW)
                .build();
    }

    @Nested
    @DisplayName("enroll")
    class EnrollTests {

        @Test
        @DisplayName("Creates an enrollment at the entry node of the latest version, due now")
        void createsEnrollment() {
            when(definitionRepository.findFirstByTenantIdAndWorkflowIdOrderByVersionDesc(TENANT, "cold-outreach"))
                    .thenReturn(Optional.of(definition(WorkflowStatus.ACTIVE)));

            EnrollResult result = enrollmentService.enroll(TENANT, "cold-outreach", "lead-1",
                    Map.of("email", "jane@example.com", Enrollment.SNAPSHOT_WAIT_NODE, "stale"));

            assertTrue(result.isCreated());
            Enrollment created = result.getEnrollment();
            assertEquals("end", created.getCurrentNodeId());
            assertEquals(3, created.getWorkflowVersion());
            assertEquals(EnrollmentStatus.ACTIVE, created.getStatus());
            assertEquals(NOW, created.getNextCheckAt());
            assertEquals("jane@example.com", created.getStateSnapshot().get("email"));
            assertFalse(created.getStateSnapshot().containsKey(Enrollment.SNAPSHOT_WAIT_NODE));
            verify(enrollmentRepository).saveAndFlush(created);
            verify(transactionManager).commit(any());
        }

        @Test
        @DisplayName("Second enroll while active returns the same enrollment and writes nothing")
        void idempotentWhileActive() {
            Enrollment active = enrollment(EnrollmentStatus.ACTIVE);
            when(enrollmentRepository.findFirstByTenantIdAndWorkflowIdAndEntityIdAndStatus(
                    TENANT, "cold-outreach", "lead-1", EnrollmentStatus.ACTIVE)).thenReturn(Optional.of(active));

            EnrollResult result = enrollmentService.enroll(TENANT, "cold-outreach", "lead-1", null);

            assertFalse(result.isCreated());
            assertSame(active, result.getEnrollment());
            verify(enrollmentRepository, never()).saveAndFlush(any());
            verifyNoInteractions(definitionRepository);
        }

        @Test
        @DisplayName("Unknown workflow is rejected")
        void unknownWorkflow() {
            when(definitionRepository.findFirstByTenantIdAndWorkflowIdOrderByVersionDesc(any(), any()))
                    .thenReturn(Optional.empty());

            assertThrows(WorkflowNotFoundException.class,
                    () -> enrollmentService.enroll(TENANT, "missing", "lead-1", null));
        }

        @Test
        @DisplayName("Archived workflow refuses new enrollments")
        void archivedWorkflow() {
            when(definitionRepository.findFirstByTenantIdAndWorkflowIdOrderByVersionDesc(any(), any()))
                    .thenReturn(Optional.of(definition(WorkflowStatus.ARCHIVED)));

            assertThrows(IllegalStateException.class,
                    () -> enrollmentService.enroll(TENANT, "cold-outreach", "lead-1", null));
            verify(enrollmentRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("Losing a concurrent enroll returns the winner's enrollment")
        void lostRaceReturnsWinner() {
            Enrollment winner = enrollment(EnrollmentStatus.ACTIVE);
            when(enrollmentRepository.findFirstByTenantIdAndWorkflowIdAndEntityIdAndStatus(
                    TENANT, "cold-outreach", "lead-1", EnrollmentStatus.ACTIVE))
                    .thenReturn(Optional.empty(), Optional.of(winner));
            when(definitionRepository.findFirstByTenantIdAndWorkflowIdOrderByVersionDesc(TENANT, "cold-outreach"))
                    .thenReturn(Optional.of(definition(WorkflowStatus.ACTIVE)));
            when(enrollmentRepository.saveAndFlush(any(Enrollment.class)))
                    .thenThrow(new DataIntegrityViolationException("active_key"));

            EnrollResult result = enrollmentService.enroll(TENANT, "cold-outreach", "lead-1", null);

            assertFalse(result.isCreated());
            assertSame(winner, result.getEnrollment());
            verify(transactionManager).rollback(any());
        }

        @Test
        @DisplayName("Constraint violation with no active winner is rethrown")
        void violationWithoutWinner() {
            when(definitionRepository.findFirstByTenantIdAndWorkflowIdOrderByVersionDesc(TENANT, "cold-outreach"))
                    .thenReturn(Optional.of(definition(WorkflowStatus.ACTIVE)));
            when(enrollmentRepository.saveAndFlush(any(Enrollment.class)))
                    .thenThrow(new DataIntegrityViolationException("not null"));

            assertThrows(DataIntegrityViolationException.class,
                    () -> enrollmentService.enroll(TENANT, "cold-outreach", "lead-1", null));
        }
    }

    @Nested
    @DisplayName("External control")
    class ControlTests {

        @Test
        @DisplayName("pause then resume makes the enrollment due again")
        void pauseAndResume() {
            Enrollment active = enrollment(EnrollmentStatus.ACTIVE);
            when(enrollmentRepository.findById(active.getEnrollmentId())).thenReturn(Optional.of(active));
            when(enrollmentRepository.save(active)).thenReturn(active);

            enrollmentService.pause(TENANT, active.getEnrollmentId());
            assertEquals(EnrollmentStatus.PAUSED, active.getStatus());

            enrollmentService.resume(TENANT, active.getEnrollmentId());
            assertEquals(EnrollmentStatus.ACTIVE, active.getStatus());
            assertEquals(NOW, active.getNextCheckAt());
        }

        @Test
        @DisplayName("Resume is refused while the lead was re-enrolled during the pause")
        void resumeRefusedWhenReEnrolled() {
            Enrollment paused = enrollment(EnrollmentStatus.PAUSED);
            Enrollment newer = enrollment(EnrollmentStatus.ACTIVE);
            when(enrollmentRepository.findById(paused.getEnrollmentId())).thenReturn(Optional.of(paused));
            when(enrollmentRepository.findFirstByTenantIdAndWorkflowIdAndEntityIdAndStatus(
                    TENANT, "cold-outreach", "lead-1", EnrollmentStatus.ACTIVE)).thenReturn(Optional.of(newer));

            assertThrows(IllegalStateException.class,
                    () -> enrollmentService.resume(TENANT, paused.getEnrollmentId()));
            assertEquals(EnrollmentStatus.PAUSED, paused.getStatus());
            verify(enrollmentRepository, never()).save(any());
        }

        @Test
        @DisplayName("stop records manual_stop")
        void stop() {
            Enrollment active = enrollment(EnrollmentStatus.ACTIVE);
            when(enrollmentRepository.findById(active.getEnrollmentId())).thenReturn(Optional.of(active));
            when(enrollmentRepository.save(active)).thenReturn(active);

            enrollmentService.stop(TENANT, active.getEnrollmentId());

            assertEquals(EnrollmentStatus.STOPPED, active.getStatus());
            assertEquals("manual_stop", active.getOutcome());
        }

        @Test
        @DisplayName("Completed enrollment cannot be resumed")
        void terminalCannotResume() {
            Enrollment completed = enrollment(EnrollmentStatus.COMPLETED);
            when(enrollmentRepository.findById(completed.getEnrollmentId())).thenReturn(Optional.of(completed));

            assertThrows(IllegalStateException.class,
                    () -> enrollmentService.resume(TENANT, completed.getEnrollmentId()));
        }

        @Test
        @DisplayName("Enrollment of another tenant is not found")
        void otherTenant() {
            Enrollment active = enrollment(EnrollmentStatus.ACTIVE);
            when(enrollmentRepository.findById(active.getEnrollmentId())).thenReturn(Optional.of(active));

            assertThrows(EnrollmentNotFoundException.class,
                    () -> enrollmentService.pause("other", active.getEnrollmentId()));
        }
    }
}
