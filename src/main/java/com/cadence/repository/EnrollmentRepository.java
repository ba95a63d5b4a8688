package com.cadence.repository;

import com.cadence.model.Enrollment;
import com.cadence.model.EnrollmentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface EnrollmentRepository extends JpaRepository<Enrollment, UUID> {

    Optional<Enrollment> findFirstByTenantIdAndWorkflowIdAndEntityIdAndStatus(
            String tenantId, String workflowId, String entityId, EnrollmentStatus status);

    List<Enrollment> findByTenantIdAndEntityIdAndStatus(
            String tenantId, String entityId, EnrollmentStatus status);

    List<Enrollment> findTop200ByTenantIdOrderByLastTransitionAtDesc(String tenantId);

    List<Enrollment> findTop200ByTenantIdAndStatusOrderByLastTransitionAtDesc(
            String tenantId, EnrollmentStatus status);

    // Scheduler sweep: active and due (or never scheduled)
    @Query("select e.enrollmentId from Enrollment e where e.status = :status "
            + "and (e.nextCheckAt is null or e.nextCheckAt <= :now) order by e.nextCheckAt asc")
    List<UUID> findDueEnrollmentIds(@Param("status") EnrollmentStatus status, @Param("now") Instant now);

    long countByTenantIdAndWorkflowIdAndStatus(String tenantId, String workflowId, EnrollmentStatus status);
}
