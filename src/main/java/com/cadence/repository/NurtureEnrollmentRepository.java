package com.cadence.repository;

import com.cadence.model.NurtureEnrollment;
import com.cadence.model.NurtureStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface NurtureEnrollmentRepository extends JpaRepository<NurtureEnrollment, UUID> {

    boolean existsByTenantIdAndEntityIdAndStatus(String tenantId, String entityId, NurtureStatus status);

    Optional<NurtureEnrollment> findFirstByTenantIdAndEntityIdAndStatus(
            String tenantId, String entityId, NurtureStatus status);

    List<NurtureEnrollment> findByStatus(NurtureStatus status);
}
