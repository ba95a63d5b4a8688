package com.cadence.repository;

import com.cadence.model.SuppressionEntry;
import com.cadence.model.SuppressionReason;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SuppressionEntryRepository extends JpaRepository<SuppressionEntry, UUID> {

    Optional<SuppressionEntry> findByTenantIdAndAddress(String tenantId, String address);

    List<SuppressionEntry> findTop500ByTenantIdOrderByCreatedAtDesc(String tenantId);

    List<SuppressionEntry> findTop500ByTenantIdAndReasonOrderByCreatedAtDesc(String tenantId, SuppressionReason reason);

    long deleteByTenantIdAndAddress(String tenantId, String address);
}
