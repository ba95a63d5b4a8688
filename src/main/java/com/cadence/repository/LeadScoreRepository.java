package com.cadence.repository;

import com.cadence.model.LeadScore;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface LeadScoreRepository extends JpaRepository<LeadScore, UUID> {

    Optional<LeadScore> findByTenantIdAndEntityId(String tenantId, String entityId);

    List<LeadScore> findByTenantIdOrderByScoreDesc(String tenantId);
}
