package com.cadence.repository;

import com.cadence.model.CrmEvent;
import com.cadence.model.EventType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Database access for the canonical event log.
 *
 * existsByTenantIdAndDedupeKey is the idempotency lookup; the unique
 * (tenant_id, dedupe_key) constraint backs it when two ingestions race.
 */
public interface CrmEventRepository extends JpaRepository<CrmEvent, UUID>, JpaSpecificationExecutor<CrmEvent> {

    boolean existsByTenantIdAndDedupeKey(String tenantId, String dedupeKey);

    // Windowed condition queries
    List<CrmEvent> findByTenantIdAndEntityIdAndEventTypeAndOccurredAtGreaterThanEqual(
            String tenantId, String entityId, EventType eventType, Instant since);

    // Frequency cap: sends to one recipient in a window
    long countByTenantIdAndEventTypeAndRecipientAndOccurredAtGreaterThanEqual(
            String tenantId, EventType eventType, String recipient, Instant since);

    // Domain throttle: sends to any recipient at a domain in a window
    long countByTenantIdAndEventTypeAndRecipientEndingWithAndOccurredAtGreaterThanEqual(
            String tenantId, EventType eventType, String domainSuffix, Instant since);

    Page<CrmEvent> findByTenantIdOrderByOccurredAtDesc(String tenantId, Pageable pageable);

    @Modifying
    @Query("update CrmEvent e set e.processed = true where e.eventId = :eventId and e.processed = false")
    int markProcessed(@Param("eventId") UUID eventId);
}
