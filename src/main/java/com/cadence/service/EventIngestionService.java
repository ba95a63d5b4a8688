package com.cadence.service;

import com.cadence.dto.IncomingEvent;
import com.cadence.dto.IngestResult;
import com.cadence.model.CrmEvent;
import com.cadence.model.EntityType;
import com.cadence.model.EventType;
import com.cadence.repository.CrmEventRepository;
import jakarta.persistence.criteria.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * The event store's write and read side.
 *
 * FLOW (ingest):
 *   1. Resolve tenant, occurredAt and the dedupe key (explicit or derived)
 *   2. Already stored for this tenant? → DUPLICATE, nothing written, nothing fired
 *   3. Persist the event
 *   4. Publish CrmEventIngested → the workflow engine wakes the lead's enrollments
 *
 * Steps 3 and 4 are not one transaction. If the process dies in between, the
 * scheduler's due-enrollment sweep still moves every enrollment forward.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventIngestionService {

    public static final String DEFAULT_TENANT = "default";

    private final CrmEventRepository eventRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public IngestResult ingest(IncomingEvent incoming) {
        Instant now = clock.instant();
        Instant occurredAt = incoming.getOccurredAt() != null ? incoming.getOccurredAt() : now;
        String tenantId = resolveTenant(incoming.getTenantId());
        String dedupeKey = hasText(incoming.getDedupeKey())
                ? incoming.getDedupeKey().trim()
                : deriveDedupeKey(incoming.getEventType(), incoming.getEntityId(), occurredAt);

        if (eventRepository.existsByTenantIdAndDedupeKey(tenantId, dedupeKey)) {
            log.info("Duplicate event discarded: tenant={}, dedupeKey={}", tenantId, dedupeKey);
            return IngestResult.duplicate(dedupeKey);
        }

        Map<String, Object> payload = incoming.getPayload() != null
                ? new HashMap<>(incoming.getPayload())
                : new HashMap<>();

        CrmEvent event = CrmEvent.builder()
                .eventId(UUID.randomUUID())
                .tenantId(tenantId)
                .eventType(incoming.getEventType())
                .entityType(incoming.getEntityType() != null ? incoming.getEntityType() : EntityType.LEAD)
                .entityId(incoming.getEntityId())
                .source(incoming.getSource())
                .occurredAt(occurredAt)
                .receivedAt(now)
                .payload(payload)
                .dedupeKey(dedupeKey)
                .recipient(recipientOf(payload))
                .processed(false)
                .build();

        try {
            eventRepository.saveAndFlush(event);
        } catch (DataIntegrityViolationException e) {
            // Lost a race with a concurrent ingestion of the same key
            log.info("Duplicate event discarded on insert: tenant={}, dedupeKey={}", tenantId, dedupeKey);
            return IngestResult.duplicate(dedupeKey);
        }

        log.info("Ingested {} for {}:{} (tenant={}, id={})",
                event.getEventType().wireName(), event.getEntityType().wireName(),
                event.getEntityId(), tenantId, event.getEventId());

        eventPublisher.publishEvent(new CrmEventIngested(event));
        return IngestResult.ingested(event);
    }

    /**
     * Events of one type for one lead whose occurredAt falls inside the trailing
     * window. Each call re-queries. Returns an empty list when storage is
     * unreachable, so a windowed branch condition fails closed.
     */
    @Transactional(readOnly = true)
    public List<CrmEvent> getEventsInWindow(String tenantId, String entityId,
                                            EventType eventType, Duration window) {
        Instant since = clock.instant().minus(window);
        try {
            return eventRepository.findByTenantIdAndEntityIdAndEventTypeAndOccurredAtGreaterThanEqual(
                    tenantId, entityId, eventType, since);
        } catch (DataAccessException e) {
            log.warn("Event window query failed for {}:{} ({}): {}",
                    tenantId, entityId, eventType.wireName(), e.getMessage());
            return List.of();
        }
    }

    @Transactional
    public void markProcessed(UUID eventId) {
        eventRepository.markProcessed(eventId);
    }

    @Transactional(readOnly = true)
    public Page<CrmEvent> search(String tenantId, String source, Boolean processed,
                                 Collection<EventType> eventTypes, String query,
                                 int limit, int offset) {
        Specification<CrmEvent> spec = (root, cq, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            predicates.add(cb.equal(root.get("tenantId"), tenantId));
            if (hasText(source)) {
                predicates.add(cb.equal(root.get("source"), source));
            }
            if (processed != null) {
                predicates.add(cb.equal(root.get("processed"), processed));
            }
            if (eventTypes != null && !eventTypes.isEmpty()) {
                predicates.add(root.get("eventType").in(eventTypes));
            }
            if (hasText(query)) {
                predicates.add(cb.like(cb.lower(root.get("entityId")),
                        "%" + query.toLowerCase(Locale.ROOT) + "%"));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
        int size = Math.max(1, Math.min(limit, 500));
        PageRequest page = PageRequest.of(Math.max(0, offset) / size, size,
                Sort.by(Sort.Direction.DESC, "occurredAt"));
        return eventRepository.findAll(spec, page);
    }

    /**
     * Fallback key when a producer sends none: eventType:entityId:occurredAt.
     * Two distinct real events for the same lead with the same type and
     * timestamp collapse into one; producers that can tell them apart should
     * pass their own key.
     */
    static String deriveDedupeKey(EventType eventType, String entityId, Instant occurredAt) {
        return eventType.wireName() + ":" + entityId + ":" + occurredAt.toString();
    }

    static String resolveTenant(String tenantId) {
        return hasText(tenantId) ? tenantId.trim() : DEFAULT_TENANT;
    }

    private static String recipientOf(Map<String, Object> payload) {
        Object to = payload.get("to");
        return to instanceof String && !((String) to).isBlank()
                ? ((String) to).trim().toLowerCase(Locale.ROOT)
                : null;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
