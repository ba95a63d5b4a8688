package com.cadence.model;

import com.cadence.model.converter.JsonMapConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * An immutable interaction fact in the canonical event log.
 *
 * (tenantId, dedupeKey) is unique: a second ingestion with the same key is
 * discarded, never merged. occurredAt is producer time and may lag receivedAt
 * for late deliveries. The only mutation after insert is processed → true.
 */
@Entity
@Table(name = "crm_events",
        uniqueConstraints = @UniqueConstraint(
                name = "crm_events_tenant_dedupe_unique",
                columnNames = {"tenant_id", "dedupe_key"}),
        indexes = {
                @Index(name = "crm_events_entity_idx", columnList = "tenant_id, entity_id, event_type"),
                @Index(name = "crm_events_occurred_idx", columnList = "occurred_at"),
                @Index(name = "crm_events_recipient_idx", columnList = "tenant_id, event_type, recipient")
        })
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class CrmEvent {

    @Id
    @Column(name = "event_id")
    private UUID eventId;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false)
    private EventType eventType;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false)
    private EntityType entityType;

    @Column(name = "entity_id", nullable = false)
    private String entityId;

    @Column(nullable = false)
    private String source;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    @Column(name = "received_at", nullable = false)
    private Instant receivedAt;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, Object> payload = new HashMap<>();

    @Column(name = "dedupe_key", nullable = false, length = 512)
    private String dedupeKey;

    /**
     * Lower-cased payload.to, kept as a column so send-frequency checks
     * can count per recipient without scanning payloads.
     */
    private String recipient;

    @Builder.Default
    private boolean processed = false;
}
