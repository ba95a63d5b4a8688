package com.cadence.dto;

import com.cadence.model.EntityType;
import com.cadence.model.EventType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.time.Instant;
import java.util.Map;

/**
 * An interaction reported by any producer (mail-tracking webhook, web pixel,
 * CRM hook, manual action).
 *
 * Example JSON:
 * {
 *   "eventType": "email_opened",
 *   "entityType": "lead",
 *   "entityId": "lead-42",
 *   "tenantId": "acme",
 *   "source": "mail-tracking",
 *   "occurredAt": "2026-03-01T10:15:00Z",
 *   "dedupeKey": "sg-evt-8f1c",
 *   "payload": { "to": "jane@example.com", "is_repeat_open": true }
 * }
 *
 * - dedupeKey:  optional; producers that can redeliver (webhooks) should send a
 *               stable provider id. When absent it is derived from
 *               eventType, entityId and occurredAt.
 * - occurredAt: optional; defaults to the time of ingestion.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class IncomingEvent {

    @NotNull(message = "eventType is required")
    private EventType eventType;

    @Builder.Default
    private EntityType entityType = EntityType.LEAD;

    @NotBlank(message = "entityId is required")
    private String entityId;

    private String tenantId;

    @NotBlank(message = "source is required")
    private String source;

    private Instant occurredAt;

    private String dedupeKey;

    private Map<String, Object> payload;
}
