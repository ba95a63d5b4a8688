package com.cadence.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "nurture_enrollments", indexes = {
    @Index(name = "nurture_tenant_entity_idx", columnList = "tenant_id, entity_id, status")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class NurtureEnrollment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "entity_id", nullable = false)
    private String entityId;

    @Column(name = "nurture_workflow_id", nullable = false)
    private String nurtureWorkflowId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private NurtureStatus status = NurtureStatus.ACTIVE;

    @Column(name = "next_send_at")
    private Instant nextSendAt;

    @Column(name = "content_index", nullable = false)
    private int contentIndex;

    @Column(name = "enrolled_at", nullable = false)
    private Instant enrolledAt;

    @Column(name = "last_activity_at")
    private Instant lastActivityAt;

    /**
     * Last sign of life: lastActivityAt, or enrolledAt when none was recorded.
     */
    public Instant lastSeenAt() {
        return lastActivityAt != null ? lastActivityAt : enrolledAt;
    }
}
