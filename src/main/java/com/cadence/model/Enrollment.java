package com.cadence.model;

import com.cadence.model.converter.JsonMapConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A lead's live position inside one workflow version.
 *
 * stateSnapshot is enrollment-local: seeded from the enroll call, extended by
 * update nodes, and used for engine bookkeeping under underscore-prefixed keys
 * (the last pending send, the wait node currently armed).
 *
 * version guards the read-modify-write of currentNodeId/stateSnapshot against
 * a concurrent event wake-up and scheduler sweep.
 *
 * activeKey is tenant:workflow:entity while the enrollment is ACTIVE and null
 * otherwise. Its unique constraint lets the database reject a second ACTIVE
 * enrollment of the same lead in the same workflow.
 */
@Entity
@Table(name = "workflow_enrollments", indexes = {
    @Index(name = "enrollment_tenant_entity_idx", columnList = "tenant_id, entity_id, status"),
    @Index(name = "enrollment_due_idx", columnList = "status, next_check_at")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class Enrollment {

    public static final String SNAPSHOT_PENDING_SEND = "_pendingSend";
    public static final String SNAPSHOT_WAIT_NODE = "_waitNode";

    @Id
    @Column(name = "enrollment_id")
    private UUID enrollmentId;

    @Column(name = "workflow_id", nullable = false)
    private String workflowId;

    @Column(name = "workflow_version", nullable = false)
    private int workflowVersion;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "entity_id", nullable = false)
    private String entityId;

    @Column(name = "current_node_id", nullable = false)
    private String currentNodeId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private EnrollmentStatus status = EnrollmentStatus.ACTIVE;

    private String outcome;

    @Column(name = "entered_at", nullable = false)
    private Instant enteredAt;

    @Column(name = "last_transition_at", nullable = false)
    private Instant lastTransitionAt;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "state_snapshot", columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, Object> stateSnapshot = new LinkedHashMap<>();

    @Column(name = "next_check_at")
    private Instant nextCheckAt;

    @Column(name = "active_key", unique = true)
    @Setter(AccessLevel.NONE)
    private String activeKey;

    @Version
    private long version;

    public boolean isActive() {
        return status == EnrollmentStatus.ACTIVE;
    }

    public void setStatus(EnrollmentStatus status) {
        this.status = status;
        syncActiveKey();
    }

    @PrePersist
    @PreUpdate
    void syncActiveKey() {
        activeKey = isActive() ? tenantId + ":" + workflowId + ":" + entityId : null;
    }
}
