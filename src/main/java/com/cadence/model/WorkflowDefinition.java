package com.cadence.model;

import com.cadence.model.converter.WorkflowGraphConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One stored version of a workflow.
 *
 * Rows are append-only per (tenantId, workflowId): changing the graph stores
 * version + 1, so an enrollment pinned to an older version keeps executing the
 * graph it was created on. Only name and status are updated in place.
 *
 * Example:
 *   workflowId = "cold-outreach"
 *   version    = 3
 *   status     = ACTIVE
 *   graph      = { entry_node_id: "send-1", nodes: [ ... ] }
 */
@Entity
@Table(name = "workflow_definitions", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"tenant_id", "workflow_id", "version"})
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class WorkflowDefinition {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workflow_id", nullable = false)
    private String workflowId;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    @Builder.Default
    private int version = 1;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private WorkflowStatus status = WorkflowStatus.DRAFT;

    @Convert(converter = WorkflowGraphConverter.class)
    @Column(name = "graph", columnDefinition = "TEXT", nullable = false)
    private WorkflowGraph graph;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    @Builder.Default
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
