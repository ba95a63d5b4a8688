package com.cadence.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A (tenant, address) pair that must not be contacted.
 * A null expiresAt means permanent.
 */
@Entity
@Table(name = "suppression_entries", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"tenant_id", "address"})
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class SuppressionEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String address;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SuppressionReason reason;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
