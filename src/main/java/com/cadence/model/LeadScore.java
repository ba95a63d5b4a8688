package com.cadence.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Stored (undecayed) score of one lead. Decay is applied on read by the scorer,
 * so score here is the value as of lastActivityAt.
 */
@Entity
@Table(name = "lead_scores", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"tenant_id", "entity_id"})
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class LeadScore {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "entity_id", nullable = false)
    private String entityId;

    @Column(nullable = false)
    private int score;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private ScoreTier tier = ScoreTier.COLD;

    @Column(name = "last_activity_at")
    private Instant lastActivityAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private long version;

    /**
     * Sets the score clamped at zero and keeps the tier in step with it.
     */
    public void applyScore(int newScore, Instant now) {
        this.score = Math.max(0, newScore);
        this.tier = ScoreTier.of(this.score);
        this.lastActivityAt = now;
        this.updatedAt = now;
    }
}
