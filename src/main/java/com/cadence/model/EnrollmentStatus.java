package com.cadence.model;

/**
 * ACTIVE ↔ PAUSED is driven from outside the engine.
 * ACTIVE → COMPLETED | STOPPED is driven by the advancement routine.
 * COMPLETED and STOPPED are absorbing: a new enrollment is created instead.
 */
public enum EnrollmentStatus {
    ACTIVE,
    PAUSED,
    COMPLETED,
    STOPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == STOPPED;
    }
}
