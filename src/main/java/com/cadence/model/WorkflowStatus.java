package com.cadence.model;

/**
 * Lifecycle of a workflow definition.
 * DRAFT and ACTIVE accept new enrollments; PAUSED and ARCHIVED refuse them.
 * Existing enrollments keep running against the version they were created on.
 */
public enum WorkflowStatus {
    DRAFT,
    ACTIVE,
    PAUSED,
    ARCHIVED;

    public boolean acceptsEnrollments() {
        return this == DRAFT || this == ACTIVE;
    }
}
