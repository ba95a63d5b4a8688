package com.cadence.model;

/**
 * ACTIVE   → lead is in the slow-cadence track
 * EXITED   → lead re-entered a primary workflow and the exit-on-re-entry policy is on
 * ARCHIVED → no activity for the archive period; terminal, never re-enrolled automatically
 */
public enum NurtureStatus {
    ACTIVE,
    EXITED,
    ARCHIVED
}
