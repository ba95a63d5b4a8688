package com.cadence.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What a workflow node does when the advancement routine reaches it.
 *
 * WAIT   → schedule the next check and halt
 * SEND   → record a send intent for the lead, unless suppressed
 * BRANCH → evaluate a condition, follow "yes" or "no"
 * UPDATE → merge fields into the snapshot, optionally adjust the score
 * NOTIFY → emit an internal alert
 * ENROL  → enroll the lead into another workflow
 * STOP   → terminate the enrollment with a reason
 *
 * Strings outside this vocabulary read as UNKNOWN rather than failing, so a
 * stored graph with a bad node still loads and that node degrades to "default".
 */
public enum NodeType {
    WAIT,
    SEND,
    BRANCH,
    UPDATE,
    NOTIFY,
    ENROL,
    STOP,
    UNKNOWN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NodeType fromWireName(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("ENROLL".equals(normalized)) {
            return ENROL;
        }
        for (NodeType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
