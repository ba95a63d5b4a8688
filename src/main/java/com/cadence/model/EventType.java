package com.cadence.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Canonical interaction event vocabulary.
 *
 * Serialized in its lower-case wire form ("email_opened", "page_visit", ...)
 * so producers can post the same strings they already use.
 */
public enum EventType {
    // Email
    EMAIL_SENT,
    EMAIL_DELIVERED,
    EMAIL_OPENED,
    EMAIL_CLICKED,
    EMAIL_REPLIED,
    EMAIL_BOUNCED,
    EMAIL_UNSUBSCRIBED,
    EMAIL_COMPLAINED,
    // Web
    PAGE_VISIT,
    TIME_ON_PAGE,
    FORM_STARTED,
    FORM_SUBMITTED,
    // CRM
    FIELD_UPDATE,
    TAG_ADDED,
    OWNER_CHANGED,
    // Meeting
    MEETING_BOOKED,
    // Manual
    SCORE_ADJUSTMENT,
    MANUAL_TAG;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EventType fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("eventType is required");
        }
        return EventType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
