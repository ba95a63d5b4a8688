package com.cadence.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EntityType {
    LEAD,
    CONTACT,
    DEAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EntityType fromWireName(String value) {
        return value == null ? LEAD : EntityType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
