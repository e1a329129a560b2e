package com.openforge.setlist.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of account roles. Checked by exact match only, there is no
 * hierarchy between them.
 */
public enum Role {
    USER,
    ARTIST,
    PROMOTER,
    VENUE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Role fromWire(String value) {
        if (value == null) {
            return null;
        }
        return Role.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
