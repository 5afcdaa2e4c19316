package com.questrail.matchsync.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Side of a match. Serialized in lower case ({@code "titans"}, {@code "atlanteans"}).
 */
public enum Team
{
    TITANS,
    ATLANTEANS;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Team fromWire(String value) {
        return Team.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
