package com.questrail.matchsync.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Game length variant. Serialized in lower case ({@code "quick"}, {@code "long"}).
 */
public enum GameLength
{
    QUICK,
    LONG;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static GameLength fromWire(String value) {
        return GameLength.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
