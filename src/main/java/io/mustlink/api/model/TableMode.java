package io.mustlink.api.model;

import java.util.Locale;

import io.mustlink.api.clients.InvalidArgumentException;

/**
 * Amount of detail returned per table row.
 */
public enum TableMode {
    BRIEF,
    FULL;

    public static TableMode fromString(String value) {
        if (value != null) {
            for (TableMode m : values()) {
                if (m.name().equals(value.trim().toUpperCase(Locale.ROOT))) {
                    return m;
                }
            }
        }
        throw new InvalidArgumentException("mode must be one of brief, full: " + value);
    }
}
