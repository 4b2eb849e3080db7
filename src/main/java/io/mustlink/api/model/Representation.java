package io.mustlink.api.model;

import java.util.Locale;

import io.mustlink.api.clients.InvalidArgumentException;

/**
 * Payload shape requested from the service. SIMPLE returns flat records, COMPLEX wraps
 * values (table cells, parameter metadata) in descriptor objects.
 */
public enum Representation {
    SIMPLE,
    COMPLEX;

    public static Representation fromString(String value) {
        if (value != null) {
            for (Representation r : values()) {
                if (r.name().equals(value.trim().toUpperCase(Locale.ROOT))) {
                    return r;
                }
            }
        }
        throw new InvalidArgumentException("representation must be one of simple, complex: " + value);
    }
}
