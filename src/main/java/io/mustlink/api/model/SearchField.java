package io.mustlink.api.model;

import java.util.Locale;

import io.mustlink.api.clients.InvalidArgumentException;

/**
 * Parameter field a full-text search runs against.
 */
public enum SearchField {
    NAME("Name"),
    DESCRIPTION("Description");

    private final String serviceKey;

    SearchField(String serviceKey) {
        this.serviceKey = serviceKey;
    }

    /** Key the service expects in the {@code key} query parameter. */
    public String getServiceKey() {
        return serviceKey;
    }

    public static SearchField fromString(String value) {
        if (value != null) {
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            for (SearchField f : values()) {
                if (f.name().equals(normalized)) {
                    return f;
                }
            }
        }
        throw new InvalidArgumentException("search field must be either description or name: " + value);
    }
}
