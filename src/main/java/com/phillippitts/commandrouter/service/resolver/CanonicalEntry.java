package com.phillippitts.commandrouter.service.resolver;

import java.util.Objects;

/**
 * Canonical record a directory alias points to.
 *
 * @param label display name, e.g. "Shivam Patel"
 * @param value machine value, e.g. a phone number or an application identifier
 */
public record CanonicalEntry(String label, String value) {

    public CanonicalEntry {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(value, "value");
        if (label.isBlank()) {
            throw new IllegalArgumentException("label must not be blank");
        }
    }
}
