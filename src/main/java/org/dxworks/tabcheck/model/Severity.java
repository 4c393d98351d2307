package org.dxworks.tabcheck.model;

import java.util.Locale;
import java.util.Optional;

public enum Severity {
    ERROR,
    WARNING,
    INFO,
    HIDDEN;

    public static Optional<Severity> fromName(String name) {
        if (name == null) return Optional.empty();
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
