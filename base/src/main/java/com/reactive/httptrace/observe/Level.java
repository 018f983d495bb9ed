package com.reactive.httptrace.observe;

import java.util.Locale;

/**
 * Severity of spans and events, ordered from most to least verbose.
 */
public enum Level {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR;

    /**
     * True if a span or event at this level passes a dispatcher keeping {@code max} and above.
     */
    public boolean isEnabled(Level max) {
        return compareTo(max) >= 0;
    }

    /**
     * Lower-case token used in span attributes ("info", "debug").
     */
    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Level parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("level must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown level '" + value + "'", e);
        }
    }
}
