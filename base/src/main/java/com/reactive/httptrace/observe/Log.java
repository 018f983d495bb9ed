package com.reactive.httptrace.observe;

import java.util.Map;

/**
 * Unified observability API.
 *
 * NO third-party types in this class.
 * SLF4J and OpenTelemetry details hidden in implementation.
 *
 * Usage:
 *   import static com.reactive.httptrace.observe.Log.*;
 *
 *   // Plain logging, attributed to the calling class
 *   info("Processed request: {}", path);
 *   error("Failed to flush", exception);
 *
 *   // Structured event on the current span
 *   event(Level.DEBUG, "cache hit", Map.of("key", key));
 */
public final class Log {

    private static final LogImpl impl = new LogImpl();

    private Log() {}

    // ========================================================================
    // Plain Logging
    // ========================================================================

    public static void info(String format, Object... args) {
        impl.log(Level.INFO, format, args);
    }

    public static void warn(String format, Object... args) {
        impl.log(Level.WARN, format, args);
    }

    public static void error(String format, Object... args) {
        impl.log(Level.ERROR, format, args);
    }

    public static void error(String message, Throwable t) {
        impl.error(message, t);
    }

    // ========================================================================
    // Structured Events
    // ========================================================================

    /**
     * Emit an event under the dispatcher's default target.
     */
    public static void event(Level level, String message) {
        impl.event(level, null, message, Map.of());
    }

    /**
     * Emit an event with fields under the dispatcher's default target.
     */
    public static void event(Level level, String message, Map<String, ?> fields) {
        impl.event(level, null, message, fields);
    }

    /**
     * Emit an event with fields under an explicit target.
     *
     * The event is attributed to whichever span is entered on the calling thread.
     */
    public static void event(Level level, String target, String message, Map<String, ?> fields) {
        impl.event(level, target, message, fields);
    }

    // ========================================================================
    // Trace Context
    // ========================================================================

    /**
     * Current trace ID, or empty string if no span is entered.
     */
    public static String traceId() {
        return impl.traceId();
    }

    /**
     * Current span ID, or empty string if no span is entered.
     */
    public static String spanId() {
        return impl.spanId();
    }
}
