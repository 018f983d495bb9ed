package com.reactive.httptrace.observe;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Implementation of observability with SLF4J and OpenTelemetry.
 *
 * ALL third-party types (SLF4J, OpenTelemetry) are confined to this package.
 */
final class LogImpl {

    private static final StackWalker WALKER = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);
    private static final ConcurrentMap<Class<?>, Logger> LOGGERS = new ConcurrentHashMap<>();
    private static final ConcurrentMap<String, Logger> TARGET_LOGGERS = new ConcurrentHashMap<>();

    private static final String LOG_CLASS = Log.class.getName();
    private static final String IMPL_CLASS = LogImpl.class.getName();

    // ========================================================================
    // Caller-attributed logging
    // ========================================================================

    void log(Level level, String format, Object... args) {
        write(getCallerLogger(), level, format, args);
    }

    void error(String message, Throwable t) {
        getCallerLogger().error(message, t);
    }

    // ========================================================================
    // Structured events
    // ========================================================================

    /**
     * Record an event on the current span and log it under the target's logger.
     */
    void event(Level level, String target, String message, Map<String, ?> fields) {
        Dispatcher dispatcher = Dispatcher.current();
        if (!dispatcher.isEnabled(level)) {
            return;
        }

        Span current = Span.current();
        if (current.isRecording()) {
            current.addEvent(message, attributes(level, fields));
        }

        String resolvedTarget = target != null ? target : dispatcher.defaultTarget();
        Logger logger = TARGET_LOGGERS.computeIfAbsent(resolvedTarget, LoggerFactory::getLogger);
        if (isEnabled(logger, level)) {
            write(logger, level, "{}", render(message, fields));
        }
    }

    // ========================================================================
    // Trace Context
    // ========================================================================

    String traceId() {
        String id = Span.current().getSpanContext().getTraceId();
        return "00000000000000000000000000000000".equals(id) ? "" : id;
    }

    String spanId() {
        String id = Span.current().getSpanContext().getSpanId();
        return "0000000000000000".equals(id) ? "" : id;
    }

    // ========================================================================
    // Attributes
    // ========================================================================

    static void setAttribute(Span span, String key, Object value) {
        if (value instanceof String s) span.setAttribute(key, s);
        else if (value instanceof Long l) span.setAttribute(key, l);
        else if (value instanceof Integer i) span.setAttribute(key, (long) i);
        else if (value instanceof Boolean b) span.setAttribute(key, b);
        else if (value instanceof Double d) span.setAttribute(key, d);
        else span.setAttribute(key, String.valueOf(value));
    }

    static Attributes attributes(Level level, Map<String, ?> fields) {
        AttributesBuilder builder = Attributes.builder().put(DiagnosticSpan.LEVEL_ATTRIBUTE, level.token());
        fields.forEach((k, v) -> {
            if (v instanceof String s) builder.put(k, s);
            else if (v instanceof Long l) builder.put(k, l);
            else if (v instanceof Integer i) builder.put(k, (long) i);
            else if (v instanceof Boolean b) builder.put(k, b);
            else if (v instanceof Double d) builder.put(k, d);
            else builder.put(k, String.valueOf(v));
        });
        return builder.build();
    }

    static String render(String message, Map<String, ?> fields) {
        StringBuilder line = new StringBuilder(message);
        fields.forEach((k, v) -> {
            if (line.length() > 0) {
                line.append(' ');
            }
            line.append(k).append('=').append(v);
        });
        return line.toString();
    }

    // ========================================================================
    // SLF4J plumbing
    // ========================================================================

    private static boolean isEnabled(Logger logger, Level level) {
        return switch (level) {
            case TRACE -> logger.isTraceEnabled();
            case DEBUG -> logger.isDebugEnabled();
            case INFO -> logger.isInfoEnabled();
            case WARN -> logger.isWarnEnabled();
            case ERROR -> logger.isErrorEnabled();
        };
    }

    private static void write(Logger logger, Level level, String format, Object... args) {
        switch (level) {
            case TRACE -> logger.trace(format, args);
            case DEBUG -> logger.debug(format, args);
            case INFO -> logger.info(format, args);
            case WARN -> logger.warn(format, args);
            case ERROR -> logger.error(format, args);
        }
    }

    private Logger getCallerLogger() {
        Class<?> callerClass = WALKER.walk(frames -> frames
                .map(StackWalker.StackFrame::getDeclaringClass)
                .filter(c -> !c.getName().equals(LOG_CLASS) && !c.getName().equals(IMPL_CLASS))
                .findFirst()
                .orElse(LogImpl.class));

        return LOGGERS.computeIfAbsent(callerClass, LoggerFactory::getLogger);
    }
}
