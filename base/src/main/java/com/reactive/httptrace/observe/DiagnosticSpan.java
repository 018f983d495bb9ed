package com.reactive.httptrace.observe;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.context.Context;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * A named, leveled diagnostic scope.
 *
 * Creating a span does not make it current. {@link #enter()} does, and may be
 * called any number of times, from any thread, for as long as the span lives;
 * events emitted while it is entered are attributed to it, and spans started
 * while it is entered become its children.
 *
 * Usage:
 * <pre>
 *   DiagnosticSpan span = DiagnosticSpan.info("request")
 *       .field("method", "GET")
 *       .start();
 *   try (SpanScope scope = span.enter()) {
 *       Log.event(Level.TRACE, "received request");
 *   }
 *   span.end();
 * </pre>
 *
 * A span whose level the dispatcher filters out is disabled: entering it leaves
 * the current span untouched and recording on it does nothing.
 */
public final class DiagnosticSpan {

    static final String LEVEL_ATTRIBUTE = "level";

    private final String name;
    private final Level level;
    private final String target;
    private final Span span;
    private final Context context;
    private final boolean mdc;
    private final AtomicBoolean ended = new AtomicBoolean();

    private DiagnosticSpan(String name, Level level, String target, Span span, Context context, boolean mdc) {
        this.name = name;
        this.level = level;
        this.target = target;
        this.span = span;
        this.context = context;
        this.mdc = mdc;
    }

    // ========================================================================
    // Creation
    // ========================================================================

    public static Builder builder(Level level, String name) {
        return new Builder(level, name);
    }

    public static Builder debug(String name) {
        return builder(Level.DEBUG, name);
    }

    public static Builder info(String name) {
        return builder(Level.INFO, name);
    }

    public static final class Builder {
        private final Level level;
        private final String name;
        private String target;
        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Builder(Level level, String name) {
            this.level = Objects.requireNonNull(level, "level");
            this.name = Objects.requireNonNull(name, "name");
        }

        /**
         * Diagnostic category; defaults to the dispatcher's configured target.
         */
        public Builder target(String target) {
            this.target = target;
            return this;
        }

        public Builder field(String key, Object value) {
            fields.put(key, value);
            return this;
        }

        /**
         * Create the span as a child of the currently entered span, if any.
         */
        public DiagnosticSpan start() {
            Dispatcher dispatcher = Dispatcher.current();
            String resolvedTarget = target != null ? target : dispatcher.defaultTarget();
            if (!dispatcher.isEnabled(level)) {
                return new DiagnosticSpan(name, level, resolvedTarget, Span.getInvalid(), null, false);
            }

            Context parent = Context.current();
            Span span = dispatcher.tracer(resolvedTarget)
                    .spanBuilder(name)
                    .setParent(parent)
                    .setSpanKind(SpanKind.INTERNAL)
                    .setAttribute(LEVEL_ATTRIBUTE, level.token())
                    .startSpan();
            fields.forEach((key, value) -> LogImpl.setAttribute(span, key, value));

            return new DiagnosticSpan(name, level, resolvedTarget, span, parent.with(span),
                dispatcher.publishesMdc());
        }
    }

    // ========================================================================
    // Scope
    // ========================================================================

    /**
     * Make this span current on the calling thread until the returned scope is closed.
     */
    public SpanScope enter() {
        if (isDisabled()) {
            return SpanScope.NOOP;
        }
        return SpanScope.open(context.makeCurrent(), traceId(), spanId(), mdc);
    }

    /**
     * Run {@code work} with this span entered.
     */
    public <T> T inScope(Supplier<T> work) {
        try (SpanScope scope = enter()) {
            return work.get();
        }
    }

    // ========================================================================
    // Fields
    // ========================================================================

    public void record(String key, long value) {
        span.setAttribute(key, value);
    }

    public void record(String key, String value) {
        span.setAttribute(key, value);
    }

    public void recordException(Throwable error) {
        span.setStatus(StatusCode.ERROR, String.valueOf(error.getMessage()));
        span.recordException(error);
    }

    /**
     * Close the span. Only the first call has an effect.
     */
    public void end() {
        if (ended.compareAndSet(false, true)) {
            span.end();
        }
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public boolean isEnded() {
        return ended.get();
    }

    public boolean isDisabled() {
        return context == null;
    }

    public String name() {
        return name;
    }

    public Level level() {
        return level;
    }

    public String target() {
        return target;
    }

    public String traceId() {
        return span.getSpanContext().getTraceId();
    }

    public String spanId() {
        return span.getSpanContext().getSpanId();
    }

    @Override
    public String toString() {
        return "DiagnosticSpan{" + level.token() + " " + target + ":" + name + " " + spanId() + "}";
    }
}
