package com.reactive.httptrace.observe;

import io.opentelemetry.context.Scope;
import org.slf4j.MDC;

/**
 * An entered {@link DiagnosticSpan}. Closing it restores whatever was current before.
 *
 * Scopes must be closed on the thread that opened them, innermost first;
 * use try-with-resources.
 */
public final class SpanScope implements AutoCloseable {

    static final SpanScope NOOP = new SpanScope(Scope.noop(), false, null, null);

    static final String MDC_TRACE_ID = "traceId";
    static final String MDC_SPAN_ID = "spanId";

    private final Scope scope;
    private final boolean mdc;
    private final String previousTraceId;
    private final String previousSpanId;

    private SpanScope(Scope scope, boolean mdc, String previousTraceId, String previousSpanId) {
        this.scope = scope;
        this.mdc = mdc;
        this.previousTraceId = previousTraceId;
        this.previousSpanId = previousSpanId;
    }

    static SpanScope open(Scope scope, String traceId, String spanId, boolean mdc) {
        if (!mdc) {
            return new SpanScope(scope, false, null, null);
        }
        SpanScope opened = new SpanScope(scope, true, MDC.get(MDC_TRACE_ID), MDC.get(MDC_SPAN_ID));
        MDC.put(MDC_TRACE_ID, traceId);
        MDC.put(MDC_SPAN_ID, spanId);
        return opened;
    }

    @Override
    public void close() {
        if (mdc) {
            restore(MDC_TRACE_ID, previousTraceId);
            restore(MDC_SPAN_ID, previousSpanId);
        }
        scope.close();
    }

    private static void restore(String key, String previous) {
        if (previous == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previous);
        }
    }
}
