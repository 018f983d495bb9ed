package com.reactive.httptrace.http.server.trace;

import com.reactive.httptrace.observe.DiagnosticSpan;

/**
 * Builds the span for one request.
 *
 * Called once per request, synchronously, before the wrapped handler runs.
 * The {@link RequestInfo} is only valid for the duration of the call.
 */
@FunctionalInterface
public interface SpanFactory {

    DiagnosticSpan build(RequestInfo info);
}
