package com.reactive.httptrace.http.server.trace;

import com.reactive.httptrace.http.server.HttpPipeline.Handler;
import com.reactive.httptrace.http.server.HttpPipeline.Reply;
import com.reactive.httptrace.http.server.HttpPipeline.Request;
import com.reactive.httptrace.observe.DiagnosticSpan;
import com.reactive.httptrace.observe.Level;
import com.reactive.httptrace.observe.Log;
import com.reactive.httptrace.observe.SpanScope;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A handler instrumented by {@link Trace}. Built only through {@link Trace#wrap}.
 *
 * Per request:
 * <ol>
 *   <li>the span factory builds the request's span</li>
 *   <li>with the span entered, "received request" is emitted and the inner
 *       handler invoked; its request executor enters the span around every task</li>
 *   <li>on completion the outcome is recorded with the span entered, then the span ends</li>
 * </ol>
 * The inner reply comes back as {@link Traced}; failures come back unchanged.
 */
public final class TracedHandler implements Handler {

    static final String RECEIVED = "received request";

    private final SpanFactory factory;
    private final Handler inner;

    TracedHandler(SpanFactory factory, Handler inner) {
        this.factory = factory;
        this.inner = inner;
    }

    @Override
    public CompletableFuture<Traced> handle(Request request) {
        DiagnosticSpan span;
        try {
            span = newSpan(request);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(
                e instanceof SpanCreationException sce ? sce : new SpanCreationException("Span factory failed", e));
        }

        CompletableFuture<? extends Reply> pending;
        try (SpanScope scope = span.enter()) {
            Log.event(Level.TRACE, Trace.TARGET, RECEIVED, Map.of());
            Request instrumented = request.withExecutor(new InstrumentedExecutor(span, request.executor()));
            pending = Objects.requireNonNull(inner.handle(instrumented), "handler returned no future");
        } catch (RuntimeException | Error e) {
            span.recordException(e);
            span.end();
            throw e;
        }

        return Instrumented.bridge(span, pending);
    }

    private DiagnosticSpan newSpan(Request request) {
        RequestInfo info = new RequestInfo(request);
        try {
            DiagnosticSpan span = factory.build(info);
            if (span == null) {
                throw new SpanCreationException("Span factory produced no span");
            }
            return span;
        } finally {
            info.release();
        }
    }
}
