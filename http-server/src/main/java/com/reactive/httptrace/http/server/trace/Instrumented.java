package com.reactive.httptrace.http.server.trace;

import com.reactive.httptrace.http.server.HttpPipeline.Reply;
import com.reactive.httptrace.observe.DiagnosticSpan;
import com.reactive.httptrace.observe.SpanScope;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The in-flight result of one traced request.
 *
 * Settles exactly once: either the inner future completes, the outcome is
 * recorded with the span entered, the span ends and the bridged result
 * completes; or the request is abandoned, and the span ends without an outcome.
 * The caller abandons by cancelling the bridged result, which also cancels the
 * inner future; a cancelled inner future abandons and passes the cancellation on.
 */
final class Instrumented {

    private final DiagnosticSpan span;
    private final CompletableFuture<? extends Reply> inner;
    private final CompletableFuture<Traced> result = new CompletableFuture<>();
    private final AtomicBoolean settled = new AtomicBoolean();

    private Instrumented(DiagnosticSpan span, CompletableFuture<? extends Reply> inner) {
        this.span = span;
        this.inner = inner;
    }

    static CompletableFuture<Traced> bridge(DiagnosticSpan span, CompletableFuture<? extends Reply> inner) {
        Instrumented instrumented = new Instrumented(span, inner);
        instrumented.result.whenComplete((reply, error) -> {
            if (instrumented.result.isCancelled()) {
                instrumented.abandon();
            }
        });
        inner.whenComplete(instrumented::complete);
        return instrumented.result;
    }

    private void complete(Reply reply, Throwable error) {
        if (!settled.compareAndSet(false, true)) {
            return;
        }
        if (error != null && OutcomeRecorder.unwrap(error) instanceof CancellationException) {
            span.end();
            result.completeExceptionally(error);
            return;
        }

        Traced traced = null;
        Throwable failure = error;
        try (SpanScope scope = span.enter()) {
            if (error == null) {
                traced = OutcomeRecorder.success(span, reply);
            } else {
                OutcomeRecorder.failure(span, error);
            }
        } catch (RuntimeException e) {
            span.recordException(e);
            failure = e;
        } finally {
            span.end();
        }

        if (failure != null) {
            result.completeExceptionally(failure);
        } else {
            result.complete(traced);
        }
    }

    private void abandon() {
        if (settled.compareAndSet(false, true)) {
            span.end();
            inner.cancel(false);
        }
    }
}
