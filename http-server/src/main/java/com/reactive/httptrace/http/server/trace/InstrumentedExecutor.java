package com.reactive.httptrace.http.server.trace;

import com.reactive.httptrace.observe.DiagnosticSpan;
import com.reactive.httptrace.observe.SpanScope;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Runs each task with a span entered, on whichever worker the delegate picks.
 *
 * Handed to the wrapped handler as its request executor, so every resumption of
 * the handler's asynchronous work is bracketed by the span: entered right before
 * the task runs, exited right after, whether the task finishes the work or
 * schedules more of it.
 */
final class InstrumentedExecutor implements Executor {

    private final DiagnosticSpan span;
    private final Executor delegate;

    InstrumentedExecutor(DiagnosticSpan span, Executor delegate) {
        this.span = span;
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        delegate.execute(() -> {
            try (SpanScope scope = span.enter()) {
                task.run();
            }
        });
    }
}
