package com.reactive.httptrace.http.server.trace;

import com.reactive.httptrace.http.server.HttpPipeline.Reply;
import com.reactive.httptrace.http.server.HttpPipeline.Response;
import com.reactive.httptrace.http.server.Rejection;
import com.reactive.httptrace.observe.DiagnosticSpan;
import com.reactive.httptrace.observe.Level;
import com.reactive.httptrace.observe.Log;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Records the terminal result of a traced handler on its span.
 *
 * Must run with the span entered so the summary event is attributed to it.
 * Observes only: statuses are never remapped and failures never replaced.
 */
final class OutcomeRecorder {

    static final String STATUS = "response.status";
    static final String ERROR = "response.error";
    static final String EVENT = "response";

    /** Status recorded for failures that are not rejections. */
    static final int FAULT_STATUS = 500;

    private OutcomeRecorder() {}

    /**
     * Materialize the reply, record its status, and hand it back as {@link Traced}.
     */
    static Traced success(DiagnosticSpan span, Reply reply) {
        Response response = reply.toResponse();
        record(span, new Outcome.Success(response.status()));
        return new Traced(response);
    }

    /**
     * Record the status and debug rendering of a failure. The caller propagates
     * the failure itself.
     */
    static Outcome failure(DiagnosticSpan span, Throwable error) {
        Outcome outcome = outcomeOf(unwrap(error));
        record(span, outcome);
        return outcome;
    }

    static Outcome outcomeOf(Throwable failure) {
        if (failure instanceof Rejection rejection) {
            return new Outcome.Failure(rejection.status(), rejection.toString());
        }
        return new Outcome.Failure(FAULT_STATUS, failure.toString());
    }

    static void record(DiagnosticSpan span, Outcome outcome) {
        span.record(STATUS, outcome.status());
        if (outcome instanceof Outcome.Failure failure) {
            span.record(ERROR, failure.error());
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put(STATUS, (long) failure.status());
            fields.put(ERROR, failure.error());
            Log.event(Level.TRACE, Trace.TARGET, EVENT, fields);
        } else {
            Log.event(Level.DEBUG, Trace.TARGET, EVENT, Map.of(STATUS, (long) outcome.status()));
        }
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
