package com.reactive.httptrace.http.server.trace;

/**
 * The span factory of a traced handler failed; the request was not handled.
 */
public class SpanCreationException extends RuntimeException {

    public SpanCreationException(String message) {
        super(message);
    }

    public SpanCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
