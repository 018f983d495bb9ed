package com.reactive.httptrace.http.server.trace;

/**
 * What a traced handler's span records about the terminal result.
 */
public sealed interface Outcome permits Outcome.Success, Outcome.Failure {

    int status();

    record Success(int status) implements Outcome {}

    /**
     * @param error debug rendering of the rejection or fault
     */
    record Failure(int status, String error) implements Outcome {}
}
