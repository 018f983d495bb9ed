package com.reactive.httptrace.http.server.trace;

import com.reactive.httptrace.http.server.HttpPipeline.Reply;
import com.reactive.httptrace.http.server.HttpPipeline.Response;

/**
 * A reply that has passed through a traced handler.
 *
 * Holds the response the inner reply materialized to and hands back that same instance.
 */
public record Traced(Response response) implements Reply {

    @Override
    public Response toResponse() {
        return response;
    }
}
