package com.reactive.httptrace.http.server.trace;

import com.reactive.httptrace.http.server.HttpPipeline.Handler;
import com.reactive.httptrace.http.server.HttpPipeline.Interceptor;

/**
 * A handler decoration, applied with {@link Handler#with(Wrap)}.
 *
 * Sealed: only decorations shipped with the pipeline can wrap handlers.
 */
public sealed interface Wrap permits Trace {

    Handler wrap(Handler inner);

    /**
     * The same decoration in interceptor form, for middleware chains.
     */
    default Interceptor asInterceptor() {
        return (request, next) -> wrap(next).handle(request);
    }
}
