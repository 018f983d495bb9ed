package com.reactive.httptrace.http.server;

import com.reactive.httptrace.http.server.trace.Wrap;

import java.net.InetSocketAddress;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * HTTP Pipeline - the types every handler, interceptor and decorator is written against.
 *
 * Design principles:
 * 1. Handlers are asynchronous: they answer with a future of a {@link Reply}
 * 2. A handler refuses a request by failing its future with a {@link Rejection}
 * 3. Cross-cutting concerns (tracing, logging) wrap handlers without knowing their internals
 * 4. Implementation-agnostic - any transport can build a {@link Request} and consume a {@link Response}
 *
 * Example usage:
 * <pre>
 * Handler hello = Handler.sync(req -> Response.ok("Hello, World!"))
 *     .with(Trace.context("hello"));
 *
 * Handler routes = hello.with(Trace.request());
 *
 * routes.handle(request).thenAccept(reply -> write(reply.toResponse()));
 * </pre>
 */
public interface HttpPipeline {

    // ========================================================================
    // HTTP Method enum
    // ========================================================================

    enum Method {
        GET, POST, PUT, DELETE, PATCH, HEAD, OPTIONS
    }

    // ========================================================================
    // HTTP Version enum
    // ========================================================================

    enum Version {
        HTTP_09("HTTP/0.9"),
        HTTP_10("HTTP/1.0"),
        HTTP_11("HTTP/1.1"),
        HTTP_2("HTTP/2.0"),
        HTTP_3("HTTP/3.0");

        private final String token;

        Version(String token) { this.token = token; }

        @Override
        public String toString() { return token; }
    }

    // ========================================================================
    // Request
    // ========================================================================

    /**
     * The ambient context of a single request, read-only.
     */
    interface Request {
        Method method();

        /**
         * Full request path, without the query string.
         */
        String path();

        Version version();

        Optional<InetSocketAddress> remoteAddress();

        /**
         * Header value by case-insensitive name, or null.
         */
        String header(String name);

        Map<String, String> headers();
        byte[] body();
        String bodyAsString();

        /**
         * Attach contextual data (e.g., user info).
         */
        Request withAttribute(String key, Object value);
        <T> T attribute(String key);

        /**
         * Executor through which this request's asynchronous work is resumed.
         * Handlers that hop threads should schedule their continuations here.
         */
        Executor executor();

        Request withExecutor(Executor executor);
    }

    // ========================================================================
    // Reply / Response
    // ========================================================================

    /**
     * Anything that can be turned into a wire-level {@link Response}.
     */
    @FunctionalInterface
    interface Reply {
        Response toResponse();
    }

    interface Response extends Reply {
        int status();
        Map<String, String> headers();
        byte[] body();

        @Override
        default Response toResponse() {
            return this;
        }

        /** 200 with a plain-text body. */
        static Response ok(String body) {
            return SimpleResponse.text(200, body);
        }

        /** 202 with no body. */
        static Response accepted() {
            return SimpleResponse.empty(202);
        }
    }

    // ========================================================================
    // Handler
    // ========================================================================

    @FunctionalInterface
    interface Handler {
        /**
         * Handle a request. The future either completes with a reply or fails,
         * normally with a {@link Rejection}.
         */
        CompletableFuture<? extends Reply> handle(Request request);

        /**
         * Decorate this handler.
         */
        default Handler with(Wrap wrap) {
            return wrap.wrap(this);
        }

        /**
         * Create a synchronous handler.
         */
        static Handler sync(Function<Request, ? extends Reply> fn) {
            return request -> CompletableFuture.completedFuture(fn.apply(request));
        }

        /**
         * Create a handler that always returns the same reply.
         */
        static Handler fixed(Reply reply) {
            return request -> CompletableFuture.completedFuture(reply);
        }

        /**
         * Create a handler that always rejects with the same rejection.
         */
        static Handler reject(Rejection rejection) {
            return request -> CompletableFuture.failedFuture(rejection);
        }
    }

    // ========================================================================
    // Interceptor (Middleware)
    // ========================================================================

    @FunctionalInterface
    interface Interceptor {
        /**
         * Intercept the request/response.
         *
         * @param request The incoming request
         * @param next The next handler in the chain
         * @return The reply (possibly decorated)
         */
        CompletableFuture<? extends Reply> intercept(Request request, Handler next);
    }
}
