package com.reactive.httptrace.http.server.trace;

import com.reactive.httptrace.http.server.HttpPipeline.Handler;
import com.reactive.httptrace.observe.DiagnosticSpan;

import java.util.Objects;

/**
 * Span instrumentation for handlers.
 *
 * Every request passing through a traced handler gets its own span, entered
 * whenever the handler's work runs and closed with the response status (and
 * rejection, if any) recorded on it.
 *
 * Usage:
 * <pre>
 * // Summary span for every request
 * Handler routes = hello.with(Trace.request());
 *
 * // Named sub-span per route
 * Handler hello = Handler.sync(req -> Response.ok("Hello"))
 *     .with(Trace.context("hello"));
 *
 * // Custom span
 * Handler custom = handler.with(Trace.trace(info ->
 *     DiagnosticSpan.info("request").field("path", info.path()).start()));
 * </pre>
 *
 * A {@code Trace} holds nothing but its factory; it can be shared between
 * threads and applied to any number of handlers.
 */
public final class Trace implements Wrap {

    /** Diagnostic category of the built-in spans. */
    public static final String TARGET = "reactive.http";

    private static final SpanFactory REQUEST = info -> DiagnosticSpan.info("request")
            .target(TARGET)
            .field("method", info.method().toString())
            .field("path", quoted(info.path()))
            .field("version", info.version().toString())
            .start();

    private final SpanFactory factory;

    private Trace(SpanFactory factory) {
        this.factory = factory;
    }

    /**
     * Instrument every request with a span built by {@code factory}.
     */
    public static Trace trace(SpanFactory factory) {
        return new Trace(Objects.requireNonNull(factory, "factory"));
    }

    /**
     * Instrument every request with an INFO span summarizing the request.
     */
    public static Trace request() {
        return trace(REQUEST);
    }

    /**
     * Instrument every request with a DEBUG span representing a named context.
     */
    public static Trace context(String name) {
        Objects.requireNonNull(name, "name");
        return trace(info -> DiagnosticSpan.debug("context")
                .target(TARGET)
                .field("message", name)
                .start());
    }

    @Override
    public TracedHandler wrap(Handler inner) {
        return new TracedHandler(factory, Objects.requireNonNull(inner, "inner"));
    }

    /**
     * Debug rendering of a string: double-quoted, with quotes, backslashes and
     * control characters escaped.
     */
    static String quoted(String value) {
        StringBuilder out = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '\0' -> out.append("\\0");
                default -> {
                    if (Character.isISOControl(c)) {
                        out.append(String.format("\\u{%x}", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        return out.append('"').toString();
    }
}
