package com.reactive.httptrace.http.server;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable Response implementation. Header names are matched case-insensitively.
 */
public record SimpleResponse(
    int status,
    Map<String, String> headers,
    byte[] body
) implements HttpPipeline.Response {

    public SimpleResponse {
        if (status < 100 || status > 999) {
            throw new IllegalArgumentException("invalid status code: " + status);
        }
        Objects.requireNonNull(headers, "headers");
        TreeMap<String, String> sorted = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        sorted.putAll(headers);
        headers = Collections.unmodifiableMap(sorted);
        body = body != null ? body.clone() : new byte[0];
    }

    /**
     * UTF-8 text body with its content type and length filled in.
     */
    public static SimpleResponse text(int status, String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        return new SimpleResponse(status, Map.of(
            "Content-Type", "text/plain; charset=utf-8",
            "Content-Length", String.valueOf(bytes.length)
        ), bytes);
    }

    public static SimpleResponse empty(int status) {
        return new SimpleResponse(status, Map.of("Content-Length", "0"), new byte[0]);
    }
}
