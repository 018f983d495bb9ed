package com.reactive.httptrace.http.server;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Simple immutable Request implementation.
 *
 * Header names are matched case-insensitively.
 *
 * <pre>
 * Request request = SimpleRequest.builder(Method.GET, "/hello")
 *     .header("User-Agent", "curl/8.0")
 *     .remoteAddress(new InetSocketAddress("127.0.0.1", 52100))
 *     .build();
 * </pre>
 */
public record SimpleRequest(
    HttpPipeline.Method method,
    String path,
    HttpPipeline.Version version,
    InetSocketAddress remote,
    Map<String, String> headers,
    byte[] body,
    Map<String, Object> attributes,
    Executor executor
) implements HttpPipeline.Request {

    public SimpleRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(executor, "executor");
        TreeMap<String, String> sorted = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        sorted.putAll(headers);
        headers = Collections.unmodifiableMap(sorted);
        attributes = Collections.unmodifiableMap(new HashMap<>(attributes));
        body = body != null ? body : new byte[0];
    }

    public static Builder builder(HttpPipeline.Method method, String path) {
        return new Builder(method, path);
    }

    @Override
    public Optional<InetSocketAddress> remoteAddress() {
        return Optional.ofNullable(remote);
    }

    @Override
    public String header(String name) {
        return headers.get(name);
    }

    @Override
    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public HttpPipeline.Request withAttribute(String key, Object value) {
        Map<String, Object> copy = new HashMap<>(attributes);
        copy.put(key, value);
        return new SimpleRequest(method, path, version, remote, headers, body, copy, executor);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T attribute(String key) {
        return (T) attributes.get(key);
    }

    @Override
    public HttpPipeline.Request withExecutor(Executor executor) {
        return new SimpleRequest(method, path, version, remote, headers, body, attributes, executor);
    }

    public static final class Builder {
        private final HttpPipeline.Method method;
        private final String path;
        private HttpPipeline.Version version = HttpPipeline.Version.HTTP_11;
        private InetSocketAddress remote;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private byte[] body = new byte[0];
        private Executor executor = ForkJoinPool.commonPool();

        private Builder(HttpPipeline.Method method, String path) {
            this.method = method;
            this.path = path;
        }

        public Builder version(HttpPipeline.Version version) {
            this.version = version;
            return this;
        }

        public Builder remoteAddress(InetSocketAddress remote) {
            this.remote = remote;
            return this;
        }

        public Builder header(String name, String value) {
            headers.put(name, value);
            return this;
        }

        public Builder body(String body) {
            this.body = body.getBytes(StandardCharsets.UTF_8);
            return this;
        }

        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public SimpleRequest build() {
            return new SimpleRequest(method, path, version, remote, headers, body, Map.of(), executor);
        }
    }
}
