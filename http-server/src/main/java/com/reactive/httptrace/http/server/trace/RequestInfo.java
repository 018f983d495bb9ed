package com.reactive.httptrace.http.server.trace;

import com.reactive.httptrace.http.server.HttpPipeline.Method;
import com.reactive.httptrace.http.server.HttpPipeline.Request;
import com.reactive.httptrace.http.server.HttpPipeline.Version;

import java.net.InetSocketAddress;
import java.util.AbstractMap;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Information about a request, handed to a {@link SpanFactory}.
 *
 * The view is released as soon as the factory returns; touching it afterwards
 * throws {@link IllegalStateException}.
 */
public final class RequestInfo {

    static final String REFERER = "Referer";
    static final String USER_AGENT = "User-Agent";
    static final String HOST = "Host";

    private final Request request;
    private final Map<String, String> headers = new Headers();
    private volatile boolean released;

    RequestInfo(Request request) {
        this.request = request;
    }

    /** View the remote address of the request. */
    public Optional<InetSocketAddress> remoteAddress() {
        return live().remoteAddress();
    }

    /** View the method of the request. */
    public Method method() {
        return live().method();
    }

    /** View the full path of the request. */
    public String path() {
        return live().path();
    }

    /** View the protocol version of the request. */
    public Version version() {
        return live().version();
    }

    /** View the referer of the request. */
    public Optional<String> referer() {
        return textHeader(REFERER);
    }

    /** View the user agent of the request. */
    public Optional<String> userAgent() {
        return textHeader(USER_AGENT);
    }

    /** View the host of the request. */
    public Optional<String> host() {
        return textHeader(HOST);
    }

    /**
     * Access the full headers of the request, read-only. The map is released
     * along with this view.
     */
    public Map<String, String> headers() {
        live();
        return headers;
    }

    void release() {
        released = true;
    }

    private Request live() {
        if (released) {
            throw new IllegalStateException("RequestInfo used after its span factory returned");
        }
        return request;
    }

    private Optional<String> textHeader(String name) {
        return Optional.ofNullable(live().header(name)).filter(RequestInfo::isVisibleText);
    }

    private final class Headers extends AbstractMap<String, String> {
        @Override
        public Set<Entry<String, String>> entrySet() {
            return Collections.unmodifiableMap(live().headers()).entrySet();
        }

        @Override
        public String get(Object key) {
            return live().headers().get(key);
        }

        @Override
        public boolean containsKey(Object key) {
            return live().headers().containsKey(key);
        }
    }

    /**
     * Header values count as text when every char is a tab or visible ASCII.
     */
    static boolean isVisibleText(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c != '\t' && (c < 0x20 || c > 0x7E)) {
                return false;
            }
        }
        return true;
    }
}
