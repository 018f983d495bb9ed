package com.reactive.httptrace.http.server;

/**
 * A handled refusal: "this request could not be handled this way".
 *
 * Rejections are expected outcomes rather than faults, so they carry no stack trace.
 * A handler rejects by failing its future with one:
 * <pre>
 *   return CompletableFuture.failedFuture(Rejection.notFound());
 * </pre>
 */
public final class Rejection extends RuntimeException {

    private final int status;
    private final String reason;

    private Rejection(int status, String reason) {
        super(reason, null, false, false);
        if (status < 100 || status > 999) {
            throw new IllegalArgumentException("invalid status code: " + status);
        }
        this.status = status;
        this.reason = reason;
    }

    public static Rejection of(int status, String reason) {
        return new Rejection(status, reason);
    }

    public static Rejection notFound() {
        return new Rejection(404, "not found");
    }

    public static Rejection methodNotAllowed() {
        return new Rejection(405, "method not allowed");
    }

    public static Rejection badRequest(String reason) {
        return new Rejection(400, reason);
    }

    /**
     * Status code surfaced to the client.
     */
    public int status() {
        return status;
    }

    public String reason() {
        return reason;
    }

    @Override
    public String toString() {
        return "Rejection[status=" + status + ", cause=\"" + reason + "\"]";
    }
}
