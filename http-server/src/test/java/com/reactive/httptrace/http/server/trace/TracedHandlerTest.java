package com.reactive.httptrace.http.server.trace;

import com.reactive.httptrace.http.server.HttpPipeline.Handler;
import com.reactive.httptrace.http.server.HttpPipeline.Method;
import com.reactive.httptrace.http.server.HttpPipeline.Request;
import com.reactive.httptrace.http.server.HttpPipeline.Response;
import com.reactive.httptrace.http.server.Rejection;
import com.reactive.httptrace.http.server.SimpleRequest;
import com.reactive.httptrace.observe.Dispatcher;
import com.reactive.httptrace.observe.InMemoryTelemetry;
import com.reactive.httptrace.observe.Level;
import com.reactive.httptrace.observe.Log;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.trace.data.EventData;
import io.opentelemetry.sdk.trace.data.SpanData;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.reactive.httptrace.observe.InMemoryTelemetry.*;
import static org.junit.jupiter.api.Assertions.*;

class TracedHandlerTest {

    private InMemoryTelemetry telemetry;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        telemetry = InMemoryTelemetry.install();
        pool = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        pool.shutdownNow();
        pool.awaitTermination(5, TimeUnit.SECONDS);
        Dispatcher.shutdown();
    }

    private Request get(String path) {
        return SimpleRequest.builder(Method.GET, path).executor(pool).build();
    }

    // ========================================================================
    // Success
    // ========================================================================

    @Test
    void successRecordsStatusOnRequestSpan() {
        Handler handler = Handler.sync(req -> Response.ok("ok")).with(Trace.request());

        Traced traced = (Traced) handler.handle(get("/hello")).join();

        assertEquals(200, traced.toResponse().status());
        assertEquals("ok", new String(traced.toResponse().body()));

        SpanData span = telemetry.only();
        assertEquals("request", span.getName());
        assertEquals(Trace.TARGET, span.getInstrumentationScopeInfo().getName());
        assertEquals("info", str(span, "level"));
        assertEquals("GET", str(span, "method"));
        assertEquals("\"/hello\"", str(span, "path"));
        assertEquals("HTTP/1.1", str(span, "version"));
        assertEquals(200L, num(span, "response.status"));
        assertNull(str(span, "response.error"));

        assertEquals(List.of("received request", "response"), eventNames(span));
        assertEquals("trace", str(event(span, "received request"), "level"));
        EventData response = event(span, "response");
        assertEquals("debug", str(response, "level"));
        assertEquals(200L, num(response, "response.status"));
    }

    @Test
    void tracedExposesTheMaterializedResponse() {
        Response original = Response.accepted();
        TracedHandler handler = Trace.context("accept").wrap(Handler.fixed(original));

        Traced traced = handler.handle(get("/jobs")).join();

        assertSame(original, traced.response());
        assertSame(original, traced.toResponse());
        assertEquals(202L, num(telemetry.only(), "response.status"));
    }

    @Test
    void replyIsMaterializedOnce() {
        Response response = Response.ok("lazy");
        int[] calls = {0};
        Handler handler = Handler.fixed(() -> {
            calls[0]++;
            return response;
        }).with(Trace.request());

        Traced traced = (Traced) handler.handle(get("/lazy")).join();

        assertSame(response, traced.toResponse());
        assertEquals(1, calls[0]);
    }

    // ========================================================================
    // Failure
    // ========================================================================

    @Test
    void rejectionIsRecordedAndPropagatedUnchanged() {
        Rejection rejection = Rejection.notFound();
        Handler handler = Handler.reject(rejection).with(Trace.request());

        CompletableFuture<?> result = handler.handle(get("/missing"));
        ExecutionException error = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));

        assertSame(rejection, error.getCause());

        SpanData span = telemetry.only();
        assertEquals(404L, num(span, "response.status"));
        assertTrue(str(span, "response.error").contains("not found"));
        assertEquals(StatusCode.UNSET, span.getStatus().getStatusCode());

        EventData event = event(span, "response");
        assertEquals("trace", str(event, "level"));
        assertEquals(404L, num(event, "response.status"));
        assertTrue(str(event, "response.error").contains("not found"));
    }

    @Test
    void rejectionFromAsyncStageKeepsItsWrapping() {
        Rejection rejection = Rejection.of(403, "forbidden");
        Handler handler = ((Handler) request -> CompletableFuture.<Response>supplyAsync(() -> {
            throw rejection;
        }, request.executor())).with(Trace.request());

        CompletionException error = assertThrows(CompletionException.class, () -> handler.handle(get("/admin")).join());

        assertSame(rejection, error.getCause());
        assertEquals(403L, num(telemetry.only(), "response.status"));
        assertTrue(str(telemetry.only(), "response.error").contains("forbidden"));
    }

    @Test
    void rawFaultIsObservedAsServerError() {
        IllegalStateException fault = new IllegalStateException("database down");
        Handler handler = ((Handler) request -> CompletableFuture.failedFuture(fault)).with(Trace.request());

        CompletionException error = assertThrows(CompletionException.class, () -> handler.handle(get("/db")).join());

        assertSame(fault, error.getCause());
        assertEquals(500L, num(telemetry.only(), "response.status"));
        assertTrue(str(telemetry.only(), "response.error").contains("database down"));
    }

    @Test
    void synchronousThrowIsRethrownAndSpanClosed() {
        IllegalArgumentException boom = new IllegalArgumentException("bad handler");
        Handler handler = ((Handler) request -> {
            throw boom;
        }).with(Trace.request());

        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class, () -> handler.handle(get("/x")));

        assertSame(boom, thrown);
        SpanData span = telemetry.only();
        assertTrue(span.hasEnded());
        assertEquals(StatusCode.ERROR, span.getStatus().getStatusCode());
        assertNull(num(span, "response.status"));
    }

    // ========================================================================
    // Nesting
    // ========================================================================

    @Test
    void nestedContextsFollowWrappingOrder() {
        Handler handler = Handler.sync(req -> Response.ok("ok"))
                .with(Trace.context("inner"))
                .with(Trace.context("outer"));

        handler.handle(get("/nested")).join();

        assertEquals(2, telemetry.spans().size());
        SpanData outer = telemetry.withMessage("outer");
        SpanData inner = telemetry.withMessage("inner");

        assertEquals("context", outer.getName());
        assertEquals("context", inner.getName());
        assertEquals("debug", str(outer, "level"));
        assertEquals(outer.getSpanId(), inner.getParentSpanId());
        assertEquals(outer.getTraceId(), inner.getTraceId());
        assertFalse(outer.getParentSpanContext().isValid());
    }

    @Test
    void contextUnderRequestSpan() {
        Handler handler = Handler.sync(req -> {
            Log.event(Level.INFO, "saying hello...");
            return Response.ok("Hello, World!");
        }).with(Trace.context("hello")).with(Trace.request());

        handler.handle(get("/hello")).join();

        SpanData context = telemetry.withMessage("hello");
        SpanData request = telemetry.spans().stream()
                .filter(span -> span.getName().equals("request"))
                .findFirst().orElseThrow();

        assertEquals(request.getSpanId(), context.getParentSpanId());
        assertTrue(eventNames(context).contains("saying hello..."));
        assertFalse(eventNames(request).contains("saying hello..."));
        assertEquals(200L, num(context, "response.status"));
        assertEquals(200L, num(request, "response.status"));
    }

    // ========================================================================
    // Resumption across workers
    // ========================================================================

    @Test
    void everyResumptionRunsInsideTheSpan() {
        List<String> seen = new CopyOnWriteArrayList<>();
        Handler hopping = request -> CompletableFuture
                .supplyAsync(() -> step(seen, "first"), request.executor())
                .thenApplyAsync(prev -> step(seen, "second"), request.executor())
                .thenComposeAsync(prev -> CompletableFuture.supplyAsync(() -> {
                    step(seen, "third");
                    return Response.ok("done");
                }, request.executor()), request.executor());

        hopping.with(Trace.request()).handle(get("/hops")).join();

        SpanData span = telemetry.only();
        assertFalse(seen.isEmpty());
        seen.forEach(spanId -> assertEquals(span.getSpanId(), spanId));
        assertEquals(List.of("received request", "step first", "step second", "step third", "response"),
            eventNames(span));
    }

    @Test
    void spanIsNotLeftActiveWhileSuspended() throws Exception {
        CompletableFuture<String> gate = new CompletableFuture<>();
        Handler waiting = request -> gate.thenApplyAsync(Response::ok, request.executor());

        CompletableFuture<?> result = waiting.with(Trace.request()).handle(get("/wait"));

        assertFalse(result.isDone());
        assertEquals("", Log.spanId());
        assertEquals("", pool.submit(Log::spanId).get());

        gate.complete("released");
        result.join();

        assertEquals(200L, num(telemetry.only(), "response.status"));
        assertEquals("", Log.spanId());
    }

    @Test
    void concurrentRequestsGetTheirOwnSpans() {
        Set<String> handlerSpans = ConcurrentHashMap.newKeySet();
        Handler handler = ((Handler) request -> CompletableFuture.supplyAsync(() -> {
            handlerSpans.add(Log.spanId());
            return Response.ok(request.path());
        }, request.executor())).with(Trace.request());

        List<CompletableFuture<?>> results = new CopyOnWriteArrayList<>();
        for (int i = 0; i < 32; i++) {
            results.add(handler.handle(get("/item/" + i)));
        }
        CompletableFuture.allOf(results.toArray(CompletableFuture[]::new)).join();

        List<SpanData> spans = telemetry.spans();
        assertEquals(32, spans.size());
        assertEquals(32, handlerSpans.size());
        for (SpanData span : spans) {
            assertTrue(handlerSpans.contains(span.getSpanId()));
            assertEquals(1, eventNames(span).stream().filter("received request"::equals).count());
            assertEquals(200L, num(span, "response.status"));
        }
    }

    // ========================================================================
    // Abandonment
    // ========================================================================

    @Test
    void cancellingClosesSpanWithoutOutcome() {
        CompletableFuture<Response> never = new CompletableFuture<>();
        Handler handler = ((Handler) request -> never).with(Trace.request());

        CompletableFuture<?> result = handler.handle(get("/slow"));
        assertTrue(telemetry.spans().isEmpty());

        result.cancel(true);

        SpanData span = telemetry.only();
        assertTrue(span.hasEnded());
        assertEquals(List.of("received request"), eventNames(span));
        assertNull(num(span, "response.status"));
        assertTrue(never.isCancelled());
    }

    @Test
    void upstreamCancellationClosesSpanWithoutOutcome() {
        CompletableFuture<Response> shared = new CompletableFuture<>();
        Handler handler = ((Handler) request -> shared).with(Trace.request());

        CompletableFuture<?> result = handler.handle(get("/shared"));
        shared.cancel(true);

        assertThrows(CancellationException.class, result::join);
        SpanData span = telemetry.only();
        assertTrue(span.hasEnded());
        assertEquals(List.of("received request"), eventNames(span));
        assertNull(num(span, "response.status"));
        assertNull(str(span, "response.error"));
    }

    // ========================================================================
    // Factory failure
    // ========================================================================

    @Test
    void factoryFailureFailsTheInvocation() {
        IllegalStateException broken = new IllegalStateException("no request context");
        AtomicBoolean invoked = new AtomicBoolean();
        Handler handler = ((Handler) request -> {
            invoked.set(true);
            return CompletableFuture.completedFuture(Response.ok("ok"));
        }).with(Trace.trace(info -> {
            throw broken;
        }));

        CompletionException error = assertThrows(CompletionException.class, () -> handler.handle(get("/")).join());

        assertInstanceOf(SpanCreationException.class, error.getCause());
        assertSame(broken, error.getCause().getCause());
        assertFalse(invoked.get());
        assertTrue(telemetry.spans().isEmpty());
    }

    @Test
    void factoryWithoutSpanFailsTheInvocation() {
        Handler handler = Handler.sync(req -> Response.ok("ok")).with(Trace.trace(info -> null));

        CompletionException error = assertThrows(CompletionException.class, () -> handler.handle(get("/")).join());

        assertInstanceOf(SpanCreationException.class, error.getCause());
    }

    // ========================================================================
    // Reuse
    // ========================================================================

    @Test
    void traceIsReusableAcrossHandlers() {
        Trace shared = Trace.context("shared");
        Handler a = Handler.sync(req -> Response.ok("a")).with(shared);
        Handler b = Handler.reject(Rejection.badRequest("missing id")).with(shared);

        a.handle(get("/a")).join();
        assertThrows(CompletionException.class, () -> b.handle(get("/b")).join());

        assertEquals(2, telemetry.spans().size());
        assertEquals(200L, num(telemetry.spans().get(0), "response.status"));
        assertEquals(400L, num(telemetry.spans().get(1), "response.status"));
    }

    @Test
    void worksAsInterceptor() {
        Handler handler = Handler.sync(req -> Response.ok("ok"));

        Object reply = Trace.request().asInterceptor().intercept(get("/mw"), handler).join();

        assertInstanceOf(Traced.class, reply);
        assertEquals("request", telemetry.only().getName());
    }

    private static String step(List<String> seen, String name) {
        seen.add(Log.spanId());
        Log.event(Level.DEBUG, "step " + name);
        return name;
    }
}
