package com.reactive.httptrace.observe;

import com.reactive.httptrace.config.TraceConfig;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide diagnostic dispatcher.
 *
 * The application installs it once at startup, before any request is processed,
 * and shuts it down on exit to flush pending spans. Instrumentation only ever
 * looks it up through {@link #current()} at call time and emits through it.
 *
 * Usage:
 * <pre>
 *   Dispatcher.install(openTelemetrySdk);          // startup
 *   ...
 *   Runtime.getRuntime().addShutdownHook(new Thread(Dispatcher::shutdown));
 * </pre>
 *
 * Until something is installed, {@link #current()} answers with a fallback over
 * {@link GlobalOpenTelemetry} and the default {@link TraceConfig}.
 */
public final class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private static final AtomicReference<Dispatcher> INSTALLED = new AtomicReference<>();

    private final OpenTelemetry openTelemetry;
    private final TraceConfig config;
    private final ConcurrentMap<String, Tracer> tracers = new ConcurrentHashMap<>();

    private Dispatcher(OpenTelemetry openTelemetry, TraceConfig config) {
        this.openTelemetry = Objects.requireNonNull(openTelemetry, "openTelemetry");
        this.config = Objects.requireNonNull(config, "config");
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    /**
     * Install the dispatcher with configuration read from {@code reactive.trace}.
     */
    public static Dispatcher install(OpenTelemetry openTelemetry) {
        return install(openTelemetry, TraceConfig.load());
    }

    /**
     * Install the dispatcher. Fails if one is already installed and not shut down.
     */
    public static Dispatcher install(OpenTelemetry openTelemetry, TraceConfig config) {
        Dispatcher dispatcher = new Dispatcher(openTelemetry, config);
        if (!INSTALLED.compareAndSet(null, dispatcher)) {
            throw new IllegalStateException("Diagnostic dispatcher is already installed");
        }
        log.info("Diagnostic dispatcher installed (target={}, max-level={})",
            config.target(), config.maxLevel().token());
        return dispatcher;
    }

    /**
     * Uninstall and flush. A no-op when nothing is installed.
     */
    public static void shutdown() {
        Dispatcher dispatcher = INSTALLED.getAndSet(null);
        if (dispatcher == null) {
            return;
        }
        if (dispatcher.openTelemetry instanceof Closeable closeable) {
            try {
                closeable.close();
            } catch (IOException e) {
                log.warn("Failed to flush diagnostic dispatcher", e);
            }
        }
        log.info("Diagnostic dispatcher shut down");
    }

    public static boolean isInstalled() {
        return INSTALLED.get() != null;
    }

    /**
     * The installed dispatcher, or the global fallback.
     */
    public static Dispatcher current() {
        Dispatcher dispatcher = INSTALLED.get();
        return dispatcher != null ? dispatcher : Fallback.INSTANCE;
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public Level maxLevel() {
        return config.maxLevel();
    }

    public String defaultTarget() {
        return config.target();
    }

    public boolean isEnabled(Level level) {
        return level.isEnabled(config.maxLevel());
    }

    boolean publishesMdc() {
        return config.mdc();
    }

    /**
     * Tracer for a diagnostic category; the target becomes the instrumentation scope name.
     */
    Tracer tracer(String target) {
        return tracers.computeIfAbsent(target, openTelemetry::getTracer);
    }

    private static final class Fallback {
        static final Dispatcher INSTANCE = new Dispatcher(GlobalOpenTelemetry.get(), TraceConfig.defaults());
    }
}
