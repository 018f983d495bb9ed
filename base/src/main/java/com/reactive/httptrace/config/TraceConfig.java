package com.reactive.httptrace.config;

import com.reactive.httptrace.observe.Level;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.Objects;

import static com.reactive.httptrace.config.ConfigAccessor.*;

/**
 * Type-safe access to the diagnostic dispatcher configuration.
 *
 * Example:
 * <pre>
 *   var config = TraceConfig.load();
 *   Dispatcher.install(openTelemetry, config);
 * </pre>
 *
 * @param target   default diagnostic category used when a span or event names none
 * @param maxLevel most verbose level kept by the dispatcher
 * @param mdc      whether entered spans publish traceId/spanId to the logging MDC
 */
public record TraceConfig(
    String target,
    Level maxLevel,
    boolean mdc
) {
    private static final String ROOT = "reactive.trace";

    public static final String DEFAULT_TARGET = "reactive.http";

    public TraceConfig {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(maxLevel, "maxLevel");
    }

    public static TraceConfig defaults() {
        return new TraceConfig(DEFAULT_TARGET, Level.TRACE, true);
    }

    public static TraceConfig load() {
        return from(ConfigFactory.load());
    }

    public static TraceConfig from(Config root) {
        TraceConfig d = defaults();
        if (!root.hasPath(ROOT)) {
            return d;
        }
        Config c = root.getConfig(ROOT);
        return new TraceConfig(
            string(c, "target", d.target()),
            parsed(c, "max-level", d.maxLevel(), Level::parse),
            bool(c, "mdc", d.mdc())
        );
    }

    public TraceConfig withMaxLevel(Level level) {
        return new TraceConfig(target, level, mdc);
    }
}
