package com.reactive.httptrace.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import java.util.function.Function;

/**
 * Reads optional HOCON values, falling back to a default when the path is missing.
 *
 * <pre>
 *   String target = ConfigAccessor.string(config, "target", "reactive.http");
 *   Level level = ConfigAccessor.parsed(config, "max-level", Level.TRACE, Level::parse);
 * </pre>
 */
public final class ConfigAccessor {

    private ConfigAccessor() {} // Utility class

    // =========================================================================
    // String
    // =========================================================================

    public static String string(Config c, String path, String defaultValue) {
        return c.hasPath(path) ? c.getString(path) : defaultValue;
    }

    // =========================================================================
    // Boolean
    // =========================================================================

    public static boolean bool(Config c, String path, boolean defaultValue) {
        return c.hasPath(path) ? c.getBoolean(path) : defaultValue;
    }

    // =========================================================================
    // Parsed values
    // =========================================================================

    /**
     * Read a string and parse it, reporting parse failures as a bad value at {@code path}.
     */
    public static <T> T parsed(Config c, String path, T defaultValue, Function<String, T> parser) {
        if (!c.hasPath(path)) {
            return defaultValue;
        }
        String raw = c.getString(path);
        try {
            return parser.apply(raw);
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(c.origin(), path, e.getMessage(), e);
        }
    }
}
