package org.tessera.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies log levels from the {@code logging} configuration block to Logback.
 * <p>
 * {@code logging.level} sets the root level; {@code logging.loggers} maps logger names to levels:
 * <pre>
 * logging {
 *   level = INFO
 *   loggers { "org.tessera.composite" = DEBUG }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * Applies the levels. Missing keys leave the Logback defaults untouched.
     *
     * @param config the application configuration.
     * @throws IllegalArgumentException if a level name is not recognised.
     */
    public static void configure(final Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        if (config.hasPath("logging.level")) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(parse(config.getString("logging.level")));
        }
        if (config.hasPath("logging.loggers")) {
            for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.loggers").entrySet()) {
                String name = stripQuotes(entry.getKey());
                context.getLogger(name).setLevel(parse(String.valueOf(entry.getValue().unwrapped())));
            }
        }
    }

    static Level parse(final String name) {
        Level level = Level.toLevel(name.trim(), null);
        if (level == null) {
            throw new IllegalArgumentException("Unknown log level: " + name);
        }
        return level;
    }

    private static String stripQuotes(final String key) {
        return key.length() > 1 && key.startsWith("\"") && key.endsWith("\"") ? key.substring(1, key.length() - 1) : key;
    }
}
