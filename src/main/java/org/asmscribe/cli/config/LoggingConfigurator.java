package org.asmscribe.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigUtil;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code logging} block of the configuration to Logback.
 * <pre>
 * logging {
 *   level = WARN
 *   levels { "org.asmscribe.annotator.frontend" = DEBUG }
 * }
 * </pre>
 * Does nothing when SLF4J is bound to another backend.
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    public static void configure(final Config config) {
        final ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            return;
        }
        if (config.hasPath("logging.level")) {
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)
                    .setLevel(parse(config.getString("logging.level"), "logging.level"));
        }
        if (config.hasPath("logging.levels")) {
            final Config levels = config.getConfig("logging.levels");
            for (String name : levels.root().keySet()) {
                final String value = levels.getString(ConfigUtil.joinPath(name));
                final Logger logger = context.getLogger(name);
                logger.setLevel(parse(value, "logging.levels." + name));
            }
        }
    }

    private static Level parse(final String value, final String path) {
        final Level level = Level.toLevel(value, null);
        if (level == null) {
            throw new IllegalArgumentException("Invalid log level '" + value + "' at " + path);
        }
        return level;
    }
}
