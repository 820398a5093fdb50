package org.texweaver.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.Map;

/**
 * Applies the {@code logging} section of the texweaver configuration to Logback.
 * The library itself logs little above DEBUG; this is how an embedding tool turns on
 * expansion traces or switches stdout to JSON lines.
 * <pre>
 * logging {
 *   format = "PLAIN"           # PLAIN or JSON
 *   default-level = "WARN"     # root logger
 *   levels {
 *     "org.texweaver.demacro" = "TRACE"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String FORMAT_KEY = "format";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    /** The Logback property that selects the appender, see logback.xml. */
    static final String FORMAT_PROPERTY = "texweaver.logging.format";
    static final String PLAIN_APPENDER = "STDOUT_PLAIN";
    static final String JSON_APPENDER = "STDOUT_JSON";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {
    }

    /**
     * Applies format and levels once; later calls are ignored until {@link #reset()}.
     * A broken section is logged and leaves Logback as it was started.
     *
     * @param config The loaded configuration, usually from {@link ConfigLoader}.
     */
    public static synchronized void configure(final Config config) {
        if (loggingConfigured) {
            LOGGER.debug("texweaver logging already applied");
            return;
        }

        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging section, keeping the Logback setup");
            loggingConfigured = true;
            return;
        }

        try {
            final Config section = config.getConfig(LOGGING_CONFIG_PATH);
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

            // Switching the format reloads logback.xml, which would undo levels set before it.
            applyFormat(section, context);
            applyRootLevel(section, context);
            applyLoggerLevels(section, context);
            LOGGER.debug("Applied texweaver logging section");
        } catch (final JoranException | RuntimeException e) {
            LOGGER.error("Invalid logging section, keeping the Logback setup", e);
        }
        loggingConfigured = true;
    }

    /**
     * Selects the PLAIN or JSON appender. If the selection changes, the Logback
     * configuration the context was started with is loaded again.
     */
    private static void applyFormat(final Config section, final LoggerContext context) throws JoranException {
        final String format = section.hasPath(FORMAT_KEY)
            ? section.getString(FORMAT_KEY)
            : "PLAIN";
        final String appender = "JSON".equalsIgnoreCase(format) ? JSON_APPENDER : PLAIN_APPENDER;

        final String active = context.getProperty(FORMAT_PROPERTY) != null
            ? context.getProperty(FORMAT_PROPERTY)
            : System.getProperty(FORMAT_PROPERTY, PLAIN_APPENDER);
        System.setProperty(FORMAT_PROPERTY, appender);
        if (appender.equals(active)) {
            context.putProperty(FORMAT_PROPERTY, appender);
            LOGGER.debug("Logging format {} already active", format);
            return;
        }

        final URL configuration = findConfiguration();
        if (configuration == null) {
            LOGGER.debug("No Logback configuration on the classpath, format {} not applied", format);
            return;
        }
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        context.putProperty(FORMAT_PROPERTY, appender);
        configurator.doConfigure(configuration);
        LOGGER.debug("Configured logging format: {}", format);
    }

    private static URL findConfiguration() {
        final ClassLoader loader = LoggingConfigurator.class.getClassLoader();
        final URL test = loader.getResource("logback-test.xml");
        return test != null ? test : loader.getResource("logback.xml");
    }

    // An unknown level name falls back to WARN.
    private static void applyRootLevel(final Config section, final LoggerContext context) {
        if (!section.hasPath(DEFAULT_LEVEL_KEY)) {
            return;
        }
        final Level level = Level.toLevel(section.getString(DEFAULT_LEVEL_KEY), Level.WARN);
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
        LOGGER.debug("Root level {}", level);
    }

    private static void applyLoggerLevels(final Config section, final LoggerContext context) {
        if (!section.hasPath(LEVELS_KEY)) {
            return;
        }
        int applied = 0;
        for (final Map.Entry<String, ConfigValue> entry : section.getConfig(LEVELS_KEY).root().entrySet()) {
            final String loggerName = entry.getKey();
            final String levelName = entry.getValue().unwrapped().toString();
            final Level level = Level.toLevel(levelName, null);
            if (level == null) {
                LOGGER.warn("Unknown level '{}' for logger '{}', ignored", levelName, loggerName);
                continue;
            }
            context.getLogger(loggerName).setLevel(level);
            applied++;
        }
        LOGGER.debug("Set levels of {} loggers", applied);
    }

    /**
     * Allows the next {@link #configure(Config)} call to apply its section again.
     */
    public static synchronized void reset() {
        loggingConfigured = false;
    }
}
