package org.texweaver.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    private static final String TEST_LOGGER = "org.texweaver.test.logging";

    private LoggerContext context;
    private Level rootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context.getLogger(TEST_LOGGER).setLevel(null);
        LoggingConfigurator.reset();
    }

    @Test
    void configure_withPlainFormat_shouldSetPlainProperty() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "PLAIN"
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(LoggingConfigurator.PLAIN_APPENDER, context.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertNotNull(context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender(LoggingConfigurator.PLAIN_APPENDER));
    }

    @Test
    void configure_withLevels_shouldSetLoggerLevels() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "INFO"
              levels {
                "org.texweaver.test.logging" = "DEBUG"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(Level.INFO, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.DEBUG, context.getLogger(TEST_LOGGER).getLevel());
    }

    @Test
    void configure_withUnknownLevel_shouldIgnoreIt() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging.levels { "org.texweaver.test.logging" = "LOUD" }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertNull(context.getLogger(TEST_LOGGER).getLevel());
    }

    @Test
    void configure_calledTwice_shouldOnlyApplyFirst() {
        // Given
        final Config first = ConfigFactory.parseString("logging.levels { \"org.texweaver.test.logging\" = \"DEBUG\" }");
        final Config second = ConfigFactory.parseString("logging.levels { \"org.texweaver.test.logging\" = \"TRACE\" }");

        // When
        LoggingConfigurator.configure(first);
        LoggingConfigurator.configure(second);

        // Then
        assertEquals(Level.DEBUG, context.getLogger(TEST_LOGGER).getLevel());
    }

    @Test
    void configure_withoutLoggingSection_shouldKeepLevels() {
        // Given
        final Config config = ConfigFactory.parseString("other.value = 1");

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(rootLevel, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }
}
