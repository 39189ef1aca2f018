package org.oxygen.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link LoggingConfigurator}.
 */
class LoggingConfiguratorTest {

    private static final String PARSER_LOGGER = "org.oxygen.compiler.frontend.parser";

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        originalRootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger(PARSER_LOGGER).setLevel(null);
        context.getLogger("org.oxygen").setLevel(null);
    }

    @Test
    @Tag("unit")
    void shouldApplyDefaultAndSpecificLevels() {
        // Arrange
        Config config = ConfigFactory.parseString(
                "logging { default-level = ERROR, levels { \"" + PARSER_LOGGER + "\" = DEBUG } }");

        // Act
        LoggingConfigurator.configure(config);

        // Assert
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger(PARSER_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    @Tag("unit")
    void shouldConfigureOnlyOnce() {
        // Arrange
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = ERROR"));

        // Act
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = TRACE"));

        // Assert
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    @Tag("unit")
    void shouldIgnoreUnknownLevels() {
        // Act
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging { levels { \"" + PARSER_LOGGER + "\" = LOUD } }"));

        // Assert
        assertThat(context.getLogger(PARSER_LOGGER).getLevel()).isNull();
    }

    @Test
    @Tag("unit")
    void shouldSetSingleLoggerLevel() {
        // Act
        LoggingConfigurator.setLevel("org.oxygen", "DEBUG");

        // Assert
        assertThat(context.getLogger("org.oxygen").getLevel()).isEqualTo(Level.DEBUG);
    }
}
