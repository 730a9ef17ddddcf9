package org.monkeylang.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class LoggingConfiguratorTest {

    private LoggerContext context;
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        originalRootLevel = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger("org.monkeylang.runtime").setLevel(null);
    }

    @Test
    void configure_appliesRootAndPerLoggerLevels() {
        Config config = ConfigFactory.parseString("""
                logging {
                  default-level = ERROR
                  levels {
                    "org.monkeylang.runtime" = DEBUG
                  }
                }
                """);

        LoggingConfigurator.configure(config);

        assertEquals(Level.ERROR, context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.DEBUG, context.getLogger("org.monkeylang.runtime").getLevel());
    }

    @Test
    void configure_leavesLevelsAloneWithoutLoggingBlock() {
        Level before = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel();

        LoggingConfigurator.configure(ConfigFactory.empty());

        assertEquals(before, context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel());
    }
}
