package com.httpretry.core.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingConfiguratorTest {

    @TempDir
    Path tmp;

    @AfterEach
    void cleanup() {
        System.clearProperty("hr.log.level");
        Logger root = LogManager.getLogManager().getLogger("");
        for (Handler h : root.getHandlers()) {
            h.close();
            root.removeHandler(h);
        }
        root.setLevel(Level.INFO);
    }

    @Test
    void init_writes_structured_lines_to_rolling_file() throws Exception {
        Path dir = tmp.resolve("logs");
        boolean file = LoggingConfigurator.init(dir, Level.INFO, 64 * 1024, 2);

        StructuredLog.get(LoggingConfiguratorTest.class).info("probe", "k", 1);
        for (Handler h : LogManager.getLogManager().getLogger("").getHandlers()) h.flush();

        assertThat(file).isTrue();
        assertThat(Files.readString(dir.resolve("retry-0.log")))
                .contains("\"event\":\"probe\"")
                .contains("\"k\":1");
    }

    @Test
    void console_only_without_directory() {
        assertThat(LoggingConfigurator.init(null, Level.WARNING, 1024, 1)).isFalse();
    }

    @Test
    void level_from_system_property_with_fallback() {
        System.setProperty("hr.log.level", "fine");
        assertThat(LoggingConfigurator.levelFromSystemProperty(Level.INFO)).isEqualTo(Level.FINE);

        System.setProperty("hr.log.level", "loud");
        assertThat(LoggingConfigurator.levelFromSystemProperty(Level.INFO)).isEqualTo(Level.INFO);
    }
}
