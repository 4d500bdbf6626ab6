package com.bookharvest.core.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingConfiguratorTest {

    @AfterEach
    void restore() throws Exception {
        for (Handler h : Logger.getLogger("").getHandlers()) h.close();
        LogManager.getLogManager().readConfiguration();
    }

    @Test
    void slf4j_and_structured_events_land_in_rotating_file(@TempDir Path dir) throws Exception {
        LoggingConfigurator.init(dir.resolve("logs"), Level.INFO, 1_000_000, 2);

        LoggerFactory.getLogger(LoggingConfiguratorTest.class).info("Batch committed: book={}", "43");
        StructuredLog.get(LoggingConfiguratorTest.class).with("book", "43").info("extract-start", "toExtract", 5);
        for (Handler h : Logger.getLogger("").getHandlers()) h.flush();

        Path log = dir.resolve("logs").resolve("app-0.log");
        assertThat(log).exists();
        String text = Files.readString(log, StandardCharsets.UTF_8);
        assertThat(text).contains("Batch committed: book=43").contains("\"event\":\"extract-start\"");
        assertThat(Logger.getLogger("").getHandlers()).hasAtLeastOneElementOfType(FileHandler.class);
    }

    @Test
    void console_only_without_log_dir() {
        LoggingConfigurator.init(null, Level.WARNING, 1, 1);
        Handler[] handlers = Logger.getLogger("").getHandlers();
        assertThat(handlers).hasSize(1);
        assertThat(handlers[0].getLevel()).isEqualTo(Level.WARNING);
    }
}
