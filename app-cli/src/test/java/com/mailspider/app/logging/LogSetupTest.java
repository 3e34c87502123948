package com.mailspider.app.logging;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.assertj.core.api.Assertions.assertThat;

class LogSetupTest {

    @Test
    void levelOf_parsesNames_andFallsBackToInfo() {
        assertThat(LogSetup.levelOf("fine")).isEqualTo(Level.FINE);
        assertThat(LogSetup.levelOf(" WARNING ")).isEqualTo(Level.WARNING);
        assertThat(LogSetup.levelOf("chatty")).isEqualTo(Level.INFO);
        assertThat(LogSetup.levelOf(null)).isEqualTo(Level.INFO);
    }

    @Test
    void lineFormatter_printsLevelLoggerAndStack() {
        LogRecord r = new LogRecord(Level.WARNING, "could not read existing output");
        r.setLoggerName("com.mailspider.core.service.ExtractionService");
        r.setThrown(new IllegalStateException("boom"));

        String line = new LogSetup.LineFormatter().format(r);

        assertThat(line)
                .contains("[WARNING]")
                .contains("com.mailspider.core.service.ExtractionService - could not read existing output")
                .contains("java.lang.IllegalStateException: boom");
    }
}
