package com.mailspider.core.util;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.logging.Level;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredLogTest {

    private final StructuredLog slog = StructuredLog.get(StructuredLogTest.class,
            Clock.fixed(Instant.parse("2026-01-02T03:04:05Z"), ZoneOffset.UTC));

    @Test
    void toJson_containsFixedFields_andKeyValues() {
        String json = slog.toJson(Level.FINE, "visit", "url", "https://ex.com/", "depth", 1, "ok", true);

        assertThat(json)
                .startsWith("{\"ts\":\"2026-01-02T03:04:05Z\",\"lvl\":\"FINE\",\"comp\":\"StructuredLogTest\"")
                .contains("\"event\":\"visit\"")
                .contains("\"url\":\"https://ex.com/\"")
                .contains("\"depth\":1")
                .endsWith("\"ok\":true}");
    }

    @Test
    void toJson_rendersIterableAsArray_andFlagsOddKvs() {
        String json = slog.toJson(Level.INFO, "emails-found", "emails", List.of("a@x.com", "b@x.com"), "dangling");
        assertThat(json)
                .contains("\"emails\":[\"a@x.com\",\"b@x.com\"]")
                .contains("\"_kv_mismatch\":true");
    }

    @Test
    void toJson_nullValuesAndNoPairs() {
        assertThat(slog.toJson(Level.INFO, "extraction-done", "output", null))
                .endsWith("\"event\":\"extraction-done\",\"output\":null}");
        assertThat(slog.toJson(Level.INFO, "crawl-done")).endsWith("\"event\":\"crawl-done\"}");
    }

    @Test
    void esc_escapesControlCharacters() {
        assertThat(StructuredLog.esc("a\nb\t\\c\u0001")).isEqualTo("a\\nb\\t\\\\c\\u0001");
    }
}
