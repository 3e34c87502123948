package com.mailspider.core.util;

import com.mailspider.core.model.CrawlConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlConfigLoaderTest {

    @TempDir Path dir;

    @Test
    void loadsAllSections() throws IOException {
        Path yml = dir.resolve(YamlConfigLoader.DEFAULT_FILE);
        Files.writeString(yml, String.join("\n",
                "target: \"https://example.com\"",
                "output: out/emails.csv",
                "crossDomain: true",
                "debug: true",
                "scope:",
                "  maxDepth: 1",
                "  maxPages: 20",
                "  maxQueueSize: 50",
                "  maxDurationMs: 30000",
                "http:",
                "  timeoutMs: 2500",
                "  followRedirects: false",
                "  userAgent: TestBot/1.0",
                ""));

        CrawlConfig cfg = YamlConfigLoader.load(yml);

        assertThat(cfg.getTarget()).isEqualTo("https://example.com");
        assertThat(cfg.getOutput()).isEqualTo(Path.of("out/emails.csv"));
        assertThat(cfg.isCrossDomain()).isTrue();
        assertThat(cfg.isDebug()).isTrue();
        assertThat(cfg.getMaxDepth()).isEqualTo(1);
        assertThat(cfg.getMaxPages()).isEqualTo(20);
        assertThat(cfg.getMaxQueueSize()).isEqualTo(50);
        assertThat(cfg.getMaxDuration()).isEqualTo(Duration.ofSeconds(30));
        assertThat(cfg.getHttp().getTimeoutMs()).isEqualTo(2500);
        assertThat(cfg.getHttp().isFollowRedirects()).isFalse();
        assertThat(cfg.getHttp().getUserAgent()).isEqualTo("TestBot/1.0");
    }

    @Test
    void missingKeysKeepDefaults() throws IOException {
        Path yml = dir.resolve("partial.yml");
        Files.writeString(yml, "scope:\n  maxDepth: 5\n");

        CrawlConfig cfg = YamlConfigLoader.load(yml);

        assertThat(cfg.getMaxDepth()).isEqualTo(5);
        assertThat(cfg.getMaxPages()).isEqualTo(CrawlConfig.DEFAULT_MAX_PAGES);
        assertThat(cfg.getHttp().getUserAgent()).isEqualTo(CrawlConfig.DEFAULT_USER_AGENT);
        assertThat(cfg.getMaxDuration()).isNull();
    }

    @Test
    void emptyFileKeepsBase() throws IOException {
        Path yml = dir.resolve("empty.yml");
        Files.writeString(yml, "");
        CrawlConfig base = CrawlConfig.defaults().setMaxPages(7);

        assertThat(YamlConfigLoader.load(yml, base).getMaxPages()).isEqualTo(7);
    }

    @Test
    void missingFile_throwsIOException() {
        assertThatThrownBy(() -> YamlConfigLoader.load(dir.resolve("nope.yml")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("config file not found");
    }

    @Test
    void brokenYamlOrNumber_throwsIOException() throws IOException {
        Path broken = dir.resolve("broken.yml");
        Files.writeString(broken, "scope: [unclosed\n");
        assertThatThrownBy(() -> YamlConfigLoader.load(broken))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("invalid YAML");

        Path badNumber = dir.resolve("bad-number.yml");
        Files.writeString(badNumber, "scope:\n  maxDepth: deep\n");
        assertThatThrownBy(() -> YamlConfigLoader.load(badNumber))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("invalid number");
    }
}
