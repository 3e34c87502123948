package com.mailspider.core.util;

import com.mailspider.core.model.CrawlConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * mailspider.yml 을 읽어 CrawlConfig 로 변환.
 *
 * 예상 YAML 키:
 * target: "https://example.com"
 * output: "emails.csv"
 * crossDomain: false
 * debug: false
 * scope:
 *   maxDepth: 3
 *   maxPages: 100
 *   maxQueueSize: 10000
 *   maxDurationMs: 0        # 0 = 무제한
 * http:
 *   timeoutMs: 10000
 *   followRedirects: true
 *   userAgent: "Mozilla/5.0 (compatible; MailSpider/1.0)"
 *
 * 없는 키는 기본값 유지. 검증(validate)은 CLI 값까지 합친 뒤 호출자가 한다.
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "mailspider.yml";

    private YamlConfigLoader() {}

    public static CrawlConfig load(Path yamlPath) throws IOException {
        return load(yamlPath, CrawlConfig.defaults());
    }

    /** base 위에 YAML 값을 덮어씀 */
    public static CrawlConfig load(Path yamlPath, CrawlConfig base) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        Objects.requireNonNull(base, "base");
        if (!Files.exists(yamlPath)) {
            throw new IOException("config file not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            Object root;
            try {
                root = yaml.load(in);
            } catch (RuntimeException e) {
                // snakeyaml 의 YAMLException 은 unchecked → 설정 파일 오류로 통일
                throw new IOException("invalid YAML in " + yamlPath + ": " + e.getMessage(), e);
            }
            CrawlConfig cfg = base;

            if (!(root instanceof Map<?, ?> map)) {
                // 비어있거나 단순 스칼라면 기본값 유지
                return cfg;
            }

            // 1) 평면 키
            setString(map, "target", cfg::setTarget);
            setString(map, "output", s -> cfg.setOutput(Path.of(s)));
            setBoolean(map, "crossDomain", cfg::setCrossDomain);
            setBoolean(map, "debug", cfg::setDebug);

            // 2) scope.*
            Map<?, ?> scope = getMap(map, "scope");
            if (scope != null) {
                setInt(scope, "maxDepth", cfg::setMaxDepth);
                setInt(scope, "maxPages", cfg::setMaxPages);
                setInt(scope, "maxQueueSize", cfg::setMaxQueueSize);
                setLong(scope, "maxDurationMs", cfg::setMaxDurationMs);
            }

            // 3) http.*
            Map<?, ?> http = getMap(map, "http");
            if (http != null) {
                var h = cfg.getHttp();
                setLong(http, "timeoutMs", h::setTimeoutMs);
                setBoolean(http, "followRedirects", h::setFollowRedirects);
                setString(http, "userAgent", h::setUserAgent);
            }
            return cfg;
        } catch (NumberFormatException e) {
            throw new IOException("invalid number in " + yamlPath + ": " + e.getMessage(), e);
        }
    }

    // ------------ helpers ------------
    private static Map<?, ?> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        return (v instanceof Map<?, ?> m) ? m : null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }
}
