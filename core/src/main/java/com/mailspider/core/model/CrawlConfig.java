package com.mailspider.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * 크롤 설정 (mailspider.yml / CLI 매핑 대상). 순수 설정 보관용.
 * CLI 인자가 YAML 값을 덮어쓰는 우선순위 처리는 app 쪽 책임.
 */
public final class CrawlConfig {

    public static final int DEFAULT_MAX_DEPTH = 3;
    public static final int DEFAULT_MAX_PAGES = 100;
    public static final int DEFAULT_MAX_QUEUE_SIZE = 10_000;
    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (compatible; MailSpider/1.0)";

    /** HTTP 관련 하위 설정: YAML의 `http:` 섹션과 매핑 */
    public static final class HttpCfg {
        private Duration timeout = Duration.ofSeconds(10);
        private boolean followRedirects = true;
        private String userAgent = DEFAULT_USER_AGENT;

        public Duration getTimeout() { return timeout; }
        public HttpCfg setTimeout(Duration timeout) { this.timeout = timeout; return this; }

        public boolean isFollowRedirects() { return followRedirects; }
        public HttpCfg setFollowRedirects(boolean v) { this.followRedirects = v; return this; }

        public String getUserAgent() { return userAgent; }
        public HttpCfg setUserAgent(String ua) {
            this.userAgent = (ua == null || ua.isBlank()) ? DEFAULT_USER_AGENT : ua;
            return this;
        }

        public long getTimeoutMs() { return timeout.toMillis(); }
        public HttpCfg setTimeoutMs(long ms) { this.timeout = Duration.ofMillis(Math.max(1, ms)); return this; }
    }

    // ---------- 기본 필드 ----------
    private String target;                       // 시드 URL (필수)
    private Path output;                         // CSV 출력 경로 (필수)
    private int maxDepth = DEFAULT_MAX_DEPTH;
    private boolean crossDomain = false;
    private int maxPages = DEFAULT_MAX_PAGES;
    private int maxQueueSize = DEFAULT_MAX_QUEUE_SIZE;  // 대기 큐 상한(초과분은 버림)
    private long maxDurationMs = 0;              // 0 = 무제한
    private boolean debug = false;

    private HttpCfg http = new HttpCfg();

    // ---------- getters ----------
    public String getTarget() { return target; }
    public Path getOutput() { return output; }
    public int getMaxDepth() { return maxDepth; }
    public boolean isCrossDomain() { return crossDomain; }
    public int getMaxPages() { return maxPages; }
    public int getMaxQueueSize() { return maxQueueSize; }
    public long getMaxDurationMs() { return maxDurationMs; }
    public boolean isDebug() { return debug; }
    public HttpCfg getHttp() { return http; }

    /** 0 이하면 무제한 → null */
    public Duration getMaxDuration() {
        return maxDurationMs > 0 ? Duration.ofMillis(maxDurationMs) : null;
    }

    // ---------- fluent setters ----------
    public CrawlConfig setTarget(String target) { this.target = target; return this; }
    public CrawlConfig setOutput(Path output) { this.output = output; return this; }
    public CrawlConfig setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; return this; }
    public CrawlConfig setCrossDomain(boolean v) { this.crossDomain = v; return this; }
    public CrawlConfig setMaxPages(int maxPages) { this.maxPages = maxPages; return this; }
    public CrawlConfig setMaxQueueSize(int maxQueueSize) { this.maxQueueSize = maxQueueSize; return this; }
    public CrawlConfig setMaxDurationMs(long ms) { this.maxDurationMs = ms; return this; }
    public CrawlConfig setDebug(boolean v) { this.debug = v; return this; }
    public CrawlConfig setHttp(HttpCfg http) { this.http = (http != null ? http : new HttpCfg()); return this; }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(output, "output");
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
        if (maxQueueSize < 1) throw new IllegalArgumentException("maxQueueSize must be >= 1");
        if (maxDurationMs < 0) throw new IllegalArgumentException("maxDurationMs must be >= 0");

        Objects.requireNonNull(http, "http");
        Duration t = http.getTimeout();
        if (t == null || t.isNegative() || t.isZero())
            throw new IllegalArgumentException("http.timeout must be > 0");
    }

    public static CrawlConfig defaults() { return new CrawlConfig(); }
}
