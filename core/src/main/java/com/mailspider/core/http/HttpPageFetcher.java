package com.mailspider.core.http;

import com.mailspider.core.api.IPageFetcher;
import com.mailspider.core.model.CrawlConfig;
import com.mailspider.core.model.FetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * java.net.http 기반 페이지 fetcher.
 * 어떤 상태코드든 그대로 돌려주고(4xx/5xx 포함), 네트워크 계층 오류만 status 0 + error 로 변환한다.
 * 타임아웃은 fetcher 내부 설정(http.timeoutMs)이며 크롤러 파라미터가 아니다.
 */
public class HttpPageFetcher implements IPageFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HttpPageFetcher.class);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final CrawlConfig.HttpCfg cfg;
    private final HttpSender sender;

    public HttpPageFetcher(CrawlConfig.HttpCfg cfg) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(cfg.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(cfg.getTimeout())
                .build();
        this.sender = req -> client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpPageFetcher(CrawlConfig.HttpCfg cfg, HttpSender testSender) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    @Override
    public FetchResult fetch(URI url) {
        Objects.requireNonNull(url, "url");
        long start = System.nanoTime();
        try {
            HttpRequest req = HttpRequest.newBuilder(url)
                    .timeout(cfg.getTimeout())
                    .header("User-Agent", cfg.getUserAgent())
                    .header("Accept", "text/html,application/xhtml+xml,*/*;q=0.8")
                    .GET()
                    .build();

            HttpResponse<String> resp = sender.send(req);
            String contentType = resp.headers().firstValue("Content-Type").orElse(null);
            return FetchResult.ok(url, resp.statusCode(), resp.body(), contentType, elapsedMs(start));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.fail(url, "Interrupted: " + url, elapsedMs(start));
        } catch (Exception e) {
            String msg = describe(url, e);
            LOG.debug("fetch failed url={} cause={}", url, e.toString());
            return FetchResult.fail(url, msg, elapsedMs(start));
        }
    }

    /** 오류 분류: 타임아웃 / 연결 실패 / 그 외 */
    static String describe(URI url, Exception e) {
        if (e instanceof HttpConnectTimeoutException || e instanceof HttpTimeoutException) {
            return "Connection timeout: " + url;
        }
        if (e instanceof ConnectException || e instanceof UnknownHostException
                || e.getCause() instanceof ConnectException || e.getCause() instanceof UnknownHostException) {
            return "Connection failed: Unable to reach " + url;
        }
        return "Network error: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
