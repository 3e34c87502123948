package com.mailspider.core.crawler;

import com.mailspider.core.api.ICrawler;
import com.mailspider.core.api.IEmailExtractor;
import com.mailspider.core.api.IHtmlParser;
import com.mailspider.core.api.IPageFetcher;
import com.mailspider.core.extract.RegexEmailExtractor;
import com.mailspider.core.http.HttpPageFetcher;
import com.mailspider.core.model.CrawlConfig;
import com.mailspider.core.model.CrawlStats;
import com.mailspider.core.model.ExtractionResult;
import com.mailspider.core.model.FetchResult;
import com.mailspider.core.model.ParsedPage;
import com.mailspider.core.util.CrawlTrace;
import com.mailspider.core.util.StructuredCrawlTrace;
import com.mailspider.core.util.StructuredLog;
import com.mailspider.core.util.UrlUtils;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * BFS 기반 Crawler
 * - FIFO 큐 → depth d 는 모두 depth d+1 보다 먼저 처리
 * - 방문 집합: 꺼낸 URL 은 처리 전에 visited 에 넣고, visited 에 있는 URL 은 다시 처리하지 않음
 * - maxDepth / maxPages / maxQueueSize / (옵션) 시간 예산
 * - fetch 실패, 2xx 아님, 파싱 실패는 해당 페이지만 건너뛰고 계속
 * - fetch/파싱/추출은 각각 IPageFetcher / IHtmlParser / IEmailExtractor 에 위임
 */
public class Crawler implements ICrawler {

    private static final StructuredLog SLOG = StructuredLog.get(Crawler.class);

    private final IPageFetcher fetcher;
    private final IHtmlParser parser;
    private final IEmailExtractor extractor;
    private final CrawlTrace trace;
    private final int maxQueueSize;
    private final Duration timeBudget;   // null = 무제한
    private final Clock clock;

    private volatile CrawlStats lastStats = new CrawlStats();

    public Crawler(CrawlConfig config) {
        this(config, new HttpPageFetcher(config.getHttp()));
    }

    public Crawler(CrawlConfig config, IPageFetcher fetcher) {
        this(config, fetcher, StructuredCrawlTrace.forDebug(config.isDebug()));
    }

    public Crawler(CrawlConfig config, IPageFetcher fetcher, CrawlTrace trace) {
        this(fetcher, new JsoupHtmlParser(), new RegexEmailExtractor(), trace,
                config.getMaxQueueSize(), config.getMaxDuration(), Clock.systemUTC());
    }

    public Crawler(IPageFetcher fetcher,
                   IHtmlParser parser,
                   IEmailExtractor extractor,
                   CrawlTrace trace,
                   int maxQueueSize,
                   Duration timeBudget,
                   Clock clock) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.trace = (trace != null) ? trace : CrawlTrace.NONE;
        if (maxQueueSize < 1) throw new IllegalArgumentException("maxQueueSize must be >= 1");
        this.maxQueueSize = maxQueueSize;
        this.timeBudget = (timeBudget == null || timeBudget.isZero() || timeBudget.isNegative()) ? null : timeBudget;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public List<ExtractionResult> crawl(String seedUrl, int maxDepth, boolean crossDomain, int maxPages) {
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");

        // 시드 검증/정규화: fetch 전에 치명적 오류로 끝냄
        if (!UrlUtils.isValid(seedUrl)) throw new InvalidSeedUrlException(seedUrl);
        URI seed = UrlUtils.normalize(seedUrl);
        String baseDomain = UrlUtils.domainOf(seed);
        if (seed == null || baseDomain.isEmpty()) throw new DomainExtractionException(seedUrl);

        CrawlState state = new CrawlState(new CrawlStats());
        this.lastStats = state.stats;
        state.queue.addLast(new Node(seed, 0));

        SLOG.debug("crawl-start", "seed", seed, "maxDepth", maxDepth, "crossDomain", crossDomain,
                "maxPages", maxPages, "maxQueueSize", maxQueueSize);

        Instant deadline = (timeBudget != null) ? clock.instant().plus(timeBudget) : null;

        while (true) {
            // 여러 페이지에서 발견되어 중복으로 들어온 항목은 예산 검사 전에 접음
            collapseVisitedHead(state);
            if (state.queue.isEmpty()) break;

            if (state.stats.pagesVisited() >= maxPages) {
                state.stats.stoppedBy(CrawlStats.StopReason.PAGE_BUDGET);
                trace.budgetExhausted("pages", state.stats.pagesVisited());
                break;
            }
            if (deadline != null && !clock.instant().isBefore(deadline)) {
                state.stats.stoppedBy(CrawlStats.StopReason.TIME_BUDGET);
                trace.budgetExhausted("time", state.stats.pagesVisited());
                break;
            }

            Node cur = state.queue.pollFirst();
            if (cur.depth > maxDepth) {
                trace.skipped(cur.url, CrawlTrace.SkipReason.DEPTH_LIMIT);
                continue;
            }

            state.visited.add(cur.url);
            state.stats.pageVisited();
            trace.visit(cur.url, cur.depth);

            ParsedPage page = fetchAndParse(cur, state);
            if (page == null) continue;

            collectEmails(cur, page, state);

            if (cur.depth < maxDepth) {
                enqueueChildren(cur, page, baseDomain, crossDomain, state);
            }
        }

        CrawlStats.Snapshot snap = state.stats.snapshot();
        SLOG.debug("crawl-done", "seed", seed, "pagesVisited", snap.pagesVisited(),
                "pagesFailed", snap.pagesFailed(), "results", snap.resultsExtracted(),
                "stopReason", snap.stopReason());
        return state.results;
    }

    @Override
    public CrawlStats.Snapshot lastStats() {
        return lastStats.snapshot();
    }

    @Override
    public void close() throws Exception {
        fetcher.close();
    }

    private void collapseVisitedHead(CrawlState state) {
        while (!state.queue.isEmpty() && state.visited.contains(state.queue.peekFirst().url)) {
            Node dup = state.queue.pollFirst();
            state.stats.duplicateCollapsed();
            trace.skipped(dup.url, CrawlTrace.SkipReason.ALREADY_VISITED);
        }
    }

    /** fetch → 2xx 확인 → 파싱. 페이지 단위 실패면 null */
    private ParsedPage fetchAndParse(Node cur, CrawlState state) {
        FetchResult res = Objects.requireNonNull(fetcher.fetch(cur.url), "fetcher returned null");

        Optional<String> err = res.getError();
        if (err.isPresent()) {
            state.stats.pageFailed();
            trace.httpError(cur.url, err.get());
            return null;
        }
        trace.httpStatus(cur.url, res.getStatus(), res.getElapsedMs());
        if (!res.isSuccess()) {
            state.stats.pageFailed();
            trace.httpSkip(cur.url, res.getStatus());
            return null;
        }

        ParsedPage page;
        try {
            page = parser.parse(res.getBody());
        } catch (RuntimeException e) {
            state.stats.pageFailed();
            trace.parseError(cur.url, e);
            return null;
        }
        state.stats.pageOk();
        return Objects.requireNonNull(page, "parser returned null");
    }

    private void collectEmails(Node cur, ParsedPage page, CrawlState state) {
        List<String> emails = extractor.extract(page.textContent());
        if (emails == null || emails.isEmpty()) {
            trace.noEmails(cur.url);
            return;
        }
        String source = cur.url.toString();
        for (String email : emails) {
            state.results.add(new ExtractionResult(email, source));
        }
        state.stats.resultsExtracted(emails.size());
        trace.emailsFound(cur.url, emails);
    }

    private void enqueueChildren(Node cur, ParsedPage page, String baseDomain, boolean crossDomain, CrawlState state) {
        List<URI> admissible = LinkDiscovery.discoverLinks(page.links(), baseDomain, cur.url, crossDomain);

        int enqueued = 0;
        int dropped = 0;
        for (URI link : admissible) {
            URI n = UrlUtils.normalize(link);
            if (n == null || state.visited.contains(n)) continue;

            // 큐 상한 초과분은 나중 패스 없이 버림(메모리 보호)
            if (state.queue.size() >= maxQueueSize) {
                dropped++;
                state.stats.linkDropped();
                continue;
            }
            state.queue.addLast(new Node(n, cur.depth + 1));
            enqueued++;
            state.stats.linkEnqueued();
        }
        trace.linksDiscovered(cur.url, page.links().size(), admissible.size(), enqueued, dropped);
    }

    /** crawl 1회 동안만 존재하는 상태 */
    private static final class CrawlState {
        final Deque<Node> queue = new ArrayDeque<>();
        final Set<URI> visited = new HashSet<>();
        final List<ExtractionResult> results = new ArrayList<>();
        final CrawlStats stats;
        CrawlState(CrawlStats stats) { this.stats = stats; }
    }

    private static final class Node {
        final URI url; final int depth;
        Node(URI u, int d) { this.url = u; this.depth = d; }
    }
}
