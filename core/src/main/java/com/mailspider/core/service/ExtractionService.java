package com.mailspider.core.service;

import com.mailspider.core.api.ICrawler;
import com.mailspider.core.crawler.Crawler;
import com.mailspider.core.http.HttpPageFetcher;
import com.mailspider.core.model.CrawlConfig;
import com.mailspider.core.model.ExtractionReport;
import com.mailspider.core.model.ExtractionResult;
import com.mailspider.core.output.CsvResultStore;
import com.mailspider.core.output.Deduplicator;
import com.mailspider.core.output.ResultStore;
import com.mailspider.core.output.ResultStoreException;
import com.mailspider.core.util.CrawlTrace;
import com.mailspider.core.util.StructuredCrawlTrace;
import com.mailspider.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 추출 오케스트레이터:
 *  - crawl → 기존 CSV 읽기 → 중복 제거(기존 주소 포함) → CSV 기록 → 요약
 *  - 기본 구현체(Crawler/CsvResultStore/Deduplicator)
 *  - DI 생성자는 테스트 주입용
 */
public final class ExtractionService {

    private static final Logger LOG = LoggerFactory.getLogger(ExtractionService.class);
    private static final StructuredLog SLOG = StructuredLog.get(ExtractionService.class);

    private final CrawlConfig config;
    private final ICrawler crawler;
    private final ResultStore store;
    private final Deduplicator deduplicator;

    /** 기본 구현 */
    public ExtractionService(CrawlConfig config) {
        this(config, StructuredCrawlTrace.forDebug(config.isDebug()));
    }

    private ExtractionService(CrawlConfig config, CrawlTrace trace) {
        this(config, new Crawler(config, new HttpPageFetcher(config.getHttp()), trace),
                new CsvResultStore(), new Deduplicator(trace));
    }

    /** DI/테스트용 */
    public ExtractionService(CrawlConfig config, ICrawler crawler, ResultStore store, Deduplicator deduplicator) {
        this.config = Objects.requireNonNull(config, "config");
        this.crawler = Objects.requireNonNull(crawler, "crawler");
        this.store = Objects.requireNonNull(store, "store");
        this.deduplicator = Objects.requireNonNull(deduplicator, "deduplicator");
    }

    /**
     * 전체 흐름 1회 실행.
     * 시드 오류(CrawlSetupException)와 출력 기록 실패(ResultStoreException)는 그대로 전파된다.
     */
    public ExtractionReport run() {
        config.validate();
        Path output = config.getOutput();

        List<ExtractionResult> results = crawler.crawl(
                config.getTarget(), config.getMaxDepth(), config.isCrossDomain(), config.getMaxPages());
        var stats = crawler.lastStats();
        LOG.info("crawl finished target={} pages={} failed={} results={}",
                config.getTarget(), stats.pagesVisited(), stats.pagesFailed(), results.size());

        List<ExtractionResult> existing = readExisting(output);
        List<String> existingEmails = new ArrayList<>(existing.size());
        for (ExtractionResult r : existing) existingEmails.add(r.getEmail());

        List<ExtractionResult> unique = deduplicator.deduplicate(results, existingEmails);

        // 기존 결과가 있으면 헤더 없이 이어쓰기, 없으면 헤더부터 새로 씀
        boolean append = !existing.isEmpty();
        store.write(unique, output, append);

        SLOG.info("extraction-done", "target", config.getTarget(), "output", output,
                "extracted", results.size(), "saved", unique.size(), "previous", existing.size(),
                "appended", append);
        return new ExtractionReport(results.size(), unique.size(), existing.size(), append, output, stats);
    }

    /** 기존 파일을 못 읽으면 경고 후 "이전 결과 없음"으로 취급 */
    private List<ExtractionResult> readExisting(Path output) {
        try {
            return store.read(output);
        } catch (ResultStoreException e) {
            LOG.warn("could not read existing output, treating as empty: {}", e.getMessage());
            return List.of();
        }
    }
}
