package com.mailspider.core.model;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 크롤 1회분 카운터 누적기.
 * 크롤 루프는 단일 스레드지만, 진행 중 다른 스레드에서 snapshot()을 읽을 수 있도록 atomic 사용.
 */
public final class CrawlStats {

    /** 루프 종료 사유 */
    public enum StopReason { QUEUE_EMPTY, PAGE_BUDGET, TIME_BUDGET }

    private final AtomicInteger pagesVisited = new AtomicInteger();
    private final AtomicInteger pagesOk = new AtomicInteger();
    private final AtomicInteger pagesFailed = new AtomicInteger();
    private final AtomicInteger duplicatesCollapsed = new AtomicInteger();
    private final AtomicInteger linksEnqueued = new AtomicInteger();
    private final AtomicInteger linksDropped = new AtomicInteger();
    private final AtomicInteger resultsExtracted = new AtomicInteger();
    private volatile StopReason stopReason = StopReason.QUEUE_EMPTY;

    public void pageVisited() { pagesVisited.incrementAndGet(); }
    public void pageOk() { pagesOk.incrementAndGet(); }
    public void pageFailed() { pagesFailed.incrementAndGet(); }
    public void duplicateCollapsed() { duplicatesCollapsed.incrementAndGet(); }
    public void linkEnqueued() { linksEnqueued.incrementAndGet(); }
    public void linkDropped() { linksDropped.incrementAndGet(); }
    public void resultsExtracted(int n) { resultsExtracted.addAndGet(n); }
    public void stoppedBy(StopReason reason) { this.stopReason = (reason == null ? StopReason.QUEUE_EMPTY : reason); }

    public int pagesVisited() { return pagesVisited.get(); }

    public Snapshot snapshot() {
        return new Snapshot(pagesVisited.get(), pagesOk.get(), pagesFailed.get(),
                duplicatesCollapsed.get(), linksEnqueued.get(), linksDropped.get(),
                resultsExtracted.get(), stopReason);
    }

    /** 불변 스냅샷 */
    public record Snapshot(int pagesVisited,
                           int pagesOk,
                           int pagesFailed,
                           int duplicatesCollapsed,
                           int linksEnqueued,
                           int linksDropped,
                           int resultsExtracted,
                           StopReason stopReason) {

        public static final Snapshot EMPTY = new Snapshot(0, 0, 0, 0, 0, 0, 0, StopReason.QUEUE_EMPTY);
    }
}
