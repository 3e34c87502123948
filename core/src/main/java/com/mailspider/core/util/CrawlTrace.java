package com.mailspider.core.util;

import java.net.URI;
import java.util.List;

/**
 * 크롤 결정 추적용 이벤트 싱크.
 * 모든 메서드는 기본 no-op 이므로 필요한 이벤트만 오버라이드하면 된다.
 * 전역 싱글턴이 아니라 Crawler/Deduplicator 생성 시 주입한다.
 */
public interface CrawlTrace {

    enum SkipReason { ALREADY_VISITED, DEPTH_LIMIT }

    default void visit(URI url, int depth) {}
    default void skipped(URI url, SkipReason reason) {}

    default void httpStatus(URI url, int status, long elapsedMs) {}
    default void httpError(URI url, String error) {}
    /** 2xx 가 아니라서 페이지 처리를 건너뜀 */
    default void httpSkip(URI url, int status) {}
    default void parseError(URI url, Throwable t) {}

    default void emailsFound(URI url, List<String> emails) {}
    default void noEmails(URI url) {}

    /**
     * @param total      페이지의 a[href] 개수
     * @param admissible LinkDiscovery 통과 개수
     * @param enqueued   실제 큐에 들어간 개수
     * @param dropped    큐 상한으로 버린 개수
     */
    default void linksDiscovered(URI url, int total, int admissible, int enqueued, int dropped) {}

    default void duplicateEmail(String email) {}
    default void dedupSummary(int before, int after) {}

    /** budget: "pages" | "time" */
    default void budgetExhausted(String budget, int pagesVisited) {}

    CrawlTrace NONE = new CrawlTrace() {};
}
