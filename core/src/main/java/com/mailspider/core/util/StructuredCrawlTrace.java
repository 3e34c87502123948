package com.mailspider.core.util;

import java.net.URI;
import java.util.List;
import java.util.Locale;

/** CrawlTrace → StructuredLog(JSON 라인). debug 이벤트는 FINE, 예산 소진은 INFO. */
public final class StructuredCrawlTrace implements CrawlTrace {

    private final StructuredLog slog;

    public StructuredCrawlTrace() {
        this(StructuredLog.get(StructuredCrawlTrace.class));
    }

    StructuredCrawlTrace(StructuredLog slog) {
        this.slog = slog;
    }

    /** debug=true 면 구조화 trace, 아니면 NONE */
    public static CrawlTrace forDebug(boolean debug) {
        return debug ? new StructuredCrawlTrace() : CrawlTrace.NONE;
    }

    @Override public void visit(URI url, int depth) {
        slog.debug("visit", "url", url, "depth", depth);
    }

    @Override public void skipped(URI url, SkipReason reason) {
        slog.debug("skip", "url", url, "reason", reason.name().toLowerCase(Locale.ROOT).replace('_', '-'));
    }

    @Override public void httpStatus(URI url, int status, long elapsedMs) {
        slog.debug("http", "url", url, "status", status, "elapsedMs", elapsedMs);
    }

    @Override public void httpError(URI url, String error) {
        slog.debug("http-error", "url", url, "error", error);
    }

    @Override public void httpSkip(URI url, int status) {
        slog.debug("http-skip", "url", url, "status", status);
    }

    @Override public void parseError(URI url, Throwable t) {
        slog.debug("parse-error", "url", url, "error", t.getClass().getSimpleName(), "message", t.getMessage());
    }

    @Override public void emailsFound(URI url, List<String> emails) {
        slog.debug("emails-found", "url", url, "count", emails.size(), "emails", emails);
    }

    @Override public void noEmails(URI url) {
        slog.debug("no-emails", "url", url);
    }

    @Override public void linksDiscovered(URI url, int total, int admissible, int enqueued, int dropped) {
        slog.debug("links", "url", url, "total", total, "admissible", admissible,
                "enqueued", enqueued, "dropped", dropped);
    }

    @Override public void duplicateEmail(String email) {
        slog.debug("duplicate-email", "email", email);
    }

    @Override public void dedupSummary(int before, int after) {
        slog.debug("dedup-summary", "before", before, "after", after, "removed", before - after);
    }

    @Override public void budgetExhausted(String budget, int pagesVisited) {
        slog.info("budget-exhausted", "budget", budget, "pagesVisited", pagesVisited);
    }
}
