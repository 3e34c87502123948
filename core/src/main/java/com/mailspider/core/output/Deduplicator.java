package com.mailspider.core.output;

import com.mailspider.core.model.ExtractionResult;
import com.mailspider.core.util.CrawlTrace;

import java.util.*;

/**
 * 이메일 기준 중복 제거(대소문자 무시).
 * 기존 파일에 이미 있는 주소로 시드할 수 있고, 첫 등장 항목만 남기며 순서는 유지한다.
 */
public final class Deduplicator {

    private final CrawlTrace trace;

    public Deduplicator() { this(CrawlTrace.NONE); }

    public Deduplicator(CrawlTrace trace) {
        this.trace = (trace != null) ? trace : CrawlTrace.NONE;
    }

    public List<ExtractionResult> deduplicate(List<ExtractionResult> results) {
        return deduplicate(results, List.of());
    }

    public List<ExtractionResult> deduplicate(List<ExtractionResult> results, Collection<String> existingEmails) {
        Set<String> seen = new HashSet<>();
        if (existingEmails != null) {
            for (String e : existingEmails) {
                if (e != null) seen.add(key(e));
            }
        }

        List<ExtractionResult> unique = new ArrayList<>();
        if (results == null) return unique;
        for (ExtractionResult r : results) {
            if (seen.add(key(r.getEmail()))) {
                unique.add(r);
            } else {
                trace.duplicateEmail(r.getEmail());
            }
        }
        trace.dedupSummary(results.size(), unique.size());
        return unique;
    }

    private static String key(String email) {
        return email.toLowerCase(Locale.ROOT);
    }
}
