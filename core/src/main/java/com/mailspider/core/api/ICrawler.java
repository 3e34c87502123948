// ICrawler.java
package com.mailspider.core.api;

import com.mailspider.core.model.CrawlStats;
import com.mailspider.core.model.ExtractionResult;

import java.util.List;

/** 크롤러 최소 계약: 시드에서 BFS로 돌며 이메일 추출 결과(중복 포함)를 돌려준다. */
public interface ICrawler extends AutoCloseable {
    List<ExtractionResult> crawl(String seedUrl, int maxDepth, boolean crossDomain, int maxPages);

    /** 직전 crawl 호출의 카운터. 아직 실행 전이면 EMPTY */
    default CrawlStats.Snapshot lastStats() { return CrawlStats.Snapshot.EMPTY; }

    @Override default void close() throws Exception {}
}
