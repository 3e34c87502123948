package com.mailspider.core.model;

import java.nio.file.Path;

/**
 * 서비스 1회 실행 결과 요약.
 * @param extracted   크롤러가 돌려준 결과 수(중복 제거 전)
 * @param saved       중복 제거 후 이번에 기록한 수
 * @param previous    기존 파일에 이미 있던 결과 수
 * @param appended    기존 파일에 이어쓰기 했는지
 */
public record ExtractionReport(int extracted,
                               int saved,
                               int previous,
                               boolean appended,
                               Path output,
                               CrawlStats.Snapshot crawl) {
}
