package com.mailspider.core.crawler;

/** 크롤 시작 전에 전체를 중단시키는 치명적 오류(fetch 전에 던져짐). */
public class CrawlSetupException extends IllegalArgumentException {
    private final String seedUrl;

    public CrawlSetupException(String message, String seedUrl) {
        super(message);
        this.seedUrl = seedUrl;
    }

    public String getSeedUrl() { return seedUrl; }
}
