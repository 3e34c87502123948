package com.mailspider.core.crawler;

/** 정규화된 시드에서 도메인(host)을 얻지 못함 */
public class DomainExtractionException extends CrawlSetupException {
    public DomainExtractionException(String seedUrl) {
        super("Could not extract domain from URL: " + seedUrl, seedUrl);
    }
}
