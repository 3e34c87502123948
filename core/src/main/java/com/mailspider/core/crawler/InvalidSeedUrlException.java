package com.mailspider.core.crawler;

/** 시드가 절대 http(s) URL 이 아님 */
public class InvalidSeedUrlException extends CrawlSetupException {
    public InvalidSeedUrlException(String seedUrl) {
        super("Invalid URL: " + seedUrl, seedUrl);
    }
}
