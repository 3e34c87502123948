package com.mailspider.core.crawler;

import com.mailspider.core.api.IPageFetcher;
import com.mailspider.core.model.FetchResult;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** 맵 기반 가짜 사이트. 등록 안 된 URL 은 404, down() 으로 등록한 URL 은 네트워크 오류 */
final class FakeFetcher implements IPageFetcher {

    private final Map<String, FetchResult> pages = new HashMap<>();
    final List<String> fetched = new ArrayList<>();
    Runnable onFetch = () -> {};
    boolean closed;

    /** text 는 body 에, links 는 a[href] 로 들어간다 */
    FakeFetcher page(String url, String text, String... links) {
        StringBuilder html = new StringBuilder("<html><body><p>").append(text).append("</p>");
        for (String l : links) html.append(" <a href=\"").append(l).append("\">link</a>");
        html.append("</body></html>");
        pages.put(url, FetchResult.ok(URI.create(url), 200, html.toString()));
        return this;
    }

    FakeFetcher raw(String url, int status, String body) {
        pages.put(url, FetchResult.ok(URI.create(url), status, body));
        return this;
    }

    FakeFetcher down(String url) {
        pages.put(url, FetchResult.fail(URI.create(url), "Connection failed: Unable to reach " + url));
        return this;
    }

    @Override
    public FetchResult fetch(URI url) {
        fetched.add(url.toString());
        onFetch.run();
        FetchResult r = pages.get(url.toString());
        return (r != null) ? r : FetchResult.ok(url, 404, "<html><body>Not Found</body></html>");
    }

    @Override
    public void close() {
        closed = true;
    }
}
