package com.mailspider.core.model;

import java.net.URI;
import java.util.Optional;

/**
 * 페이지 fetch 결과(status/body/error 3종 세트).
 * status 0 + error 는 네트워크 계층 실패(타임아웃, DNS, 연결 거부 등).
 * HTTP 4xx/5xx 는 error 없이 status 그대로 전달된다.
 */
public final class FetchResult {
    private final URI url;
    private final int status;
    private final String body;
    private final String error;
    private final String contentType;
    private final long elapsedMs;

    private FetchResult(URI url, int status, String body, String error, String contentType, long elapsedMs) {
        this.url = url;
        this.status = status;
        this.body = (body == null) ? "" : body;
        this.error = error;
        this.contentType = contentType;
        this.elapsedMs = elapsedMs;
    }

    public static FetchResult ok(URI url, int status, String body, String contentType, long elapsedMs) {
        return new FetchResult(url, status, body, null, contentType, elapsedMs);
    }

    public static FetchResult ok(URI url, int status, String body) {
        return ok(url, status, body, null, 0L);
    }

    public static FetchResult fail(URI url, String error, long elapsedMs) {
        return new FetchResult(url, 0, "", (error == null ? "unknown error" : error), null, elapsedMs);
    }

    public static FetchResult fail(URI url, String error) {
        return fail(url, error, 0L);
    }

    public URI getUrl() { return url; }
    public int getStatus() { return status; }
    public String getBody() { return body; }
    public Optional<String> getError() { return Optional.ofNullable(error); }
    public String getContentType() { return contentType; }
    public long getElapsedMs() { return elapsedMs; }

    /** error 없음 + 2xx */
    public boolean isSuccess() {
        return error == null && status >= 200 && status < 300;
    }
}
