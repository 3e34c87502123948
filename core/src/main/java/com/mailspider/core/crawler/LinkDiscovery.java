package com.mailspider.core.crawler;

import com.mailspider.core.util.UrlUtils;
import org.jsoup.internal.StringUtil;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 페이지의 a[href] 원본 값 → 큐에 넣을 수 있는 절대 URL 목록.
 * - baseUrl 기준 상대경로 해석(jsoup StringUtil.resolve)
 * - http(s) 아님 / 해석 실패 / host 없음 → 조용히 버림(오류 아님)
 * - crossDomain=false 면 host 가 baseDomain 과 정확히 같아야 함(서브도메인은 다른 도메인)
 * - 해석된 절대 URL 문자열 기준 호출 내 중복 제거, 첫 등장 순서 유지
 * 부수효과 없음, 예외를 밖으로 던지지 않음.
 */
public final class LinkDiscovery {
    private LinkDiscovery(){}

    public static List<URI> discoverLinks(List<String> rawLinks, String baseDomain, URI baseUrl, boolean crossDomain) {
        List<URI> out = new ArrayList<>();
        if (rawLinks == null || rawLinks.isEmpty() || baseUrl == null) return out;
        String domain = (baseDomain == null) ? "" : baseDomain;

        Set<String> seen = new HashSet<>();
        for (String raw : rawLinks) {
            URI abs = resolve(baseUrl, raw);
            if (abs == null || !UrlUtils.isHttp(abs)) continue;

            if (!crossDomain && !domain.equals(UrlUtils.domainOf(abs))) continue;

            if (seen.add(abs.toString())) {
                out.add(abs);
            }
        }
        return out;
    }

    /**
     * jsoup 의 URL 해석기(absUrl 과 같은 경로)로 절대 URL 을 만든 뒤 관대하게 파싱.
     * "?page=2" 는 마지막 경로 조각을 유지하고, 루트 위로 올라가는 ".." 는 버린다.
     * 해석 실패 시 null
     */
    static URI resolve(URI baseUrl, String raw) {
        if (raw == null) return null;
        String href = raw.trim();
        if (href.isEmpty()) return null;
        String abs;
        try {
            abs = StringUtil.resolve(baseUrl.toString(), href);
        } catch (IllegalArgumentException ignore) {
            return null; // java.net.URL 이 거부한 host (예: 닫히지 않은 '[')
        }
        return abs.isEmpty() ? null : UrlUtils.parse(abs);
    }
}
