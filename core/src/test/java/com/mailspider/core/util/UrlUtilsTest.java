package com.mailspider.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class UrlUtilsTest {

    @Test
    @DisplayName("scheme/host 소문자, 기본 포트/fragment 제거, 끝 슬래시 제거, 쿼리 정렬")
    void normalize_appliesAllRules() {
        URI n = UrlUtils.normalize(URI.create("HTTP://Example.COM:80/a/b/?b=2&a=1#top"));
        assertEquals("http://example.com/a/b?a=1&b=2", n.toString());
    }

    @Test
    void normalize_emptyPathBecomesRoot_andRootSlashKept() {
        assertEquals("https://example.com/", UrlUtils.normalize("https://example.com").toString());
        assertEquals("https://example.com/", UrlUtils.normalize("https://example.com:443/").toString());
    }

    @Test
    void normalize_keepsNonDefaultPort_andUserInfo() {
        assertEquals("http://example.com:8080/x", UrlUtils.normalize("http://example.com:8080/x/").toString());
        assertEquals("https://example.com:80/", UrlUtils.normalize("https://example.com:80").toString());
    }

    @Test
    void normalize_isIdempotent() {
        URI once = UrlUtils.normalize("http://Example.com/p/?z=1&a=2&a=1#f");
        URI twice = UrlUtils.normalize(once);
        assertEquals(once, twice);
    }

    @Test
    void normalize_keepsEncodingAsIs() {
        URI n = UrlUtils.normalize("http://example.com/a%20b?q=x%26y");
        assertEquals("http://example.com/a%20b?q=x%26y", n.toString());
    }

    @Test
    void normalize_rejectsNonHttp() {
        assertNull(UrlUtils.normalize("mailto:a@b.com"));
        assertNull(UrlUtils.normalize("ftp://example.com/"));
        assertNull(UrlUtils.normalize("/relative/path"));
        assertNull(UrlUtils.normalize((String) null));
    }

    @Test
    void isValid_requiresAbsoluteHttpWithHost() {
        assertTrue(UrlUtils.isValid("https://example.com/x"));
        assertTrue(UrlUtils.isValid("  http://example.com  "));
        assertFalse(UrlUtils.isValid("not a url"));
        assertFalse(UrlUtils.isValid("example.com"));
        assertFalse(UrlUtils.isValid("javascript:void(0)"));
        assertFalse(UrlUtils.isValid(""));
        assertFalse(UrlUtils.isValid(null));
    }

    @Test
    void sortQuery_isStableByName_andDropsEmptyPairs() {
        assertEquals("a=2&a=1&b=0", UrlUtils.sortQuery("b=0&a=2&&a=1"));
        assertNull(UrlUtils.sortQuery("&&"));
        assertNull(UrlUtils.sortQuery(""));
    }

    @Test
    @DisplayName("서브도메인은 다른 도메인")
    void sameDomain_isExactHostMatch() {
        URI a = URI.create("https://Example.com/a");
        assertTrue(UrlUtils.sameDomain(a, URI.create("http://example.com:8080/b")));
        assertFalse(UrlUtils.sameDomain(a, URI.create("https://blog.example.com/")));
        assertFalse(UrlUtils.sameDomain(a, null));
        assertEquals("example.com", UrlUtils.domainOf(a));
        assertEquals("", UrlUtils.domainOf(null));
    }

    @Test
    @DisplayName("java.net.URI 가 거부하는 문자는 인코딩 후 파싱")
    void lenientParsing_encodesIllegalCharacters() {
        assertEquals("http://example.com/s?q=a%7Cb", UrlUtils.normalize("http://example.com/s?q=a|b").toString());
        assertEquals("http://example.com/a%20b", UrlUtils.normalize("http://example.com/a b").toString());
        assertEquals("a%252", UrlUtils.encodeIllegal("a%2"));
        assertEquals("a%41#f%23g", UrlUtils.encodeIllegal("a%41#f#g"));
    }

    @Test
    @DisplayName("host 에 '_' 가 있어도 유효, 포트/대소문자 규칙 동일")
    void underscoreHost_isAcceptedAndNormalized() {
        assertTrue(UrlUtils.isValid("https://my_host.example.com/"));
        assertEquals("http://my_host.com/a", UrlUtils.normalize("http://My_Host.com:80/a/").toString());
        assertEquals("http://user@my_host.com:8080/", UrlUtils.normalize("http://user@my_host.com:8080").toString());
        assertEquals("my_host.com", UrlUtils.domainOf(URI.create("http://My_Host.com:81/")));
    }
}
