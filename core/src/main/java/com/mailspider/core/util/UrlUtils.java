package com.mailspider.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/** URL 검증 + 정규화 + same-domain 판정 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    // java.net.URI 가 거부하지만 브라우저는 받아주는 문자
    private static final String ILLEGAL = " \"<>\\^`{|}";

    /** 절대 http(s) URL 이고 host 가 있으면 true */
    public static boolean isValid(String url) {
        return parseHttp(url) != null;
    }

    /** 절대 http(s) URL 로 파싱. 실패/비허용 스킴/host 없음이면 null */
    public static URI parseHttp(String url) {
        URI u = parse(url);
        return isHttp(u) ? u : null;
    }

    /**
     * 관대한 파싱: URI 문법에 안 맞는 문자(공백, |, {, ", 짝 없는 % 등)는 먼저 퍼센트 인코딩.
     * 스킴 제한 없음. 그래도 실패하면 null
     */
    public static URI parse(String url) {
        if (url == null || url.isBlank()) return null;
        try {
            return new URI(encodeIllegal(url.trim()));
        } catch (URISyntaxException e) {
            return null;
        }
    }

    public static boolean isHttp(URI u) {
        if (u == null || !u.isAbsolute() || u.isOpaque()) return false;
        String s = u.getScheme();
        if (!"http".equalsIgnoreCase(s) && !"https".equalsIgnoreCase(s)) return false;
        String host = hostOf(u);
        return host != null && !host.isEmpty();
    }

    /**
     * 정규화 규칙:
     * - scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - 빈 경로는 "/", 루트가 아니면 끝 슬래시 1개 제거
     * - 쿼리 파라미터를 이름 기준 안정 정렬(값/인코딩은 그대로)
     * - fragment 제거(#... 제거)
     * http(s)가 아니거나 host 가 없으면 null.
     */
    public static URI normalize(URI u) {
        if (!isHttp(u)) return null;

        String scheme = u.getScheme().toLowerCase(Locale.ROOT);
        String host = hostOf(u).toLowerCase(Locale.ROOT);

        int port = portOf(u);
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1; // 기본 포트 제거
        }

        String path = u.getRawPath();
        if (path == null || path.isEmpty()) path = "/";
        if (path.length() > 1 && path.endsWith("/")) path = path.substring(0, path.length() - 1);

        String query = sortQuery(u.getRawQuery());

        // raw 컴포넌트로 직접 조립해야 이중 인코딩이 안 생김
        StringBuilder sb = new StringBuilder(64).append(scheme).append("://");
        String userInfo = userInfoOf(u);
        if (userInfo != null) sb.append(userInfo).append('@');
        sb.append(host);
        if (port != -1) sb.append(':').append(port);
        sb.append(path);
        if (query != null) sb.append('?').append(query);

        try {
            return new URI(sb.toString());
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /** 문자열 버전. 파싱 실패 시 null */
    public static URI normalize(String url) {
        return normalize(parseHttp(url));
    }

    /** 비교용 host(소문자). 없으면 "" */
    public static String domainOf(URI u) {
        String host = (u == null) ? null : hostOf(u);
        return (host == null) ? "" : host.toLowerCase(Locale.ROOT);
    }

    /** host 기준 동일 도메인 판정(소문자 비교, 서브도메인은 다른 도메인) */
    public static boolean sameDomain(URI a, URI b) {
        if (a == null || b == null) return false;
        String ha = domainOf(a);
        return !ha.isEmpty() && ha.equals(domainOf(b));
    }

    /** "b=2&a=1" → "a=1&b=2". 빈 쌍은 버림, 결과가 비면 null */
    static String sortQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) return null;
        List<String> pairs = new ArrayList<>();
        for (String p : rawQuery.split("&")) {
            if (!p.isEmpty()) pairs.add(p);
        }
        if (pairs.isEmpty()) return null;
        // List.sort 는 stable → 같은 이름끼리는 원래 순서 유지
        pairs.sort(Comparator.comparing(UrlUtils::paramName));
        return String.join("&", pairs);
    }

    private static String paramName(String pair) {
        int eq = pair.indexOf('=');
        return eq < 0 ? pair : pair.substring(0, eq);
    }

    /*
     * host 에 '_' 가 있으면 java.net.URI 는 registry 기반 authority 로 보고 getHost()/getPort() 가 비어 있다.
     * 그런 경우 raw authority 를 직접 나눈다: [userinfo@]host[:port]
     */
    static String hostOf(URI u) {
        if (u.getHost() != null) return u.getHost();
        String hostPort = hostPortOf(u);
        if (hostPort == null) return null;
        int colon = hostPort.lastIndexOf(':');
        return (colon >= 0 && isPort(hostPort.substring(colon + 1))) ? hostPort.substring(0, colon) : hostPort;
    }

    private static int portOf(URI u) {
        if (u.getHost() != null) return u.getPort();
        String hostPort = hostPortOf(u);
        if (hostPort == null) return -1;
        int colon = hostPort.lastIndexOf(':');
        return (colon >= 0 && isPort(hostPort.substring(colon + 1))) ? Integer.parseInt(hostPort.substring(colon + 1)) : -1;
    }

    private static String userInfoOf(URI u) {
        if (u.getHost() != null) return u.getRawUserInfo();
        String auth = u.getRawAuthority();
        int at = (auth == null) ? -1 : auth.lastIndexOf('@');
        return at < 0 ? null : auth.substring(0, at);
    }

    private static String hostPortOf(URI u) {
        String auth = u.getRawAuthority();
        if (auth == null || auth.isEmpty()) return null;
        return auth.substring(auth.lastIndexOf('@') + 1);
    }

    private static boolean isPort(String s) {
        if (s.isEmpty() || s.length() > 5) return false;
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) return false;
        }
        return true;
    }

    /** URI 가 거부하는 문자 인코딩. 두 번째 이후 '#', 뒤에 16진수 2자리가 없는 '%' 도 포함 */
    static String encodeIllegal(String s) {
        StringBuilder sb = null;
        boolean seenHash = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            boolean bad = ILLEGAL.indexOf(c) >= 0
                    || (c == '#' && seenHash)
                    || (c == '%' && !(i + 2 < s.length() && isHex(s.charAt(i + 1)) && isHex(s.charAt(i + 2))));
            if (c == '#') seenHash = true;
            if (bad && sb == null) sb = new StringBuilder(s.length() + 16).append(s, 0, i);
            if (sb == null) continue;
            if (bad) sb.append('%').append(String.format("%02X", (int) c));
            else sb.append(c);
        }
        return (sb == null) ? s : sb.toString();
    }

    private static boolean isHex(char c) {
        return Character.digit(c, 16) >= 0;
    }
}
