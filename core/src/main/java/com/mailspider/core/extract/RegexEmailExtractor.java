package com.mailspider.core.extract;

import com.mailspider.core.api.IEmailExtractor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 정규식으로 후보를 찾고 isValid() 문법 검사를 통과한 주소만 돌려준다.
 * 호출 내 중복은 문자열 그대로(대소문자 구분) 제거, 등장 순서 유지.
 * 대소문자 무시 중복 제거는 Deduplicator 몫.
 */
public class RegexEmailExtractor implements IEmailExtractor {

    // 길이 제한은 정규식이 아니라 isValid 에서 검사(정규식에 넣으면 긴 local part 의 꼬리만 잘려 매치됨)
    private static final Pattern EMAIL_PATTERN = Pattern.compile(
            "\\b[A-Za-z0-9](?:[A-Za-z0-9._+-]*[A-Za-z0-9])?@[A-Za-z0-9][A-Za-z0-9.-]*\\.[A-Za-z]{2,}\\b");

    private static final Pattern LOCAL_CHARS = Pattern.compile("^[A-Za-z0-9._+-]+$");
    private static final Pattern DOMAIN_CHARS = Pattern.compile("^[A-Za-z0-9.-]+$");
    private static final Pattern TLD = Pattern.compile("^[A-Za-z]{2,}$");

    @Override
    public List<String> extract(String text) {
        if (text == null || text.isEmpty()) return List.of();

        Set<String> unique = new LinkedHashSet<>();
        Matcher m = EMAIL_PATTERN.matcher(text);
        while (m.find()) {
            String candidate = m.group();
            if (isValid(candidate)) unique.add(candidate);
        }
        return new ArrayList<>(unique);
    }

    /**
     * 주소 문법:
     * - local: 1~64자, [A-Za-z0-9._+-], 점으로 시작/끝 금지, 연속 점 금지
     * - domain: 1~255자, 영숫자/점/하이픈, 점·하이픈으로 시작/끝 금지, 연속 점 금지, 점 1개 이상
     * - TLD: 영문자 2자 이상
     */
    public static boolean isValid(String email) {
        if (email == null || email.isEmpty()) return false;

        int at = email.indexOf('@');
        if (at < 0 || at != email.lastIndexOf('@')) return false;

        String local = email.substring(0, at);
        String domain = email.substring(at + 1);

        if (local.isEmpty() || local.length() > 64) return false;
        if (local.startsWith(".") || local.endsWith(".")) return false;
        if (local.contains("..")) return false;
        if (!LOCAL_CHARS.matcher(local).matches()) return false;

        if (domain.isEmpty() || domain.length() > 255) return false;
        if (!domain.contains(".")) return false;
        if (domain.startsWith(".") || domain.endsWith(".")
                || domain.startsWith("-") || domain.endsWith("-")) return false;
        if (domain.contains("..")) return false;
        if (!DOMAIN_CHARS.matcher(domain).matches()) return false;

        String tld = domain.substring(domain.lastIndexOf('.') + 1);
        return TLD.matcher(tld).matches();
    }
}
