package com.mailspider.core.model;

import java.util.List;

/** HTML 파싱 결과: 본문 텍스트 + a[href] 원본 값(문서 순서) */
public record ParsedPage(String textContent, List<String> links) {

    private static final ParsedPage EMPTY = new ParsedPage("", List.of());

    public ParsedPage {
        textContent = (textContent == null) ? "" : textContent;
        links = (links == null) ? List.of() : List.copyOf(links);
    }

    public static ParsedPage empty() { return EMPTY; }
}
