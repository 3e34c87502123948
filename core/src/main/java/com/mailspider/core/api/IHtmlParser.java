// IHtmlParser.java
package com.mailspider.core.api;

import com.mailspider.core.model.ParsedPage;

/** HTML → (본문 텍스트, 링크 원본 값). 깨진 마크업도 최대한 추출, 전체 실패 시 빈 결과. */
public interface IHtmlParser {
    ParsedPage parse(String html);
}
