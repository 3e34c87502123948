// IEmailExtractor.java
package com.mailspider.core.api;

import java.util.List;

/** 텍스트 → 유효한 이메일 주소 목록(호출 내 유일, 등장 순서 유지). */
public interface IEmailExtractor {
    List<String> extract(String text);
}
