package com.mailspider.core.crawler;

import com.mailspider.core.api.IHtmlParser;
import com.mailspider.core.model.ParsedPage;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/** 기본 JSoup 기반 파서: body 텍스트 + a[href] 원본 값 수집 (절대경로 해석은 LinkDiscovery 담당) */
public class JsoupHtmlParser implements IHtmlParser {
    private static final Logger LOG = Logger.getLogger(JsoupHtmlParser.class.getName());

    @Override
    public ParsedPage parse(String html) {
        if (html == null || html.isBlank()) return ParsedPage.empty();
        try {
            Document doc = Jsoup.parse(html);

            Element body = doc.body();
            String text = (body != null) ? body.text() : doc.text();

            List<String> links = new ArrayList<>();
            for (Element a : doc.select("a[href]")) {
                String href = a.attr("href");
                if (!href.isEmpty()) links.add(href);
            }
            return new ParsedPage(text.trim(), links);
        } catch (RuntimeException e) {
            // jsoup 은 관대한 파서라 여기 오는 경우는 드묾. 계약상 빈 결과로 대체
            LOG.log(Level.FINE, "HTML parse failed: " + e.getMessage(), e);
            return ParsedPage.empty();
        }
    }
}
