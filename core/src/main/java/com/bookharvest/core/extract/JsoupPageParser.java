package com.bookharvest.core.extract;

import com.bookharvest.core.api.IHtmlExtractor;
import com.bookharvest.core.model.ExtractedPage;
import com.bookharvest.core.model.PageMetadata;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;

/**
 * 빠른 1차 파서: 알려진 본문 컨테이너 셀렉터만 순서대로 본다.
 * 어느 것도 비어 있지 않은 본문을 주지 않으면 실패(관대한 파서로 넘김).
 */
public class JsoupPageParser implements IHtmlExtractor {

    public static final String NAME = "jsoup-fast";

    /** 우선순위 순 */
    static final List<String> CONTENT_SELECTORS = List.of(
            "div.nass", "#book", "div#text", "article", "div.reader-text",
            "div.col-md-9", ".book-content", ".page-content", "main");

    @Override
    public ExtractedPage extract(int pageNumber, String html) throws ParseException {
        if (html == null || html.isBlank()) throw new ParseException("page " + pageNumber + ": empty body");
        Document doc;
        try {
            doc = Jsoup.parse(html);
        } catch (RuntimeException e) {
            throw new ParseException("page " + pageNumber + ": jsoup failed", e);
        }
        for (String selector : CONTENT_SELECTORS) {
            Element content = doc.selectFirst(selector);
            if (content == null) continue;
            String text = TextCleaner.clean(content);
            if (text.isEmpty()) continue;
            return new ExtractedPage(pageNumber, text, new PageMetadata(
                    NAME, selector, TextCleaner.wordCount(text), text.length(),
                    PrintedPageNumbers.fromTitle(doc.title())));
        }
        throw new ParseException("page " + pageNumber + ": no known content container");
    }
}
