package com.bookharvest.core.extract;

import com.bookharvest.core.api.IHtmlExtractor;
import com.bookharvest.core.model.ExtractedPage;
import com.bookharvest.core.model.PageMetadata;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * 관대한 대체 파서: 구조를 가정하지 않고 body 전체에서 본문을 긁는다.
 * 헤더/푸터 태그까지 지운 뒤에도 남는 글이 없으면 실패.
 */
public class LenientPageParser implements IHtmlExtractor {

    public static final String NAME = "lenient";

    private static final String CHROME = "header, footer, aside, form, select, noscript, iframe";

    @Override
    public ExtractedPage extract(int pageNumber, String html) throws ParseException {
        if (html == null || html.isBlank()) throw new ParseException("page " + pageNumber + ": empty body");
        Document doc;
        try {
            doc = Jsoup.parse(html);
        } catch (RuntimeException e) {
            throw new ParseException("page " + pageNumber + ": jsoup failed", e);
        }
        Element body = doc.body();
        if (body == null) throw new ParseException("page " + pageNumber + ": no <body>");
        body.select(CHROME).remove();
        String text = TextCleaner.clean(body);
        if (text.isEmpty()) {
            throw new ParseException("page " + pageNumber + ": no text left after cleaning");
        }
        return new ExtractedPage(pageNumber, text, new PageMetadata(
                NAME, "body", TextCleaner.wordCount(text), text.length(),
                PrintedPageNumbers.fromTitle(doc.title())));
    }
}
