package com.bookharvest.core.api;

import com.bookharvest.core.extract.ParseException;
import com.bookharvest.core.model.ExtractedPage;

/** 원시 HTML → 페이지 레코드. 본문을 못 찾으면 빈 텍스트 대신 ParseException. */
public interface IHtmlExtractor {
    ExtractedPage extract(int pageNumber, String html) throws ParseException;
}
