package com.bookharvest.core.model;

import java.util.Objects;

/** 페이지 구조 메타데이터. Gson 직렬화 대상이라 필드는 단순 타입만 둔다. */
public final class PageMetadata {
    private final String parser;
    private final String contentSelector;
    private final int wordCount;
    private final int charCount;
    private final Integer printedPageNumber; // 원본 인쇄 쪽수, 없으면 null

    public PageMetadata(String parser, String contentSelector, int wordCount, int charCount, Integer printedPageNumber) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.contentSelector = Objects.requireNonNull(contentSelector, "contentSelector");
        this.wordCount = wordCount;
        this.charCount = charCount;
        this.printedPageNumber = printedPageNumber;
    }

    public String getParser() { return parser; }
    public String getContentSelector() { return contentSelector; }
    public int getWordCount() { return wordCount; }
    public int getCharCount() { return charCount; }
    public Integer getPrintedPageNumber() { return printedPageNumber; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PageMetadata m)) return false;
        return wordCount == m.wordCount && charCount == m.charCount
                && parser.equals(m.parser) && contentSelector.equals(m.contentSelector)
                && Objects.equals(printedPageNumber, m.printedPageNumber);
    }

    @Override public int hashCode() {
        return Objects.hash(parser, contentSelector, wordCount, charCount, printedPageNumber);
    }

    @Override public String toString() {
        return "PageMetadata{parser=" + parser + ", selector=" + contentSelector + ", words=" + wordCount
                + ", chars=" + charCount + ", printed=" + printedPageNumber + "}";
    }
}
