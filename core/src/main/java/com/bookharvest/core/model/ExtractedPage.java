package com.bookharvest.core.model;

import java.util.Objects;

/** 파싱이 끝난 페이지 레코드(불변). 파싱 성공한 PageTask에서만 만들어진다. */
public final class ExtractedPage {
    private final int pageNumber;
    private final String text;
    private final PageMetadata metadata;

    public ExtractedPage(int pageNumber, String text, PageMetadata metadata) {
        if (pageNumber < 1) throw new IllegalArgumentException("pageNumber must be >= 1");
        this.pageNumber = pageNumber;
        this.text = Objects.requireNonNull(text, "text");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    public int getPageNumber() { return pageNumber; }
    public String getText() { return text; }
    public PageMetadata getMetadata() { return metadata; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExtractedPage p)) return false;
        return pageNumber == p.pageNumber && text.equals(p.text) && metadata.equals(p.metadata);
    }

    @Override public int hashCode() { return Objects.hash(pageNumber, text, metadata); }

    @Override public String toString() {
        return "ExtractedPage{" + pageNumber + ", chars=" + text.length() + "}";
    }
}
