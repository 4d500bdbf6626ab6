package com.bookharvest.core.model;

import com.bookharvest.core.util.BookIds;

import java.net.URI;
import java.util.Objects;

/** 추출 대상 책(불변). 실행당 한 번 생성. */
public final class Book {
    private final String id;
    private final int totalPages;
    private final String sourceBaseUrl;

    public Book(String id, int totalPages, String sourceBaseUrl) {
        this.id = BookIds.normalize(Objects.requireNonNull(id, "id"));
        if (totalPages < 0) throw new IllegalArgumentException("totalPages must be >= 0");
        this.totalPages = totalPages;
        this.sourceBaseUrl = Objects.requireNonNull(sourceBaseUrl, "sourceBaseUrl");
    }

    public String getId() { return id; }
    public int getTotalPages() { return totalPages; }
    public String getSourceBaseUrl() { return sourceBaseUrl; }

    /** 페이지 URL은 {base, id, page}로부터 결정적으로 만들어진다. */
    public URI pageUri(int pageNumber) {
        if (pageNumber > totalPages) {
            throw new IllegalArgumentException("page " + pageNumber + " > totalPages " + totalPages);
        }
        return BookIds.pageUri(sourceBaseUrl, id, pageNumber);
    }

    @Override public String toString() {
        return "Book{" + id + ", pages=" + totalPages + ", base=" + sourceBaseUrl + "}";
    }
}
