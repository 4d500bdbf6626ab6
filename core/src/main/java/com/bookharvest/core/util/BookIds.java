package com.bookharvest.core.util;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 책 ID 정규화 및 페이지 URL 규칙: {base}/book/{id}/{page} */
public final class BookIds {
    private static final Pattern PREFIXED = Pattern.compile("^BK0*(\\d+)$");

    private BookIds() {}

    /** "BK000043" → "43". 그 외는 trim만. */
    public static String normalize(String raw) {
        Objects.requireNonNull(raw, "raw");
        String s = raw.trim();
        if (s.isEmpty()) throw new IllegalArgumentException("book id is blank");
        Matcher m = PREFIXED.matcher(s.toUpperCase(Locale.ROOT));
        return m.matches() ? m.group(1) : s;
    }

    public static URI pageUri(String sourceBaseUrl, String bookId, int pageNumber) {
        if (pageNumber < 1) throw new IllegalArgumentException("pageNumber must be >= 1: " + pageNumber);
        String base = sourceBaseUrl.endsWith("/")
                ? sourceBaseUrl.substring(0, sourceBaseUrl.length() - 1)
                : sourceBaseUrl;
        return URI.create(base + "/book/" + bookId + "/" + pageNumber);
    }
}
