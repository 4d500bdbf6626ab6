package com.bookharvest.core.util;

@FunctionalInterface
public interface ProgressListener {
    /**
     * @param bookId 정규화된 책 ID
     * @param phase  "resolve" | "extract" | "flush" | "done"
     * @param done   처리된 페이지 수(모르면 -1)
     * @param total  대상 페이지 수(모르면 -1)
     */
    void onProgress(String bookId, String phase, long done, long total);

    ProgressListener NONE = (b, phase, d, t) -> {};
}
