package com.bookharvest.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 실행 종료 시 한 번 만들어지는 읽기 전용 요약.
 * pagesTotal = pagesSucceeded + pagesFailed + incomplete + pagesSkipped
 */
public final class ExtractionResult {

    public enum Status {
        /** 모든 대상 페이지가 PERSISTED 또는 FAILED */
        COMPLETED,
        /** 외부 중지 신호로 끝남. incomplete 페이지는 다음 재개 때 다시 시도 */
        STOPPED,
        /** 영속화 실패 또는 연결 완전 상실 */
        FATAL
    }

    private final String bookId;
    private final TierKind tier;
    private final Status status;
    private final String fatalError;
    private final int pagesTotal;
    private final int pagesSucceeded;
    private final int pagesFailed;
    private final int pagesSkipped;
    private final List<Integer> failedPageNumbers;
    private final List<Integer> incompletePageNumbers;
    private final Map<Integer, Integer> attemptsByPage;
    private final int checkpoint;
    private final long durationMs;
    private final ExtractionStats.Snapshot stats;

    private ExtractionResult(Builder b) {
        this.bookId = Objects.requireNonNull(b.bookId, "bookId");
        this.tier = b.tier;
        this.status = Objects.requireNonNull(b.status, "status");
        this.fatalError = b.fatalError;
        this.pagesTotal = b.pagesTotal;
        this.pagesSucceeded = b.pagesSucceeded;
        this.pagesFailed = b.failedPageNumbers.size();
        this.pagesSkipped = b.pagesSkipped;
        this.failedPageNumbers = List.copyOf(b.failedPageNumbers);
        this.incompletePageNumbers = List.copyOf(b.incompletePageNumbers);
        this.attemptsByPage = Map.copyOf(b.attemptsByPage);
        this.checkpoint = b.checkpoint;
        this.durationMs = b.durationMs;
        this.stats = b.stats;
    }

    public static Builder builder() { return new Builder(); }

    public String getBookId() { return bookId; }
    public TierKind getTier() { return tier; }
    public Status getStatus() { return status; }
    public String getFatalError() { return fatalError; }
    public int getPagesTotal() { return pagesTotal; }
    public int getPagesSucceeded() { return pagesSucceeded; }
    public int getPagesFailed() { return pagesFailed; }
    public int getPagesSkipped() { return pagesSkipped; }
    public List<Integer> getFailedPageNumbers() { return failedPageNumbers; }
    public List<Integer> getIncompletePageNumbers() { return incompletePageNumbers; }
    public int getCheckpoint() { return checkpoint; }
    public long getDurationMs() { return durationMs; }
    public ExtractionStats.Snapshot getStats() { return stats; }

    /** 해당 페이지의 HTTP 시도 횟수(이번 실행 대상이 아니었으면 0) */
    public int getAttemptCount(int pageNumber) {
        return attemptsByPage.getOrDefault(pageNumber, 0);
    }

    @Override public String toString() {
        return "ExtractionResult{book=" + bookId + ", tier=" + tier + ", status=" + status
                + ", total=" + pagesTotal + ", ok=" + pagesSucceeded + ", failed=" + failedPageNumbers
                + ", incomplete=" + incompletePageNumbers.size() + ", skipped=" + pagesSkipped
                + ", checkpoint=" + checkpoint + ", " + durationMs + "ms"
                + (fatalError == null ? "" : ", fatal=" + fatalError) + "}";
    }

    public static final class Builder {
        private String bookId;
        private TierKind tier;
        private Status status;
        private String fatalError;
        private int pagesTotal;
        private int pagesSucceeded;
        private int pagesSkipped;
        private List<Integer> failedPageNumbers = List.of();
        private List<Integer> incompletePageNumbers = List.of();
        private Map<Integer, Integer> attemptsByPage = Map.of();
        private int checkpoint;
        private long durationMs;
        private ExtractionStats.Snapshot stats;

        public Builder bookId(String v) { this.bookId = v; return this; }
        public Builder tier(TierKind v) { this.tier = v; return this; }
        public Builder status(Status v) { this.status = v; return this; }
        public Builder fatalError(String v) { this.fatalError = v; return this; }
        public Builder pagesTotal(int v) { this.pagesTotal = v; return this; }
        public Builder pagesSucceeded(int v) { this.pagesSucceeded = v; return this; }
        public Builder pagesSkipped(int v) { this.pagesSkipped = v; return this; }
        public Builder failedPageNumbers(List<Integer> v) { this.failedPageNumbers = v; return this; }
        public Builder incompletePageNumbers(List<Integer> v) { this.incompletePageNumbers = v; return this; }
        public Builder attemptsByPage(Map<Integer, Integer> v) { this.attemptsByPage = v; return this; }
        public Builder checkpoint(int v) { this.checkpoint = v; return this; }
        public Builder durationMs(long v) { this.durationMs = v; return this; }
        public Builder stats(ExtractionStats.Snapshot v) { this.stats = v; return this; }
        public ExtractionResult build() { return new ExtractionResult(this); }
    }
}
