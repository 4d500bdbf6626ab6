package com.bookharvest.core.model;

import java.time.Instant;
import java.util.Objects;

/** 책별 재개 지점: 1..page 전부가 영속화된 최대 page. 0이면 아직 없음. */
public final class ResumeCheckpoint {
    private final String bookId;
    private final int highestContiguousPersistedPage;
    private final Instant timestamp;

    public ResumeCheckpoint(String bookId, int highestContiguousPersistedPage, Instant timestamp) {
        this.bookId = Objects.requireNonNull(bookId, "bookId");
        if (highestContiguousPersistedPage < 0) throw new IllegalArgumentException("checkpoint must be >= 0");
        this.highestContiguousPersistedPage = highestContiguousPersistedPage;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    public String getBookId() { return bookId; }
    public int getHighestContiguousPersistedPage() { return highestContiguousPersistedPage; }
    public Instant getTimestamp() { return timestamp; }

    @Override public String toString() {
        return "ResumeCheckpoint{" + bookId + "@" + highestContiguousPersistedPage + ", " + timestamp + "}";
    }
}
