package com.bookharvest.core.persist;

import com.bookharvest.core.api.IPageSink;
import com.bookharvest.core.model.ResumeCheckpoint;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * 책별 체크포인트의 유일한 소유자.
 * 체크포인트 = 1..k가 전부 영속화된 최대 k (연속 접두사). 순서 없이 끝난 페이지가
 * 빈칸을 건너뛰어 체크포인트를 올리는 일은 없다. 실행 중에도 재시작 후에도 감소하지 않는다.
 */
public final class ResumeManager {

    private final IPageSink sink;
    private final String bookId;
    private final Clock clock;

    private int checkpoint;
    private final TreeSet<Integer> persistedAbove = new TreeSet<>(); // checkpoint보다 큰 영속 페이지

    public ResumeManager(IPageSink sink, String bookId, Clock clock) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.bookId = Objects.requireNonNull(bookId, "bookId");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** 저장소에서 마지막 체크포인트를 읽는다(없으면 0). */
    public synchronized int load() throws IOException {
        int stored = sink.lastCheckpoint(bookId).orElse(0);
        checkpoint = Math.max(checkpoint, stored);
        persistedAbove.headSet(checkpoint, true).clear();
        return checkpoint;
    }

    /**
     * 이번 실행에서 추출할 페이지(오름차순): 체크포인트 이후 전부 + 호출자가 명시한 재시도 페이지.
     */
    public synchronized List<Integer> pagesToExtract(int totalPages, Set<Integer> retryPages) {
        TreeSet<Integer> pages = new TreeSet<>();
        for (Integer p : retryPages) {
            if (p != null && p >= 1 && p <= totalPages) pages.add(p);
        }
        for (int p = checkpoint + 1; p <= totalPages; p++) pages.add(p);
        return new ArrayList<>(pages);
    }

    /** pages가 커밋된다면 도달할 체크포인트(상태는 바꾸지 않음). */
    public synchronized ResumeCheckpoint candidate(Collection<Integer> pages) {
        TreeSet<Integer> all = new TreeSet<>(persistedAbove);
        all.addAll(pages);
        int k = checkpoint;
        while (all.contains(k + 1)) k++;
        return new ResumeCheckpoint(bookId, k, clock.instant());
    }

    /** 커밋 성공 후에만 호출. */
    public synchronized void committed(ResumeCheckpoint cp, Collection<Integer> pages) {
        for (Integer p : pages) {
            if (p > checkpoint) persistedAbove.add(p);
        }
        if (cp.getHighestContiguousPersistedPage() > checkpoint) {
            checkpoint = cp.getHighestContiguousPersistedPage();
        }
        persistedAbove.headSet(checkpoint, true).clear();
    }

    public synchronized int current() { return checkpoint; }

    public String bookId() { return bookId; }
}
