package com.bookharvest.core.persist;

import com.bookharvest.core.api.IPageConsumer;
import com.bookharvest.core.api.IPageSink;
import com.bookharvest.core.model.ExtractedPage;
import com.bookharvest.core.model.ExtractionConfig;
import com.bookharvest.core.model.ExtractionStats;
import com.bookharvest.core.model.PageStatus;
import com.bookharvest.core.model.PageTask;
import com.bookharvest.core.model.ResumeCheckpoint;
import com.bookharvest.core.util.Sleeper;
import com.bookharvest.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 완료 페이지 버퍼 + 원자적 배치 커밋.
 *
 * - 버퍼가 batchSize에 닿으면 accept() 안에서(락을 쥔 채) 바로 flush → 다른 워커는 대기(역압)
 * - 커밋 성공: 페이지 PERSISTED, 체크포인트 전진
 * - 커밋 실패: rollback 후 persistRetries번 재시도, 그래도 실패면 배치를 버리고 PersistenceException
 *   (버려진 페이지는 PARSED로 남아 incomplete로 보고되고 체크포인트는 그대로)
 */
public final class BatchPersister implements IPageConsumer {

    private static final Logger LOG = LoggerFactory.getLogger(BatchPersister.class);

    private final String bookId;
    private final IPageSink sink;
    private final ResumeManager resume;
    private final int batchSize;
    private final int attemptsPerBatch;
    private final Duration retryDelay;
    private final Sleeper sleeper;
    private final ExtractionStats stats;
    private final StructuredLog slog;

    private final List<PageTask> tasks = new ArrayList<>();
    private final List<ExtractedPage> pages = new ArrayList<>();
    private PersistenceException fatal;

    public BatchPersister(IPageSink sink, ResumeManager resume, ExtractionConfig config,
                          Sleeper sleeper, ExtractionStats stats) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.resume = Objects.requireNonNull(resume, "resume");
        this.bookId = resume.bookId();
        this.batchSize = config.getBatchSize();
        this.attemptsPerBatch = config.getPersistRetries() + 1;
        this.retryDelay = config.getPersistRetryDelay();
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.slog = StructuredLog.get(BatchPersister.class).with("book", bookId);
    }

    @Override
    public synchronized void accept(PageTask task, ExtractedPage page) throws InterruptedException {
        if (fatal != null) throw fatal;
        if (task.getStatus() != PageStatus.PARSED) {
            throw new IllegalStateException("only PARSED pages can be buffered: " + task);
        }
        if (task.getPageNumber() != page.getPageNumber()) {
            throw new IllegalArgumentException("task/page mismatch: " + task + " vs " + page);
        }
        tasks.add(task);
        pages.add(page);
        if (pages.size() >= batchSize) flushLocked();
    }

    /** 남은 버퍼를 커밋(실행 종료/중지 시). */
    public synchronized void flush() throws InterruptedException {
        if (fatal != null) throw fatal;
        flushLocked();
    }

    public synchronized int buffered() { return pages.size(); }

    public synchronized boolean isFailed() { return fatal != null; }

    private void flushLocked() throws InterruptedException {
        if (pages.isEmpty()) return;
        List<Integer> numbers = new ArrayList<>(pages.size());
        for (ExtractedPage p : pages) numbers.add(p.getPageNumber());
        ResumeCheckpoint cp = resume.candidate(numbers);

        IOException last = null;
        for (int attempt = 1; attempt <= attemptsPerBatch; attempt++) {
            try {
                sink.beginBatch(bookId);
                for (ExtractedPage p : pages) sink.append(p);
                sink.commit(cp);
            } catch (IOException e) {
                last = e;
                sink.rollback();
                LOG.warn("Batch commit failed (attempt {}/{}): book={}, pages={}, cause={}",
                        attempt, attemptsPerBatch, bookId, numbers.size(), e.toString());
                slog.warn("batch-commit-failed", "attempt", attempt, "pages", numbers.size(), "cause", e.toString());
                if (attempt < attemptsPerBatch) sleeper.sleep(retryDelay);
                continue;
            }

            for (PageTask t : tasks) t.persisted();
            resume.committed(cp, numbers);
            stats.recordFlush(numbers.size());
            LOG.info("Batch committed: book={}, pages={}, checkpoint={}",
                    bookId, numbers.size(), cp.getHighestContiguousPersistedPage());
            slog.info("batch-committed", "pages", numbers.size(),
                    "first", numbers.get(0), "last", numbers.get(numbers.size() - 1),
                    "checkpoint", cp.getHighestContiguousPersistedPage());
            clear();
            return;
        }

        // 배치 폐기: 체크포인트는 마지막 성공 값 유지
        int dropped = numbers.size();
        clear();
        fatal = new PersistenceException("Batch of " + dropped + " pages for book " + bookId
                + " could not be committed after " + attemptsPerBatch + " attempts", last);
        slog.error("batch-aborted", last, "pages", dropped, "checkpoint", resume.current());
        throw fatal;
    }

    private void clear() {
        tasks.clear();
        pages.clear();
    }
}
