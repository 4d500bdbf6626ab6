package com.bookharvest.core.persist;

import com.bookharvest.core.model.ExtractedPage;
import com.bookharvest.core.model.ExtractionConfig;
import com.bookharvest.core.model.ExtractionStats;
import com.bookharvest.core.model.PageMetadata;
import com.bookharvest.core.model.PageStatus;
import com.bookharvest.core.model.PageTask;
import com.bookharvest.core.support.RecordingPageSink;
import com.bookharvest.core.support.TestSleeper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class BatchPersisterTest {

    private final TestSleeper sleeper = new TestSleeper();
    private final ExtractionStats stats = new ExtractionStats();

    private static ExtractionConfig cfg(int batchSize, int persistRetries) {
        return ExtractionConfig.builder()
                .batchSize(batchSize)
                .persistRetries(persistRetries)
                .persistRetryDelay(Duration.ofMillis(250))
                .build();
    }

    private static PageTask parsedTask(int n) {
        PageTask t = new PageTask(n);
        t.startFetch();
        t.fetched();
        t.startParse();
        t.parsed();
        return t;
    }

    private static ExtractedPage page(int n) {
        String text = "page " + n;
        return new ExtractedPage(n, text, new PageMetadata("jsoup", "div.nass", 2, text.length(), null));
    }

    private BatchPersister persister(RecordingPageSink sink, ExtractionConfig cfg) {
        ResumeManager rm = new ResumeManager(sink, "43", Clock.systemUTC());
        return new BatchPersister(sink, rm, cfg, sleeper, stats);
    }

    @Test
    @DisplayName("batchSize 4로 10쪽 → 4, 4, 2 배치")
    void flushesFullBatchesAndRemainder() throws Exception {
        RecordingPageSink sink = new RecordingPageSink();
        BatchPersister bp = persister(sink, cfg(4, 0));
        List<PageTask> tasks = new ArrayList<>();
        for (int n = 1; n <= 10; n++) {
            PageTask t = parsedTask(n);
            tasks.add(t);
            bp.accept(t, page(n));
        }
        assertThat(sink.batchSizes()).containsExactly(4, 4);
        assertEquals(2, bp.buffered());

        bp.flush();

        assertThat(sink.batchSizes()).containsExactly(4, 4, 2);
        assertThat(sink.pages()).hasSize(10);
        assertThat(tasks).allMatch(t -> t.getStatus() == PageStatus.PERSISTED);
        assertEquals(10, sink.lastCheckpoint("43").getAsInt());
        assertThat(sink.commits()).extracting(c -> c.getHighestContiguousPersistedPage()).containsExactly(4, 8, 10);
    }

    @Test
    void out_of_order_pages_commit_but_checkpoint_waits_for_gap() throws Exception {
        RecordingPageSink sink = new RecordingPageSink();
        BatchPersister bp = persister(sink, cfg(3, 0));
        bp.accept(parsedTask(1), page(1));
        bp.accept(parsedTask(3), page(3));
        bp.accept(parsedTask(4), page(4));

        assertThat(sink.pages().keySet()).containsExactly(1, 3, 4);
        assertEquals(1, sink.lastCheckpoint("43").getAsInt());

        bp.accept(parsedTask(2), page(2));
        bp.flush();
        assertEquals(4, sink.lastCheckpoint("43").getAsInt());
    }

    @Test
    @DisplayName("커밋 실패 후 재시도 성공: rollback 기록, 지연은 persistRetryDelay")
    void retriesFailedCommit() throws Exception {
        RecordingPageSink sink = new RecordingPageSink().failNextCommits(2);
        BatchPersister bp = persister(sink, cfg(2, 3));
        PageTask t1 = parsedTask(1), t2 = parsedTask(2);
        bp.accept(t1, page(1));
        bp.accept(t2, page(2));

        assertEquals(3, sink.commitCalls());
        assertEquals(2, sink.rollbacks());
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofMillis(250), Duration.ofMillis(250));
        assertThat(sink.batches()).containsExactly(List.of(1, 2));
        assertEquals(PageStatus.PERSISTED, t1.getStatus());
        assertFalse(bp.isFailed());
    }

    @Test
    @DisplayName("재시도 소진 → PersistenceException, 체크포인트 유지, 페이지는 PARSED")
    void exhaustedCommitIsFatal() throws Exception {
        RecordingPageSink sink = new RecordingPageSink();
        BatchPersister bp = persister(sink, cfg(2, 1));
        bp.accept(parsedTask(1), page(1));
        bp.accept(parsedTask(2), page(2));
        assertEquals(2, sink.lastCheckpoint("43").getAsInt());

        sink.failNextCommits(5);
        PageTask t3 = parsedTask(3), t4 = parsedTask(4);
        bp.accept(t3, page(3));
        PersistenceException e = assertThrows(PersistenceException.class, () -> bp.accept(t4, page(4)));

        assertThat(e).hasMessageContaining("2 attempts").hasCauseInstanceOf(java.io.IOException.class);
        assertTrue(bp.isFailed());
        assertEquals(0, bp.buffered());
        assertEquals(2, sink.lastCheckpoint("43").getAsInt());
        assertEquals(PageStatus.PARSED, t3.getStatus());
        assertEquals(PageStatus.PARSED, t4.getStatus());
        assertEquals(2, sink.rollbacks());

        // 이후 호출도 같은 예외
        assertThrows(PersistenceException.class, bp::flush);
        assertThrows(PersistenceException.class, () -> bp.accept(parsedTask(5), page(5)));
    }

    @Test
    void rejects_pages_that_are_not_parsed() {
        BatchPersister bp = persister(new RecordingPageSink(), cfg(2, 0));
        PageTask fetching = new PageTask(1);
        fetching.startFetch();
        assertThrows(IllegalStateException.class, () -> bp.accept(fetching, page(1)));
        assertThrows(IllegalArgumentException.class, () -> bp.accept(parsedTask(2), page(3)));
    }

    @Test
    void concurrent_producers_never_lose_or_duplicate_pages() throws Exception {
        RecordingPageSink sink = new RecordingPageSink();
        BatchPersister bp = persister(sink, cfg(7, 0));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<?>> fs = new ArrayList<>();
        for (int n = 1; n <= 200; n++) {
            final int page = n;
            fs.add(pool.submit(() -> { bp.accept(parsedTask(page), page(page)); return null; }));
        }
        for (Future<?> f : fs) f.get();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        bp.flush();

        assertThat(sink.pages()).hasSize(200);
        int committed = sink.batches().stream().mapToInt(List::size).sum();
        assertEquals(200, committed);
        assertEquals(200, sink.lastCheckpoint("43").getAsInt());
        assertEquals(200, stats.snapshot().pagesFlushed);
    }
}
