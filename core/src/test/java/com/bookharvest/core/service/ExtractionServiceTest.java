package com.bookharvest.core.service;

import com.bookharvest.core.extract.FallbackHtmlExtractor;
import com.bookharvest.core.http.HttpSession;
import com.bookharvest.core.model.Book;
import com.bookharvest.core.model.ExtractedPage;
import com.bookharvest.core.model.ExtractionConfig;
import com.bookharvest.core.model.ExtractionResult;
import com.bookharvest.core.model.TierKind;
import com.bookharvest.core.persist.FilePageSink;
import com.bookharvest.core.support.FixtureBookServer;
import com.bookharvest.core.support.FixturePages;
import com.bookharvest.core.support.InProcessShardLauncher;
import com.bookharvest.core.support.RecordingPageSink;
import com.bookharvest.core.support.TestSleeper;
import com.bookharvest.core.api.IPageSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.net.ServerSocket;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/** 가짜 책 서버를 상대로 한 끝-끝 추출 */
class ExtractionServiceTest {

    private static final int PAGES = 20;

    private FixtureBookServer server;
    private final TestSleeper sleeper = new TestSleeper();

    @BeforeEach
    void up() throws Exception {
        server = new FixtureBookServer("43", PAGES);
    }

    @AfterEach
    void down() {
        server.close();
    }

    private ExtractionConfig.Builder base() {
        return ExtractionConfig.builder()
                .sourceBaseUrl(server.baseUrl())
                .requestsPerSecond(1_000)
                .rateBurst(50)
                .baseRetryDelay(Duration.ofMillis(5))
                .rateLimitCooldown(Duration.ZERO)
                .requestTimeout(Duration.ofSeconds(5))
                .batchSize(4)
                .workerCount(3)
                .asyncConcurrency(4)
                .processCount(2)
                .minShardSize(1);
    }

    /** 20쪽짜리 책이 원하는 티어로 가도록 임계값을 맞춘다 */
    private ExtractionConfig forTier(TierKind kind) {
        switch (kind) {
            case SEQUENTIAL:    return base().forceSequential(true).build();
            case THREAD_POOL:   return base().threadThreshold(2).asyncThreshold(100).multiprocessThreshold(200).build();
            case ASYNC_IO:      return base().threadThreshold(2).asyncThreshold(3).multiprocessThreshold(100).build();
            case MULTI_PROCESS: return base().threadThreshold(2).asyncThreshold(3).multiprocessThreshold(4).build();
            default: throw new IllegalArgumentException(kind.name());
        }
    }

    private ExtractionService service(IPageSink sink) {
        return new ExtractionService(sink, HttpSession::new, FallbackHtmlExtractor::forConfig,
                InProcessShardLauncher.http(), sleeper, Clock.systemUTC());
    }

    private Book book() {
        return new Book("43", PAGES, server.baseUrl());
    }

    @ParameterizedTest
    @EnumSource(TierKind.class)
    @DisplayName("어느 티어든 같은 내용을 저장한다")
    void every_tier_persists_identical_pages(TierKind kind) throws Exception {
        RecordingPageSink sink = new RecordingPageSink();

        ExtractionResult r = service(sink).extract(book(), forTier(kind), null, null);

        assertEquals(kind, r.getTier());
        assertEquals(ExtractionResult.Status.COMPLETED, r.getStatus(), r.toString());
        assertEquals(PAGES, r.getPagesSucceeded());
        assertEquals(PAGES, r.getCheckpoint());
        assertThat(r.getFailedPageNumbers()).isEmpty();

        Map<Integer, ExtractedPage> pages = sink.pages();
        assertThat(pages).hasSize(PAGES);
        for (int p = 1; p <= PAGES; p++) {
            assertEquals(FixturePages.expectedText(p), pages.get(p).getText(), "page " + p);
        }
        // 페이지마다 정확히 한 번 요청
        assertEquals(PAGES, server.totalHits());
        // 한 배치 안에서 중복 없음, 배치 사이에도 중복 없음
        int committed = sink.batches().stream().mapToInt(List::size).sum();
        assertEquals(PAGES, committed);
    }

    @ParameterizedTest
    @EnumSource(TierKind.class)
    @DisplayName("일시 오류는 재시도, 404는 Missing으로 건너뛰고 계속")
    void transient_retried_and_missing_skipped(TierKind kind) throws Exception {
        server.script(5, 500, 500).script(7, 404);
        RecordingPageSink sink = new RecordingPageSink();

        ExtractionResult r = service(sink).extract(book(), forTier(kind), null, null);

        assertEquals(ExtractionResult.Status.COMPLETED, r.getStatus(), r.toString());
        assertEquals(3, r.getAttemptCount(5));
        assertEquals(3, server.hits(5));
        assertEquals(List.of(7), r.getFailedPageNumbers());
        assertEquals(PAGES - 1, r.getPagesSucceeded());
        assertThat(sink.pages().keySet()).contains(6, 8).doesNotContain(7);
        // 빠진 7쪽 때문에 체크포인트는 6에서 멈춘다
        assertEquals(6, r.getCheckpoint());
        assertEquals(6, sink.lastCheckpoint("43").getAsInt());
    }

    @Test
    void resume_fetches_only_pages_after_checkpoint() throws Exception {
        RecordingPageSink sink = new RecordingPageSink().withCheckpoint("43", 12);

        ExtractionResult r = service(sink).extract(book(), base().build(), null, null);

        for (int p = 1; p <= 12; p++) assertEquals(0, server.hits(p), "page " + p + " should be skipped");
        for (int p = 13; p <= PAGES; p++) assertEquals(1, server.hits(p), "page " + p);
        assertEquals(12, r.getPagesSkipped());
        assertEquals(8, r.getPagesSucceeded());
        assertEquals(PAGES, r.getCheckpoint());
        assertEquals(ExtractionResult.Status.COMPLETED, r.getStatus());
    }

    @Test
    void explicit_retry_pages_are_refetched_below_checkpoint() throws Exception {
        RecordingPageSink sink = new RecordingPageSink().withCheckpoint("43", 18);
        ExtractionConfig cfg = base().retryPages(Set.of(3, 9)).build();

        ExtractionResult r = service(sink).extract(book(), cfg, null, null);

        assertEquals(1, server.hits(3));
        assertEquals(1, server.hits(9));
        assertEquals(0, server.hits(10));
        assertEquals(4, r.getPagesSucceeded());
        assertThat(sink.pages().keySet()).containsExactly(3, 9, 19, 20);
        assertEquals(PAGES, r.getCheckpoint());
    }

    @Test
    void stop_before_start_leaves_everything_incomplete() throws Exception {
        RecordingPageSink sink = new RecordingPageSink();

        ExtractionResult r = service(sink).extract(book(), base().build(), null, new AtomicBoolean(true));

        assertEquals(ExtractionResult.Status.STOPPED, r.getStatus());
        assertEquals(PAGES, r.getIncompletePageNumbers().size());
        assertEquals(0, server.totalHits());
        assertThat(sink.batches()).isEmpty();
        assertEquals(0, r.getCheckpoint());
    }

    @Test
    @DisplayName("중지 요청 후에도 이미 파싱된 페이지는 flush된다")
    void stop_mid_run_flushes_parsed_pages() throws Exception {
        RecordingPageSink sink = new RecordingPageSink();
        AtomicBoolean stop = new AtomicBoolean(false);
        // batchSize보다 적게 받은 시점에 중지 → 남은 버퍼는 마지막 flush로
        ExtractionConfig cfg = base().forceSequential(true).batchSize(50).build();

        ExtractionResult r = service(sink).extract(book(), cfg, (id, phase, done, total) -> {
            if ("extract".equals(phase) && done >= 5) stop.set(true);
        }, stop);

        assertEquals(ExtractionResult.Status.STOPPED, r.getStatus());
        assertEquals(5, r.getPagesSucceeded());
        assertThat(sink.pages().keySet()).containsExactly(1, 2, 3, 4, 5);
        assertEquals(5, r.getCheckpoint());
        assertEquals(PAGES - 5, r.getIncompletePageNumbers().size());
    }

    @Test
    void persistence_failure_is_fatal_and_keeps_checkpoint() throws Exception {
        RecordingPageSink sink = new RecordingPageSink().failNextCommits(100);
        ExtractionConfig cfg = base().forceSequential(true).persistRetries(1).build();

        ExtractionResult r = service(sink).extract(book(), cfg, null, null);

        assertEquals(ExtractionResult.Status.FATAL, r.getStatus());
        assertThat(r.getFatalError()).contains("could not be committed");
        assertEquals(0, r.getCheckpoint());
        assertEquals(0, r.getPagesSucceeded());
        assertThat(r.getIncompletePageNumbers()).isNotEmpty();
        // 치명 오류 이후 더 이상 요청하지 않는다
        assertThat(server.totalHits()).isLessThan(PAGES);
    }

    @Test
    void total_connectivity_loss_is_fatal() throws Exception {
        int deadPort;
        try (ServerSocket s = new ServerSocket(0)) {
            deadPort = s.getLocalPort();
        }
        String deadBase = "http://127.0.0.1:" + deadPort;
        ExtractionConfig cfg = base().sourceBaseUrl(deadBase).forceSequential(true)
                .maxConsecutiveConnectionFailures(3).build();

        ExtractionResult r = service(new RecordingPageSink())
                .extract(new Book("43", PAGES, deadBase), cfg, null, null);

        assertEquals(ExtractionResult.Status.FATAL, r.getStatus());
        assertThat(r.getFatalError()).contains("connectivity");
        assertEquals(0, r.getPagesSucceeded());
    }

    @Test
    void resolves_page_count_from_first_page_and_reports_phases() throws Exception {
        RecordingPageSink sink = new RecordingPageSink();
        List<String> phases = new CopyOnWriteArrayList<>();

        ExtractionResult r = service(sink).extract("43", base().forceSequential(true).build(),
                (id, phase, done, total) -> {
                    if (phases.isEmpty() || !phases.get(phases.size() - 1).equals(phase)) phases.add(phase);
                }, new AtomicBoolean(false));

        assertEquals(PAGES, r.getPagesTotal());
        assertEquals(ExtractionResult.Status.COMPLETED, r.getStatus());
        assertEquals(List.of("resolve", "extract", "flush", "done"), phases);
        // 1쪽은 resolve 때 한 번, 추출 때 한 번
        assertEquals(2, server.hits(1));
    }

    @Test
    void second_run_over_file_sink_has_nothing_left_to_do(@TempDir Path dir) throws Exception {
        FilePageSink sink = new FilePageSink(dir, true);
        ExtractionConfig cfg = forTier(TierKind.ASYNC_IO);

        ExtractionResult first = service(sink).extract(book(), cfg, null, null);
        assertEquals(ExtractionResult.Status.COMPLETED, first.getStatus());
        assertEquals(PAGES, sink.readPages("43").size());
        assertEquals(5, sink.batchCount("43"));

        ExtractionResult second = service(sink).extract(book(), cfg, null, null);
        assertEquals(TierKind.SEQUENTIAL, second.getTier());
        assertEquals(ExtractionResult.Status.COMPLETED, second.getStatus());
        assertEquals(PAGES, second.getPagesSkipped());
        assertEquals(0, second.getPagesSucceeded());
        assertEquals(PAGES, server.totalHits());
    }

    @Test
    @DisplayName("스레드 풀 티어에서 10쪽, 배치 4 → 4,4,2로 flush, 체크포인트 10")
    void thread_pool_flushes_in_batches_of_four() throws Exception {
        try (FixtureBookServer small = new FixtureBookServer("43", 10)) {
            RecordingPageSink sink = new RecordingPageSink();
            ExtractionConfig cfg = base().sourceBaseUrl(small.baseUrl())
                    .threadThreshold(2).asyncThreshold(100).multiprocessThreshold(200)
                    .batchSize(4).build();

            ExtractionResult r = service(sink).extract(new Book("43", 10, small.baseUrl()), cfg, null, null);

            assertEquals(TierKind.THREAD_POOL, r.getTier());
            assertEquals(ExtractionResult.Status.COMPLETED, r.getStatus(), r.toString());
            assertEquals(List.of(4, 4, 2), sink.batchSizes());
            assertEquals(10, r.getCheckpoint());
            assertEquals(10, sink.lastCheckpoint("43").getAsInt());
        }
    }

    @Test
    @DisplayName("인터럽트되면 버퍼를 flush하고 인터럽트 상태를 되돌려 둔다")
    void interrupt_flushes_and_restores_interrupt_flag() throws Exception {
        server.script(2, 500);
        RecordingPageSink sink = new RecordingPageSink();
        // 재시도 대기에서 인터럽트
        ExtractionService svc = new ExtractionService(sink, HttpSession::new, FallbackHtmlExtractor::forConfig,
                InProcessShardLauncher.http(), d -> { throw new InterruptedException("test"); }, Clock.systemUTC());

        ExtractionResult r;
        boolean flagAfterReturn;
        try {
            r = svc.extract(book(), base().forceSequential(true).build(), null, null);
        } finally {
            flagAfterReturn = Thread.interrupted();
        }

        assertTrue(flagAfterReturn);
        assertEquals(ExtractionResult.Status.STOPPED, r.getStatus());
        assertThat(sink.pages().keySet()).containsExactly(1);
        assertEquals(1, r.getCheckpoint());
    }
}
