package com.bookharvest.core.service;

import com.bookharvest.core.api.IHtmlExtractor;
import com.bookharvest.core.api.IHttpSession;
import com.bookharvest.core.api.IPageSink;
import com.bookharvest.core.extract.BookResolver;
import com.bookharvest.core.extract.FallbackHtmlExtractor;
import com.bookharvest.core.http.DefaultRetryPolicy;
import com.bookharvest.core.http.HttpSession;
import com.bookharvest.core.http.RetryPolicy;
import com.bookharvest.core.model.Book;
import com.bookharvest.core.model.ExtractionConfig;
import com.bookharvest.core.model.ExtractionResult;
import com.bookharvest.core.model.ExtractionStats;
import com.bookharvest.core.model.PageStatus;
import com.bookharvest.core.model.PageTask;
import com.bookharvest.core.model.TierKind;
import com.bookharvest.core.persist.BatchPersister;
import com.bookharvest.core.persist.PersistenceException;
import com.bookharvest.core.persist.ResumeManager;
import com.bookharvest.core.tier.AsyncTier;
import com.bookharvest.core.tier.ExecutionTier;
import com.bookharvest.core.tier.MultiProcessTier;
import com.bookharvest.core.tier.SequentialTier;
import com.bookharvest.core.tier.StrategySelector;
import com.bookharvest.core.tier.ThreadPoolTier;
import com.bookharvest.core.tier.TierContext;
import com.bookharvest.core.tier.TierPlan;
import com.bookharvest.core.tier.multiprocess.ProcessShardLauncher;
import com.bookharvest.core.tier.multiprocess.ShardWorkerLauncher;
import com.bookharvest.core.util.DefaultSleeper;
import com.bookharvest.core.util.ProgressListener;
import com.bookharvest.core.util.RateLimiter;
import com.bookharvest.core.util.Sleeper;
import com.bookharvest.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * 추출 오케스트레이터:
 *  - 체크포인트 로드 → 대상 페이지 시드 → 티어 선택 → 티어 실행 → 마지막 flush → 요약
 *  - 기본 구현체(HttpSession/FallbackHtmlExtractor/자식 JVM 워커)
 *  - DI 생성자는 테스트/플러그인 주입용
 *
 * 페이지 단위 실패는 책 전체를 멈추지 않는다. 치명적인 것은 영속화 실패와 연결 완전 상실뿐이다.
 * 재시작 한도를 넘긴 샤드의 페이지는 incomplete로 남는다.
 */
public final class ExtractionService {

    private static final Logger LOG = LoggerFactory.getLogger(ExtractionService.class);
    private static final StructuredLog SLOG = StructuredLog.get(ExtractionService.class);

    private final IPageSink sink;
    private final Function<ExtractionConfig, IHttpSession> sessionFactory;
    private final Function<ExtractionConfig, IHtmlExtractor> extractorFactory;
    private final ShardWorkerLauncher launcher;
    private final Sleeper sleeper;
    private final Clock clock;

    /** 기본 구현 */
    public ExtractionService(IPageSink sink) {
        this(sink, HttpSession::new, FallbackHtmlExtractor::forConfig, new ProcessShardLauncher(),
                DefaultSleeper.INSTANCE, Clock.systemUTC());
    }

    /** DI/테스트용 */
    public ExtractionService(IPageSink sink,
                             Function<ExtractionConfig, IHttpSession> sessionFactory,
                             Function<ExtractionConfig, IHtmlExtractor> extractorFactory,
                             ShardWorkerLauncher launcher,
                             Sleeper sleeper,
                             Clock clock) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory");
        this.extractorFactory = Objects.requireNonNull(extractorFactory, "extractorFactory");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /* =========================
       실행 API
       ========================= */

    /** 책 ID만으로: 1쪽을 받아 전체 쪽수를 알아낸 뒤 추출. */
    public ExtractionResult extract(String bookId, ExtractionConfig config) throws IOException, InterruptedException {
        return extract(bookId, config, ProgressListener.NONE, new AtomicBoolean(false));
    }

    public ExtractionResult extract(String bookId, ExtractionConfig config,
                                    ProgressListener listener, AtomicBoolean stop) throws IOException, InterruptedException {
        Objects.requireNonNull(config, "config");
        ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        Book book;
        try (IHttpSession session = sessionFactory.apply(config)) {
            book = new BookResolver(session, DefaultRetryPolicy.from(config), sleeper)
                    .resolve(bookId, config.getSourceBaseUrl());
        }
        pl.onProgress(book.getId(), "resolve", 0, book.getTotalPages());
        return extract(book, config, pl, stop);
    }

    /** 이미 알고 있는 Book으로 추출. stop이 켜지면 진행 중 배치까지 flush하고 돌아온다. */
    public ExtractionResult extract(Book book, ExtractionConfig config,
                                    ProgressListener listener, AtomicBoolean stop) throws IOException, InterruptedException {
        Objects.requireNonNull(book, "book");
        Objects.requireNonNull(config, "config");
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final AtomicBoolean stopFlag = (stop != null) ? stop : new AtomicBoolean(false);
        final StructuredLog slog = SLOG.with("book", book.getId());
        final long t0 = System.nanoTime();

        // ---- 0) 재개 지점 ----
        ResumeManager resume = new ResumeManager(sink, book.getId(), clock);
        int startCheckpoint = resume.load();
        List<Integer> pages = resume.pagesToExtract(book.getTotalPages(), config.getRetryPages());
        int skipped = book.getTotalPages() - pages.size();

        List<PageTask> tasks = new ArrayList<>(pages.size());
        for (int p : pages) tasks.add(new PageTask(p));

        // ---- 1) 티어 선택 ----
        TierPlan plan = StrategySelector.select(pages, config);
        LOG.info("Extract start: book={}, pages={}, checkpoint={}, toExtract={}, tier={}",
                book.getId(), book.getTotalPages(), startCheckpoint, pages.size(), plan);
        slog.info("extract-start",
                "totalPages", book.getTotalPages(),
                "checkpoint", startCheckpoint,
                "toExtract", pages.size(),
                "rps", config.getRequestsPerSecond());
        slog.info("tier-selected", "tier", plan.kind().name(), "workers", plan.workers(),
                "shards", plan.shards().size());

        ExtractionStats stats = new ExtractionStats();
        BatchPersister persister = new BatchPersister(sink, resume, config, sleeper, stats);
        String fatal = null;
        boolean interrupted = false;

        // ---- 2) 실행 ----
        try (IHttpSession session = plan.kind() == TierKind.MULTI_PROCESS ? null : sessionFactory.apply(config)) {
            TierContext ctx = TierContext.builder()
                    .book(book)
                    .config(config)
                    .plan(plan)
                    .session(session)
                    .extractor(extractorFactory.apply(config))
                    .limiter(new RateLimiter(config.getRequestsPerSecond(), config.getRateBurst()))
                    .retryPolicy(DefaultRetryPolicy.from(config))
                    .sleeper(sleeper)
                    .consumer(persister)
                    .stats(stats)
                    .progress(pl)
                    .stop(stopFlag)
                    .slog(slog)
                    .tasks(tasks)
                    .build();

            pl.onProgress(book.getId(), "extract", 0, tasks.size());
            try {
                tierFor(plan.kind()).run(tasks, ctx);
            } catch (InterruptedException ie) {
                // 호출 스레드 인터럽트 = 외부 중지. 버퍼는 아래에서 flush.
                LOG.warn("Extraction of book {} interrupted", book.getId());
                stopFlag.set(true);
                Thread.interrupted();
                interrupted = true;
            }
            fatal = ctx.fatalReason();
        }

        // ---- 3) 마지막 flush (치명 오류가 아니면 중지여도) ----
        if (!persister.isFailed()) {
            pl.onProgress(book.getId(), "flush", persister.buffered(), tasks.size());
            try {
                persister.flush();
            } catch (PersistenceException e) {
                fatal = (fatal != null) ? fatal : e.getMessage();
            }
        }

        // ---- 4) 요약 ----
        ExtractionResult result = summarize(book, plan, tasks, skipped, resume.current(), stats, stopFlag.get(), fatal, t0);
        pl.onProgress(book.getId(), "done", result.getPagesSucceeded() + result.getPagesFailed(), tasks.size());

        LOG.info("Extract done: {}", result);
        slog.info("extract-done",
                "status", result.getStatus().name(),
                "succeeded", result.getPagesSucceeded(),
                "failed", result.getPagesFailed(),
                "incomplete", result.getIncompletePageNumbers().size(),
                "skipped", result.getPagesSkipped(),
                "checkpoint", result.getCheckpoint(),
                "durationMs", result.getDurationMs(),
                "requests", result.getStats().requestsTotal,
                "retries", result.getStats().retriesTotal,
                "maxObservedCC", result.getStats().maxObservedConcurrency);
        // flush가 끝났으니 호출자의 인터럽트 상태를 되돌린다
        if (interrupted) Thread.currentThread().interrupt();
        return result;
    }

    /* =========================
       내부
       ========================= */

    private ExecutionTier tierFor(TierKind kind) {
        switch (kind) {
            case SEQUENTIAL:  return new SequentialTier();
            case THREAD_POOL: return new ThreadPoolTier();
            case ASYNC_IO:    return new AsyncTier();
            case MULTI_PROCESS: return new MultiProcessTier(launcher);
            default: throw new IllegalArgumentException("unknown tier " + kind);
        }
    }

    private static ExtractionResult summarize(Book book, TierPlan plan, List<PageTask> tasks, int skipped,
                                              int checkpoint, ExtractionStats stats, boolean stopped,
                                              String fatal, long t0) {
        int ok = 0;
        List<Integer> failed = new ArrayList<>();
        List<Integer> incomplete = new ArrayList<>();
        Map<Integer, Integer> attempts = new HashMap<>();
        for (PageTask t : tasks) {
            attempts.put(t.getPageNumber(), t.getAttemptCount());
            PageStatus s = t.getStatus();
            if (s == PageStatus.PERSISTED) ok++;
            else if (s == PageStatus.FAILED) failed.add(t.getPageNumber());
            else incomplete.add(t.getPageNumber());   // PENDING/FETCHING/.../PARSED(미커밋)
        }

        ExtractionResult.Status status;
        if (fatal != null) status = ExtractionResult.Status.FATAL;
        else if (incomplete.isEmpty()) status = ExtractionResult.Status.COMPLETED;
        else status = ExtractionResult.Status.STOPPED;
        if (status == ExtractionResult.Status.STOPPED && !stopped) {
            LOG.warn("Book {} ended with {} incomplete pages without a stop request", book.getId(), incomplete.size());
        }

        return ExtractionResult.builder()
                .bookId(book.getId())
                .tier(plan.kind())
                .status(status)
                .fatalError(fatal)
                .pagesTotal(book.getTotalPages())
                .pagesSucceeded(ok)
                .pagesSkipped(skipped)
                .failedPageNumbers(failed)
                .incompletePageNumbers(incomplete)
                .attemptsByPage(attempts)
                .checkpoint(checkpoint)
                .durationMs((System.nanoTime() - t0) / 1_000_000)
                .stats(stats.snapshot())
                .build();
    }
}
