package com.bookharvest.core.tier;

import com.bookharvest.core.api.IHtmlExtractor;
import com.bookharvest.core.api.IHttpSession;
import com.bookharvest.core.api.IPageConsumer;
import com.bookharvest.core.http.ConnectivityMonitor;
import com.bookharvest.core.http.RetryPolicy;
import com.bookharvest.core.model.Book;
import com.bookharvest.core.model.ExtractionConfig;
import com.bookharvest.core.model.ExtractionStats;
import com.bookharvest.core.model.PageTask;
import com.bookharvest.core.util.ProgressListener;
import com.bookharvest.core.util.RateLimiter;
import com.bookharvest.core.util.Sleeper;
import com.bookharvest.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 한 번의 실행에서 티어가 공유하는 협력자 묶음 + 중지/치명 오류 신호.
 * 설정과 Book은 읽기 전용. RateLimiter 상태는 acquire/reserve로만 건드린다.
 */
public final class TierContext {

    private static final Logger LOG = LoggerFactory.getLogger(TierContext.class);

    private final Book book;
    private final ExtractionConfig config;
    private final TierPlan plan;
    private final IHttpSession session;
    private final IHtmlExtractor extractor;
    private final RateLimiter limiter;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final IPageConsumer consumer;
    private final ExtractionStats stats;
    private final ConnectivityMonitor monitor;
    private final ProgressListener progress;
    private final AtomicBoolean stop;
    private final StructuredLog slog;
    private final SortedMap<Integer, PageTask> tasks;

    private final AtomicReference<String> fatalReason = new AtomicReference<>();
    private final AtomicInteger resolved = new AtomicInteger(0);

    private TierContext(Builder b) {
        this.book = Objects.requireNonNull(b.book, "book");
        this.config = Objects.requireNonNull(b.config, "config");
        this.plan = Objects.requireNonNull(b.plan, "plan");
        this.session = b.session;   // MultiProcess 부모 쪽은 세션을 쓰지 않는다
        this.extractor = b.extractor;
        this.limiter = Objects.requireNonNull(b.limiter, "limiter");
        this.retryPolicy = Objects.requireNonNull(b.retryPolicy, "retryPolicy");
        this.sleeper = Objects.requireNonNull(b.sleeper, "sleeper");
        this.consumer = Objects.requireNonNull(b.consumer, "consumer");
        this.stats = Objects.requireNonNull(b.stats, "stats");
        this.monitor = Objects.requireNonNull(b.monitor, "monitor");
        this.progress = b.progress == null ? ProgressListener.NONE : b.progress;
        this.stop = b.stop == null ? new AtomicBoolean(false) : b.stop;
        this.slog = b.slog == null ? StructuredLog.get(TierContext.class).with("book", book.getId()) : b.slog;
        TreeMap<Integer, PageTask> byPage = new TreeMap<>();
        for (PageTask t : b.tasks) byPage.put(t.getPageNumber(), t);
        this.tasks = Collections.unmodifiableSortedMap(byPage);
    }

    public static Builder builder() { return new Builder(); }

    public Book book() { return book; }
    public ExtractionConfig config() { return config; }
    public TierPlan plan() { return plan; }
    public IHttpSession session() { return session; }
    public IHtmlExtractor extractor() { return extractor; }
    public RateLimiter limiter() { return limiter; }
    public RetryPolicy retryPolicy() { return retryPolicy; }
    public Sleeper sleeper() { return sleeper; }
    public IPageConsumer consumer() { return consumer; }
    public ExtractionStats stats() { return stats; }
    public ConnectivityMonitor monitor() { return monitor; }
    public StructuredLog slog() { return slog; }

    /** 페이지 번호 → 이번 실행의 PageTask */
    public SortedMap<Integer, PageTask> tasks() { return tasks; }

    public boolean shouldStop() {
        return stop.get() || Thread.currentThread().isInterrupted();
    }

    public void requestStop() { stop.set(true); }

    /** 실행 치명 오류. 첫 사유만 남기고 중지 신호를 켠다. */
    public void fatal(String reason) {
        if (fatalReason.compareAndSet(null, reason)) {
            LOG.error("Run for book {} is fatal: {}", book.getId(), reason);
            slog.warn("run-fatal", "reason", reason);
        }
        stop.set(true);
    }

    public void fatal(RuntimeException e) {
        fatal(e.getMessage() == null ? e.toString() : e.getMessage());
    }

    /** @return 치명 사유, 없으면 null */
    public String fatalReason() { return fatalReason.get(); }

    /** 페이지가 이번 실행에서 결론(PARSED 전달 또는 FAILED)에 도달 */
    public void pageResolved() {
        int done = resolved.incrementAndGet();
        try {
            progress.onProgress(book.getId(), "extract", done, tasks.size());
        } catch (RuntimeException e) {
            LOG.debug("Progress listener threw: {}", e.toString());
        }
    }

    public static final class Builder {
        private Book book;
        private ExtractionConfig config;
        private TierPlan plan;
        private IHttpSession session;
        private IHtmlExtractor extractor;
        private RateLimiter limiter;
        private RetryPolicy retryPolicy;
        private Sleeper sleeper;
        private IPageConsumer consumer;
        private ExtractionStats stats = new ExtractionStats();
        private ConnectivityMonitor monitor;
        private ProgressListener progress;
        private AtomicBoolean stop;
        private StructuredLog slog;
        private List<PageTask> tasks = List.of();

        public Builder book(Book v) { this.book = v; return this; }
        public Builder config(ExtractionConfig v) { this.config = v; return this; }
        public Builder plan(TierPlan v) { this.plan = v; return this; }
        public Builder session(IHttpSession v) { this.session = v; return this; }
        public Builder extractor(IHtmlExtractor v) { this.extractor = v; return this; }
        public Builder limiter(RateLimiter v) { this.limiter = v; return this; }
        public Builder retryPolicy(RetryPolicy v) { this.retryPolicy = v; return this; }
        public Builder sleeper(Sleeper v) { this.sleeper = v; return this; }
        public Builder consumer(IPageConsumer v) { this.consumer = v; return this; }
        public Builder stats(ExtractionStats v) { this.stats = v; return this; }
        public Builder monitor(ConnectivityMonitor v) { this.monitor = v; return this; }
        public Builder progress(ProgressListener v) { this.progress = v; return this; }
        public Builder stop(AtomicBoolean v) { this.stop = v; return this; }
        public Builder slog(StructuredLog v) { this.slog = v; return this; }
        public Builder tasks(List<PageTask> v) { this.tasks = v; return this; }

        public TierContext build() {
            if (monitor == null && config != null) {
                monitor = new ConnectivityMonitor(config.getMaxConsecutiveConnectionFailures());
            }
            return new TierContext(this);
        }
    }
}
