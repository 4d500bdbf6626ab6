package com.bookharvest.core.tier;

import com.bookharvest.core.model.PageTask;
import com.bookharvest.core.model.TierKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 고정 워커 풀 + 유한 큐(워커 수 ×2). 큐가 차면 제출 스레드가 put으로 대기(역압).
 * 파싱된 페이지는 BatchPersister가 flush하는 동안 워커를 붙잡아 두므로 메모리에 무한정 쌓이지 않는다.
 */
public final class ThreadPoolTier implements ExecutionTier {

    private static final Logger LOG = LoggerFactory.getLogger(ThreadPoolTier.class);

    @Override public TierKind kind() { return TierKind.THREAD_POOL; }

    @Override
    public void run(List<PageTask> tasks, TierContext ctx) throws InterruptedException {
        final int cc = Math.max(1, ctx.plan().workers());
        final PageProcessor processor = new PageProcessor(ctx);

        ExecutorService exec = new ThreadPoolExecutor(
                cc, cc,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(cc * 2),
                new NamedThreadFactory("page-worker"),
                (r, e) -> {
                    try { e.getQueue().put(r); }
                    catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RejectedExecutionException("Interrupted while enqueueing", ie);
                    }
                }
        );

        final List<Future<?>> futures = new ArrayList<>(tasks.size());
        final AtomicInteger inFlight = new AtomicInteger(0);
        try {
            for (PageTask task : tasks) {
                if (ctx.shouldStop()) break;
                futures.add(exec.submit(() -> {
                    if (ctx.shouldStop()) return null;
                    int cur = inFlight.incrementAndGet();
                    ctx.stats().observeConcurrency(cur);
                    try {
                        processor.processGuarded(task);
                    } finally {
                        inFlight.decrementAndGet();
                    }
                    return null;
                }));
            }

            for (Future<?> f : futures) {
                try {
                    f.get();
                } catch (ExecutionException e) {
                    Throwable cause = (e.getCause() != null ? e.getCause() : e);
                    if (cause instanceof InterruptedException) continue;   // 중지 중 버려진 요청
                    LOG.warn("Page worker failed: {}", cause.toString());
                    ctx.slog().error("task-failed", cause, "cause", cause.toString());
                    ctx.fatal("page worker failed: " + cause);
                }
            }
        } catch (RejectedExecutionException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedException("Interrupted while submitting pages");
        } finally {
            exec.shutdownNow();
            if (!exec.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Page workers did not terminate within 30s");
            }
        }
    }
}
