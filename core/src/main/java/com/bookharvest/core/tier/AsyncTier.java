package com.bookharvest.core.tier;

import com.bookharvest.core.model.FetchOutcome;
import com.bookharvest.core.model.PageTask;
import com.bookharvest.core.model.TierKind;
import com.bookharvest.core.persist.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 단일 스레드 이벤트 루프. 동시에 최대 workers개의 요청을 띄워 두고,
 * 응답 콜백/백오프 타이머/레이트리미터 대기를 모두 같은 루프 스레드에서 처리한다.
 * 완료 순서는 보장하지 않는다.
 */
public final class AsyncTier implements ExecutionTier {

    private static final Logger LOG = LoggerFactory.getLogger(AsyncTier.class);

    @Override public TierKind kind() { return TierKind.ASYNC_IO; }

    @Override
    public void run(List<PageTask> tasks, TierContext ctx) throws InterruptedException {
        ScheduledExecutorService loop = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("async-loop"));
        EventLoop el = new EventLoop(tasks, ctx, loop);
        try {
            loop.execute(el::pump);
            el.done.get();
        } catch (ExecutionException e) {
            Throwable cause = (e.getCause() != null ? e.getCause() : e);
            LOG.error("Async loop failed", cause);
            ctx.fatal("async loop failed: " + cause);
        } finally {
            loop.shutdownNow();
            if (!loop.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Async loop did not terminate within 30s");
            }
        }
    }

    /** 루프 스레드 전용 상태. 필드는 루프 스레드에서만 읽고 쓴다. */
    private static final class EventLoop {
        private final TierContext ctx;
        private final ScheduledExecutorService loop;
        private final PageProcessor processor;
        private final ArrayDeque<PageTask> queue;
        private final int limit;
        private final CompletableFuture<Void> done = new CompletableFuture<>();
        private int inFlight;

        EventLoop(List<PageTask> tasks, TierContext ctx, ScheduledExecutorService loop) {
            this.ctx = ctx;
            this.loop = loop;
            this.processor = new PageProcessor(ctx);
            this.queue = new ArrayDeque<>(tasks);
            this.limit = Math.max(1, ctx.plan().workers());
        }

        void pump() {
            guard(() -> {
                while (!ctx.shouldStop() && inFlight < limit && !queue.isEmpty()) {
                    PageTask t = queue.poll();
                    inFlight++;
                    ctx.stats().observeConcurrency(inFlight);
                    reserveThenSend(t);
                }
                if (inFlight == 0 && (queue.isEmpty() || ctx.shouldStop())) done.complete(null);
            });
        }

        /** 레이트리미터 대기도 블로킹 대신 타이머로 */
        private void reserveThenSend(PageTask t) {
            long waitNs = ctx.limiter().reserve();
            if (waitNs > 0) loop.schedule(() -> guard(() -> send(t)), waitNs, TimeUnit.NANOSECONDS);
            else send(t);
        }

        private void send(PageTask t) {
            if (ctx.shouldStop()) { release(); return; }
            URI uri = ctx.book().pageUri(t.getPageNumber());
            t.startFetch();
            ctx.session().fetchAsync(uri)
                    .whenCompleteAsync((o, err) -> guard(() -> onFetched(t, uri, o, err)), loop);
        }

        private void onFetched(PageTask t, URI uri, FetchOutcome o, Throwable err) {
            FetchOutcome outcome = (err == null) ? o : failure(uri, err);
            try {
                switch (processor.afterFetch(t, outcome)) {
                    case PARSE:
                        processor.parseAndEmit(t, outcome.getBody());
                        release();
                        break;
                    case RETRY:
                        Duration d = processor.retryDelay(t, outcome);
                        loop.schedule(() -> guard(() -> reserveThenSend(t)), d.toNanos(), TimeUnit.NANOSECONDS);
                        break;
                    default:
                        release();
                }
            } catch (PersistenceException e) {
                ctx.fatal(e);
                release();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                ctx.requestStop();
                release();
            }
        }

        private void release() {
            inFlight--;
            pump();
        }

        private void guard(Runnable r) {
            try {
                r.run();
            } catch (RuntimeException e) {
                done.completeExceptionally(e);
            }
        }

        private static FetchOutcome failure(URI uri, Throwable err) {
            Throwable cause = (err instanceof CompletionException && err.getCause() != null) ? err.getCause() : err;
            return FetchOutcome.builder()
                    .url(uri)
                    .kind(FetchOutcome.Kind.TRANSIENT)
                    .statusCode(-1)
                    .error(cause.toString())
                    .build();
        }
    }
}
