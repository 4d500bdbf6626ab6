package com.bookharvest.core.tier.multiprocess;

import com.bookharvest.core.api.IHtmlExtractor;
import com.bookharvest.core.api.IHttpSession;
import com.bookharvest.core.api.IPageConsumer;
import com.bookharvest.core.extract.FallbackHtmlExtractor;
import com.bookharvest.core.http.DefaultRetryPolicy;
import com.bookharvest.core.model.ExtractionConfig;
import com.bookharvest.core.model.PageStatus;
import com.bookharvest.core.model.PageTask;
import com.bookharvest.core.model.TierKind;
import com.bookharvest.core.tier.ExecutionTier;
import com.bookharvest.core.tier.SequentialTier;
import com.bookharvest.core.tier.ThreadPoolTier;
import com.bookharvest.core.tier.TierContext;
import com.bookharvest.core.tier.TierPlan;
import com.bookharvest.core.util.DefaultSleeper;
import com.bookharvest.core.util.RateLimiter;
import com.bookharvest.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 샤드 하나를 자체 세션/리미터/파서로 처리하고 결과를 메시지로 흘려보낸다.
 * 워커 쪽 PageTask는 PARSED에서 멈춘다. 영속화는 부모 몫.
 * 순서: PAGE* (완료되는 대로) → FAILED* → DONE
 */
public final class ShardWorker {

    private static final Logger LOG = LoggerFactory.getLogger(ShardWorker.class);

    private final ShardAssignment assignment;
    private final IHttpSession session;
    private final Writer out;

    public ShardWorker(ShardAssignment assignment, IHttpSession session, Writer out) {
        this.assignment = Objects.requireNonNull(assignment, "assignment");
        this.session = Objects.requireNonNull(session, "session");
        this.out = Objects.requireNonNull(out, "out");
    }

    /** @return 프로세스 종료 코드(정상 0) */
    public int run() throws IOException, InterruptedException {
        ExtractionConfig cfg = assignment.toConfig();
        int shard = assignment.shardIndex();

        List<PageTask> tasks = new ArrayList<>();
        for (int p : assignment.pageList()) tasks.add(new PageTask(p));

        IPageConsumer emitter = (task, page) -> send(ShardMessage.page(shard, page, task.getAttemptCount()));
        IHtmlExtractor extractor = FallbackHtmlExtractor.forConfig(cfg);

        boolean pooled = cfg.getWorkerCount() > 1 && tasks.size() > 1;
        ExecutionTier tier = pooled ? new ThreadPoolTier() : new SequentialTier();
        TierPlan plan = pooled
                ? TierPlan.of(TierKind.THREAD_POOL, Math.min(cfg.getWorkerCount(), tasks.size()))
                : TierPlan.of(TierKind.SEQUENTIAL, 1);

        TierContext ctx = TierContext.builder()
                .book(assignment.book())
                .config(cfg)
                .plan(plan)
                .session(session)
                .extractor(extractor)
                .limiter(new RateLimiter(cfg.getRequestsPerSecond(), cfg.getRateBurst()))
                .retryPolicy(DefaultRetryPolicy.from(cfg))
                .sleeper(DefaultSleeper.INSTANCE)
                .consumer(emitter)
                .slog(StructuredLog.get(ShardWorker.class).with("book", assignment.book().getId(), "shard", shard))
                .tasks(tasks)
                .build();

        LOG.info("Shard {} (attempt {}) starting: {} pages via {}", shard, assignment.attempt(), tasks.size(), plan);
        try {
            tier.run(tasks, ctx);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }

        for (PageTask t : tasks) {
            if (t.getStatus() == PageStatus.FAILED) {
                send(ShardMessage.failed(shard, t.getPageNumber(), t.getFailureKind(), t.getLastError(), t.getAttemptCount()));
            }
        }
        send(ShardMessage.done(shard, ctx.fatalReason()));
        LOG.info("Shard {} done", shard);
        return 0;
    }

    /** 여러 워커 스레드가 동시에 부르므로 줄 단위로 직렬화 */
    private void send(ShardMessage m) {
        synchronized (out) {
            try {
                out.write(ShardChannel.encode(m) + "\n");
                out.flush();
            } catch (IOException e) {
                throw new UncheckedIOException("channel to parent closed", e);
            }
        }
    }
}
