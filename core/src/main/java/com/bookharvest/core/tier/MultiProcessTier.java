package com.bookharvest.core.tier;

import com.bookharvest.core.model.ExtractionConfig;
import com.bookharvest.core.model.PageStatus;
import com.bookharvest.core.model.PageTask;
import com.bookharvest.core.model.TierKind;
import com.bookharvest.core.persist.PersistenceException;
import com.bookharvest.core.tier.multiprocess.ShardAssignment;
import com.bookharvest.core.tier.multiprocess.ShardChannel;
import com.bookharvest.core.tier.multiprocess.ShardMessage;
import com.bookharvest.core.tier.multiprocess.ShardWorkerLauncher;
import com.bookharvest.core.tier.multiprocess.ShardWorkerLauncher.WorkerHandle;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * 샤드마다 워커 프로세스 하나. 워커는 자체 세션/리미터(rps / 샤드 수)로 돌고
 * 결과를 메시지로 보내며, 부모가 모든 샤드를 하나의 BatchPersister로 모은다.
 *
 * 리더 스레드 → 유한 큐 → 이 스레드(consumer) 경로라서 영속화가 밀리면 파이프가 차고 워커가 멈춘다.
 * 워커가 DONE 없이 끝나거나 종료 코드가 0이 아니면 크래시: 그 샤드에서 아직 PENDING인 페이지만
 * 다시 배정한다(최대 maxShardRestarts회). 이미 받은/영속화된 페이지는 건너뛴다.
 * 한도를 넘긴 샤드는 포기하고 남은 페이지를 PENDING으로 둔다(실행 치명 오류는 아님).
 */
public final class MultiProcessTier implements ExecutionTier {

    private static final Logger LOG = LoggerFactory.getLogger(MultiProcessTier.class);

    private final ShardWorkerLauncher launcher;

    public MultiProcessTier(ShardWorkerLauncher launcher) {
        this.launcher = Objects.requireNonNull(launcher, "launcher");
    }

    @Override public TierKind kind() { return TierKind.MULTI_PROCESS; }

    @Override
    public void run(List<PageTask> tasks, TierContext ctx) throws InterruptedException {
        if (tasks.isEmpty()) return;
        ExtractionConfig cfg = ctx.config();
        List<Shard> shards = ctx.plan().shards();
        if (shards.isEmpty()) {
            List<Integer> pages = new ArrayList<>(tasks.size());
            for (PageTask t : tasks) pages.add(t.getPageNumber());
            shards = ShardPlanner.split(pages, cfg.getProcessCount(), cfg.getMinShardSize());
        }
        new Coordinator(ctx, shards).run();
    }

    /** 워커 한 번의 실행 */
    private static final class Run {
        final Shard shard;
        final int attempt;
        final WorkerHandle handle;
        boolean doneSeen;

        Run(Shard shard, int attempt, WorkerHandle handle) {
            this.shard = shard;
            this.attempt = attempt;
            this.handle = handle;
        }
    }

    /** 리더 스레드 → 조정 스레드 이벤트: 메시지 하나, 또는 워커 종료 */
    private static final class Event {
        final Run run;
        final ShardMessage message;  // null이면 종료 이벤트
        final int exitCode;

        Event(Run run, ShardMessage message, int exitCode) {
            this.run = run;
            this.message = message;
            this.exitCode = exitCode;
        }
    }

    private final class Coordinator {
        private final TierContext ctx;
        private final List<Shard> shards;
        private final double perWorkerRps;
        private final BlockingQueue<Event> events;
        private final ExecutorService readers = Executors.newCachedThreadPool(new NamedThreadFactory("shard-reader"));
        private final Map<Integer, Run> running = new HashMap<>();
        private final Map<Integer, Integer> restarts = new HashMap<>();
        private boolean destroyed;

        Coordinator(TierContext ctx, List<Shard> shards) {
            this.ctx = ctx;
            this.shards = shards;
            this.perWorkerRps = ctx.config().getRequestsPerSecond() / shards.size();
            this.events = new ArrayBlockingQueue<>(Math.max(16, ctx.config().getBatchSize() * 2));
        }

        void run() throws InterruptedException {
            ctx.stats().observeConcurrency(shards.size());
            LOG.info("Multi-process run for book {}: {} shards, {} rps per worker",
                    ctx.book().getId(), shards.size(), perWorkerRps);
            try {
                for (Shard s : shards) {
                    if (ctx.shouldStop()) break;
                    start(s, 0, s.pages());
                }
                while (!running.isEmpty()) {
                    Event ev = events.take();
                    if (ev.message != null) onMessage(ev.run, ev.message);
                    else onExit(ev.run, ev.exitCode);
                    if (ctx.shouldStop() && !destroyed) destroyAll();
                }
            } finally {
                destroyAll();
                readers.shutdownNow();
                if (!readers.awaitTermination(10, TimeUnit.SECONDS)) {
                    LOG.warn("Shard readers did not terminate within 10s");
                }
            }
        }

        private void start(Shard shard, int attempt, List<Integer> pages) {
            ShardAssignment a = ShardAssignment.of(ctx.book(), shard.index(), attempt, pages, ctx.config(), perWorkerRps);
            WorkerHandle handle;
            try {
                handle = launcher.launch(a);
            } catch (IOException e) {
                LOG.error("Cannot launch worker for shard {} (attempt {}): {}", shard.index(), attempt, e.toString());
                ctx.slog().warn("shard-abandoned", "shard", shard.index(), "attempt", attempt,
                        "remaining", pages.size(), "cause", e.toString());
                return;
            }
            Run run = new Run(shard, attempt, handle);
            running.put(shard.index(), run);
            ctx.slog().info("shard-started", "shard", shard.index(), "attempt", attempt, "pages", pages.size());
            readers.execute(() -> pump(run));
        }

        /** 리더 스레드: 워커 stdout → 이벤트 큐(가득 차면 대기) */
        private void pump(Run run) {
            try (BufferedReader r = run.handle.output()) {
                String line;
                while ((line = r.readLine()) != null) {
                    if (line.isBlank()) continue;
                    ShardMessage m;
                    try {
                        m = ShardChannel.decode(line);
                    } catch (JsonParseException e) {
                        LOG.warn("Malformed message from shard {}: {}", run.shard.index(), e.getMessage());
                        run.handle.destroy();
                        break;
                    }
                    events.put(new Event(run, m, 0));
                }
            } catch (IOException e) {
                LOG.debug("Shard {} output closed: {}", run.shard.index(), e.toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            try {
                int code = run.handle.waitFor();
                events.put(new Event(run, null, code));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        private void onMessage(Run run, ShardMessage m) {
            switch (m.type()) {
                case DONE:
                    run.doneSeen = true;
                    if (m.fatal() != null) ctx.fatal("shard " + run.shard.index() + ": " + m.fatal());
                    return;
                case PAGE:
                    onPage(run, m);
                    return;
                case FAILED:
                    PageTask failed = pendingTask(m.pageNumber());
                    if (failed == null) return;
                    failed.failRemotely(m.failureKind(), m.error(), m.attempts());
                    ctx.stats().recordRemoteAttempts(m.attempts());
                    LOG.warn("Page {} failed in shard {}: {} ({})", m.pageNumber(), run.shard.index(), m.failureKind(), m.error());
                    ctx.slog().warn("page-failed", "page", m.pageNumber(), "kind", String.valueOf(m.failureKind()),
                            "shard", run.shard.index());
                    ctx.pageResolved();
                    return;
                default:
                    LOG.warn("Unknown message type from shard {}: {}", run.shard.index(), m);
            }
        }

        private void onPage(Run run, ShardMessage m) {
            if (ctx.shouldStop()) return;
            PageTask task = pendingTask(m.pageNumber());
            if (task == null) return;
            task.completeRemotely(m.attempts());
            ctx.stats().recordRemoteAttempts(m.attempts());
            try {
                ctx.consumer().accept(task, m.toPage());
                ctx.pageResolved();
            } catch (PersistenceException e) {
                ctx.fatal(e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ctx.requestStop();
            }
        }

        /** 이 실행 대상이면서 아직 PENDING인 task. 중복/범위 밖 메시지는 null. */
        private PageTask pendingTask(int pageNumber) {
            PageTask t = ctx.tasks().get(pageNumber);
            if (t == null || t.getStatus() != PageStatus.PENDING) {
                LOG.debug("Ignoring message for page {} (state {})", pageNumber, t == null ? "unknown" : t.getStatus());
                return null;
            }
            return t;
        }

        private void onExit(Run run, int exitCode) {
            running.remove(run.shard.index());
            boolean crashed = !run.doneSeen || exitCode != 0;
            if (!crashed) {
                LOG.info("Shard {} finished", run.shard.index());
                return;
            }
            if (ctx.shouldStop()) return;

            List<Integer> remaining = new ArrayList<>();
            for (int p : run.shard.pages()) {
                PageTask t = ctx.tasks().get(p);
                if (t != null && t.getStatus() == PageStatus.PENDING) remaining.add(p);
            }
            LOG.warn("Shard {} worker crashed (exit={}, done={}), {} pages unresolved",
                    run.shard.index(), exitCode, run.doneSeen, remaining.size());
            ctx.slog().warn("shard-crashed", "shard", run.shard.index(), "attempt", run.attempt,
                    "exit", exitCode, "remaining", remaining.size());
            if (remaining.isEmpty()) return;

            int used = restarts.merge(run.shard.index(), 1, Integer::sum);
            if (used > ctx.config().getMaxShardRestarts()) {
                // 남은 페이지는 PENDING 그대로 → incomplete로 보고. 다른 샤드는 계속.
                LOG.error("Shard {} crashed {} times, abandoning {} pages", run.shard.index(), used, remaining.size());
                ctx.slog().warn("shard-abandoned", "shard", run.shard.index(), "crashes", used,
                        "remaining", remaining.size());
                return;
            }
            start(run.shard, used, remaining);
        }

        private void destroyAll() {
            destroyed = true;
            for (Run r : running.values()) r.handle.destroy();
        }
    }
}
