package com.bookharvest.core.tier;

import com.bookharvest.core.model.FailureKind;
import com.bookharvest.core.model.PageStatus;
import com.bookharvest.core.model.PageTask;
import com.bookharvest.core.support.InProcessShardLauncher;
import com.bookharvest.core.tier.multiprocess.ShardAssignment;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class MultiProcessTierTest {

    private static TierPlan twoShards(TierHarness h) {
        List<Integer> pages = new ArrayList<>();
        for (PageTask t : h.tasks) pages.add(t.getPageNumber());
        return TierPlan.multiProcess(ShardPlanner.split(pages, 2, 1));
    }

    /** 같은 페이지가 두 번 오면 바로 실패 */
    private static void rejectDuplicates(TierHarness h) {
        Set<Integer> seen = ConcurrentHashMap.newKeySet();
        h.consumer = (task, page) -> {
            if (!seen.add(page.getPageNumber())) throw new AssertionError("duplicate page " + page.getPageNumber());
            h.emitted.put(page.getPageNumber(), page);
        };
    }

    @Test
    void shards_cover_all_pages_with_split_rate() throws Exception {
        TierHarness h = new TierHarness(20, 0, TierHarness.fastConfig());
        rejectDuplicates(h);
        InProcessShardLauncher launcher = new InProcessShardLauncher(a -> h.session);

        TierContext ctx = h.context(twoShards(h));
        new MultiProcessTier(launcher).run(h.tasks, ctx);

        assertNull(ctx.fatalReason());
        assertEquals(20, h.emitted.size());
        List<ShardAssignment> launched = launcher.launched();
        assertEquals(2, launched.size());
        assertThat(launched.get(0).pageList()).containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
        assertThat(launched.get(1).pageList()).containsExactly(11, 12, 13, 14, 15, 16, 17, 18, 19, 20);
        // 워커마다 전체 rps의 절반
        assertEquals(h.config.getRequestsPerSecond() / 2, launched.get(0).toConfig().getRequestsPerSecond(), 1e-9);
    }

    @Test
    void worker_failures_are_reported_back_to_parent() throws Exception {
        TierHarness h = new TierHarness(20, 0, TierHarness.fastConfig());
        h.session.script(4, 500).script(15, 404);

        TierContext ctx = h.context(twoShards(h));
        new MultiProcessTier(new InProcessShardLauncher(a -> h.session)).run(h.tasks, ctx);

        assertEquals(PageStatus.PARSED, h.task(4).getStatus());
        assertEquals(2, h.task(4).getAttemptCount());
        assertEquals(PageStatus.FAILED, h.task(15).getStatus());
        assertEquals(FailureKind.MISSING, h.task(15).getFailureKind());
        assertEquals(19, h.emitted.size());
    }

    @Test
    void crashed_shard_is_relaunched_with_only_unfinished_pages() throws Exception {
        TierHarness h = new TierHarness(20, 0, TierHarness.fastConfig());
        rejectDuplicates(h);
        InProcessShardLauncher launcher = new InProcessShardLauncher(a -> h.session).crashAfter(1, 3);

        TierContext ctx = h.context(twoShards(h));
        new MultiProcessTier(launcher).run(h.tasks, ctx);

        assertNull(ctx.fatalReason());
        assertEquals(20, h.emitted.size(), "every page delivered exactly once");
        h.tasks.forEach(t -> assertEquals(PageStatus.PARSED, t.getStatus(), t.toString()));

        List<ShardAssignment> launched = launcher.launched();
        assertEquals(3, launched.size());
        ShardAssignment relaunch = launched.get(2);
        assertEquals(1, relaunch.shardIndex());
        assertEquals(1, relaunch.attempt());
        // 첫 실행이 보낸 3쪽은 다시 배정하지 않는다
        assertEquals(7, relaunch.pageList().size());
        assertThat(relaunch.pageList()).allMatch(p -> p >= 11 && p <= 20);
        Set<Integer> firstRun = launched.get(1).pageList().stream().collect(Collectors.toSet());
        assertThat(firstRun).containsAll(relaunch.pageList());
    }

    @Test
    void exhausting_restarts_abandons_only_that_shard() throws Exception {
        TierHarness h = new TierHarness(20, 0, TierHarness.fastConfig().toBuilder().maxShardRestarts(0).build());
        InProcessShardLauncher launcher = new InProcessShardLauncher(a -> h.session).crashAfter(0, 2);

        TierContext ctx = h.context(twoShards(h));
        new MultiProcessTier(launcher).run(h.tasks, ctx);

        assertNull(ctx.fatalReason(), "a crashed shard is not run-fatal");
        assertEquals(2, launcher.launched().size());
        long pending = h.tasks.subList(0, 10).stream().filter(t -> t.getStatus() == PageStatus.PENDING).count();
        assertEquals(8, pending);
        // 다른 샤드는 끝까지
        assertThat(h.tasks.subList(10, 20)).allMatch(t -> t.getStatus() == PageStatus.PARSED);
    }

    @Test
    void stop_request_kills_workers_and_leaves_pages_pending() throws Exception {
        TierHarness h = new TierHarness(40, 5, TierHarness.fastConfig());
        h.consumer = (task, page) -> {
            h.emitted.put(page.getPageNumber(), page);
            if (h.emitted.size() >= 4) h.stop.set(true);
        };

        TierContext ctx = h.context(twoShards(h));
        new MultiProcessTier(new InProcessShardLauncher(a -> h.session)).run(h.tasks, ctx);

        assertNull(ctx.fatalReason());
        assertThat(h.tasks).anyMatch(t -> t.getStatus() == PageStatus.PENDING);
        assertThat(h.emitted.size()).isLessThan(40);
    }
}
