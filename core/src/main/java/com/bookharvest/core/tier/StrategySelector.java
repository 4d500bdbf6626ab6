package com.bookharvest.core.tier;

import com.bookharvest.core.model.ExtractionConfig;
import com.bookharvest.core.model.TierKind;

import java.util.ArrayList;
import java.util.List;

/**
 * 페이지 수 → 실행 티어. 부수효과 없는 순수 함수.
 * <pre>
 *   n &lt; threadThreshold        → SEQUENTIAL
 *   n &lt; asyncThreshold         → THREAD_POOL (workerCount)
 *   n &lt; multiprocessThreshold  → ASYNC_IO   (asyncConcurrency)
 *   그 이상                       → MULTI_PROCESS (샤드당 프로세스 하나)
 * </pre>
 * forceSequential이면 크기와 무관하게 SEQUENTIAL.
 */
public final class StrategySelector {
    private StrategySelector() {}

    public static TierPlan select(int totalPages, ExtractionConfig cfg) {
        List<Integer> pages = new ArrayList<>(Math.max(0, totalPages));
        for (int p = 1; p <= totalPages; p++) pages.add(p);
        return select(pages, cfg);
    }

    /** @param pages 이번 실행에서 추출할 페이지(오름차순) */
    public static TierPlan select(List<Integer> pages, ExtractionConfig cfg) {
        int n = pages.size();
        if (cfg.isForceSequential() || n < cfg.getThreadThreshold()) {
            return TierPlan.of(TierKind.SEQUENTIAL, 1);
        }
        if (n < cfg.getAsyncThreshold()) {
            return TierPlan.of(TierKind.THREAD_POOL, Math.min(cfg.getWorkerCount(), n));
        }
        if (n < cfg.getMultiprocessThreshold()) {
            return TierPlan.of(TierKind.ASYNC_IO, Math.min(cfg.getAsyncConcurrency(), n));
        }
        return TierPlan.multiProcess(ShardPlanner.split(pages, cfg.getProcessCount(), cfg.getMinShardSize()));
    }
}
