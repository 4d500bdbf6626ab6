package com.bookharvest.core.tier;

import com.bookharvest.core.model.PageTask;
import com.bookharvest.core.model.TierKind;

import java.util.List;

/** 한 번에 한 페이지. 기준 구현. */
public final class SequentialTier implements ExecutionTier {

    @Override public TierKind kind() { return TierKind.SEQUENTIAL; }

    @Override
    public void run(List<PageTask> tasks, TierContext ctx) throws InterruptedException {
        PageProcessor processor = new PageProcessor(ctx);
        for (PageTask task : tasks) {
            if (ctx.shouldStop()) break;
            ctx.stats().observeConcurrency(1);
            processor.processGuarded(task);
        }
    }
}
