package com.bookharvest.core.tier;

import com.bookharvest.core.model.PageTask;
import com.bookharvest.core.model.TierKind;

import java.util.List;

/**
 * 네 가지 동시성 모델의 공통 계약: PENDING 페이지들을 PARSED(→ consumer) 또는 FAILED까지 몬다.
 * 중지 신호가 오면 새 페이지를 시작하지 않고 돌아온다. 남은 PENDING은 호출자가 incomplete로 집계.
 */
public interface ExecutionTier {

    TierKind kind();

    void run(List<PageTask> tasks, TierContext ctx) throws InterruptedException;
}
