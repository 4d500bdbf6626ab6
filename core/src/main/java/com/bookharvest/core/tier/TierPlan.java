package com.bookharvest.core.tier;

import com.bookharvest.core.model.TierKind;

import java.util.List;
import java.util.Objects;

/** StrategySelector 결과: 티어 + 워커 수 (+ MultiProcess면 샤드). */
public final class TierPlan {
    private final TierKind kind;
    private final int workers;
    private final List<Shard> shards;

    private TierPlan(TierKind kind, int workers, List<Shard> shards) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.workers = workers;
        this.shards = List.copyOf(shards);
    }

    public static TierPlan of(TierKind kind, int workers) {
        return new TierPlan(kind, Math.max(1, workers), List.of());
    }

    public static TierPlan multiProcess(List<Shard> shards) {
        return new TierPlan(TierKind.MULTI_PROCESS, Math.max(1, shards.size()), shards);
    }

    public TierKind kind() { return kind; }
    public int workers() { return workers; }
    public List<Shard> shards() { return shards; }

    @Override public String toString() {
        return kind + "(workers=" + workers + (shards.isEmpty() ? "" : ", shards=" + shards) + ")";
    }
}
