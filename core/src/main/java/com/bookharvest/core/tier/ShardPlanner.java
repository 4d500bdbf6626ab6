package com.bookharvest.core.tier;

import java.util.ArrayList;
import java.util.List;

/**
 * 오름차순 페이지 목록을 서로 겹치지 않는 연속 샤드로 나눈다.
 * 샤드 수 = min(processCount, n / minShardSize) (최소 1) → 각 샤드는 minShardSize 이상.
 * 나머지는 앞쪽 샤드에 한 장씩 더 얹는다.
 */
public final class ShardPlanner {
    private ShardPlanner() {}

    public static List<Shard> split(List<Integer> pages, int processCount, int minShardSize) {
        if (processCount < 1) throw new IllegalArgumentException("processCount must be >= 1");
        if (minShardSize < 1) throw new IllegalArgumentException("minShardSize must be >= 1");
        int n = pages.size();
        if (n == 0) return List.of();

        int shardCount = Math.max(1, Math.min(processCount, n / minShardSize));
        int base = n / shardCount;
        int extra = n % shardCount;

        List<Shard> out = new ArrayList<>(shardCount);
        int from = 0;
        for (int i = 0; i < shardCount; i++) {
            int size = base + (i < extra ? 1 : 0);
            out.add(new Shard(i, pages.subList(from, from + size)));
            from += size;
        }
        return out;
    }
}
