package com.bookharvest.core.http;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 연속 연결 실패(status -1) 카운터. 임계치에 닿으면 "연결 완전 상실"로 판단한다.
 * 응답을 하나라도 받으면(상태코드 무관) 0으로 리셋.
 */
public final class ConnectivityMonitor {
    private final int threshold;
    private final AtomicInteger consecutive = new AtomicInteger(0);
    private final AtomicBoolean lost = new AtomicBoolean(false);

    public ConnectivityMonitor(int threshold) {
        if (threshold < 1) throw new IllegalArgumentException("threshold must be >= 1");
        this.threshold = threshold;
    }

    public void recordResponse() {
        if (!lost.get()) consecutive.set(0);
    }

    /** @return 이번 실패로 상실 판정이 났으면 true (한 번만) */
    public boolean recordConnectionFailure() {
        int n = consecutive.incrementAndGet();
        return n >= threshold && lost.compareAndSet(false, true);
    }

    public boolean isLost() { return lost.get(); }

    public int consecutiveFailures() { return consecutive.get(); }
}
