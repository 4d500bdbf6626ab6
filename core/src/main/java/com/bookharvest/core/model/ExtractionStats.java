package com.bookharvest.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class ExtractionStats {
    private final AtomicLong requestsTotal = new AtomicLong(0);   // HTTP 시도(재시도 포함) 총합
    private final AtomicLong retriesTotal  = new AtomicLong(0);
    private final AtomicLong sumAttemptMs  = new AtomicLong(0);   // 시도별 응답 시간 합
    private final AtomicLong flushesTotal  = new AtomicLong(0);
    private final AtomicLong pagesFlushed  = new AtomicLong(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    /** 한 번의 HTTP 시도 */
    public void recordAttempt(long elapsedMs) {
        requestsTotal.incrementAndGet();
        sumAttemptMs.addAndGet(Math.max(0, elapsedMs));
    }

    /** 다른 프로세스가 보고한 시도 수(지연은 모름) */
    public void recordRemoteAttempts(int attempts) {
        if (attempts <= 0) return;
        requestsTotal.addAndGet(attempts);
        retriesTotal.addAndGet(attempts - 1L);
    }

    public void recordRetry() {
        retriesTotal.incrementAndGet();
    }

    public void recordFlush(int pages) {
        flushesTotal.incrementAndGet();
        pagesFlushed.addAndGet(pages);
    }

    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        long req = requestsTotal.get();
        long avg = sumAttemptMs.get() / Math.max(1, req); // 근사치(원격 시도 포함 시 낮게 나옴)
        return new Snapshot(req, retriesTotal.get(), maxObservedConcurrency.get(), avg,
                flushesTotal.get(), pagesFlushed.get());
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long requestsTotal;
        public final long retriesTotal;
        public final int  maxObservedConcurrency;
        public final long avgLatencyMs;
        public final long flushes;
        public final long pagesFlushed;

        public Snapshot(long requestsTotal, long retriesTotal, int maxObservedConcurrency,
                        long avgLatencyMs, long flushes, long pagesFlushed) {
            this.requestsTotal = requestsTotal;
            this.retriesTotal = retriesTotal;
            this.maxObservedConcurrency = maxObservedConcurrency;
            this.avgLatencyMs = avgLatencyMs;
            this.flushes = flushes;
            this.pagesFlushed = pagesFlushed;
        }

        @Override public String toString() {
            return "requests=" + requestsTotal + ", retries=" + retriesTotal + ", maxCC=" + maxObservedConcurrency
                    + ", avgLatencyMs=" + avgLatencyMs + ", flushes=" + flushes;
        }
    }
}
