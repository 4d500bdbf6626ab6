package com.bookharvest.core.util;

import java.time.Duration;
import java.util.Objects;

/**
 * 토큰 버킷 리미터 (프로세스 내부 공유).
 *
 * 토큰이 모자라면 음수(부채)로 예약하고, 호출자는 돌려받은 시간만큼 기다린다.
 * 예약이 락 안에서 직렬화되므로 워커 수와 무관하게 1/rate 간격이 보장된다.
 * 비동기 티어는 {@link #reserve()}로 대기 시간만 받아 스케줄링한다.
 */
public final class RateLimiter {
    private final double permitsPerSecond;
    private final double capacity;
    private final Ticker ticker;
    private final Sleeper sleeper;

    private double tokens;
    private long lastNs;

    public RateLimiter(double permitsPerSecond, int burst) {
        this(permitsPerSecond, burst, Ticker.SYSTEM, DefaultSleeper.INSTANCE);
    }

    public RateLimiter(double permitsPerSecond, int burst, Ticker ticker, Sleeper sleeper) {
        if (!(permitsPerSecond > 0)) throw new IllegalArgumentException("permitsPerSecond must be > 0");
        if (burst < 1) throw new IllegalArgumentException("burst must be >= 1");
        this.permitsPerSecond = permitsPerSecond;
        this.capacity = burst;
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.tokens = burst;
        this.lastNs = ticker.nanoTime();
    }

    /** 토큰 하나를 얻을 때까지 블로킹. */
    public void acquire() throws InterruptedException {
        long waitNs = reserve();
        if (waitNs > 0) sleeper.sleep(Duration.ofNanos(waitNs));
    }

    /** 토큰 하나를 예약하고, 사용 가능해질 때까지 남은 나노초를 돌려준다(0이면 즉시). */
    public synchronized long reserve() {
        refill();
        tokens -= 1.0;
        if (tokens >= 0) return 0L;
        return (long) Math.ceil(-tokens / permitsPerSecond * 1_000_000_000.0);
    }

    public double rate() { return permitsPerSecond; }

    private void refill() {
        long now = ticker.nanoTime();
        long elapsed = now - lastNs;
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + elapsed / 1_000_000_000.0 * permitsPerSecond);
            lastNs = now;
        }
    }
}
