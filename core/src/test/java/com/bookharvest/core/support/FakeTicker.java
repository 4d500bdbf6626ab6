package com.bookharvest.core.support;

import com.bookharvest.core.util.Sleeper;
import com.bookharvest.core.util.Ticker;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/** 수동 시계. sleeper()로 얻은 Sleeper는 자는 대신 시계를 앞으로 민다. */
public final class FakeTicker implements Ticker {
    private final AtomicLong now = new AtomicLong(1_000_000_000L);

    @Override public long nanoTime() { return now.get(); }

    public void advance(Duration d) { now.addAndGet(d.toNanos()); }

    public Sleeper sleeper() { return this::advance; }
}
