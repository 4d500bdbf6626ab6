package com.bookharvest.core.util;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

public final class DefaultSleeper implements Sleeper {
    public static final DefaultSleeper INSTANCE = new DefaultSleeper();

    @Override public void sleep(Duration d) throws InterruptedException {
        long nanos = (d == null) ? 0 : Math.max(0, d.toNanos());
        if (nanos > 0) TimeUnit.NANOSECONDS.sleep(nanos);
    }
}
