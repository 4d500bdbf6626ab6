package com.bookharvest.core.util;

import java.time.Duration;

/** 대기 추상화. 테스트에서는 기록만 하는 구현으로 교체한다. */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
}
