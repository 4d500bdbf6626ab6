package com.bookharvest.core.util;

/** 단조 증가 나노초 시계. RateLimiter 테스트용 주입 지점. */
@FunctionalInterface
public interface Ticker {
    long nanoTime();

    Ticker SYSTEM = System::nanoTime;
}
