package com.bookharvest.core.api;

import com.bookharvest.core.model.FetchOutcome;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/** 단일 시도 GET 계약. 재시도는 호출자(PageTask 상태기계)가 결정한다. */
public interface IHttpSession extends AutoCloseable {

    /** 블로킹 1회 시도. 네트워크 오류는 예외 대신 FetchOutcome(status -1)로 돌아온다. */
    FetchOutcome fetch(URI url) throws InterruptedException;

    /** 비동기 1회 시도. 기본 구현은 호출 스레드에서 fetch()를 돌린다. */
    default CompletableFuture<FetchOutcome> fetchAsync(URI url) {
        try {
            return CompletableFuture.completedFuture(fetch(url));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return CompletableFuture.failedFuture(ie);
        }
    }

    @Override default void close() {}
}
