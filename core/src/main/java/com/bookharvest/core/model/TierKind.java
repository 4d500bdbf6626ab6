package com.bookharvest.core.model;

public enum TierKind {
    SEQUENTIAL, THREAD_POOL, ASYNC_IO, MULTI_PROCESS
}
