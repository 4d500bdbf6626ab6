package com.bookharvest.core.model;

/** 페이지가 FAILED로 끝난 이유. */
public enum FailureKind {
    /** 404/403/410 등 영구 오류. 재시도 없음. */
    MISSING,
    /** 일시 오류가 maxAttempts를 소진. */
    FETCH_EXHAUSTED,
    /** 빠른 파서와 관대한 파서 모두 실패. */
    PARSE_ERROR
}
