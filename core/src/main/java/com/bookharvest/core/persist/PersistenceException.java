package com.bookharvest.core.persist;

/** 배치 커밋이 재시도 한도를 넘겨 실패. 실행 전체에 치명적. */
public class PersistenceException extends RuntimeException {
    public PersistenceException(String message, Throwable cause) { super(message, cause); }
}
