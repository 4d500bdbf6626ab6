package com.bookharvest.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * 페이지 한 장의 수명주기 상태기계.
 *
 * PENDING → FETCHING → FETCHED → PARSING → PARSED → PERSISTED
 * 재시도는 FETCHING → PENDING 한 가지뿐이다. 그 밖의 역방향 전이는 IllegalStateException.
 * FETCHING은 startFetch()로만 들어가므로 같은 페이지에 동시 요청 두 개가 생길 수 없다.
 */
public final class PageTask {
    private final int pageNumber;
    private PageStatus status = PageStatus.PENDING;
    private int attemptCount;
    private String lastError;
    private FailureKind failureKind;

    public PageTask(int pageNumber) {
        if (pageNumber < 1) throw new IllegalArgumentException("pageNumber must be >= 1");
        this.pageNumber = pageNumber;
    }

    public int getPageNumber() { return pageNumber; }
    public synchronized PageStatus getStatus() { return status; }
    public synchronized int getAttemptCount() { return attemptCount; }
    public synchronized String getLastError() { return lastError; }
    public synchronized FailureKind getFailureKind() { return failureKind; }

    /** PENDING → FETCHING, 시도 횟수 +1 */
    public synchronized void startFetch() {
        move(EnumSet.of(PageStatus.PENDING), PageStatus.FETCHING);
        attemptCount++;
    }

    public synchronized void fetched() {
        move(EnumSet.of(PageStatus.FETCHING), PageStatus.FETCHED);
    }

    /** 일시 오류: FETCHING → PENDING */
    public synchronized void retry(String error) {
        move(EnumSet.of(PageStatus.FETCHING), PageStatus.PENDING);
        this.lastError = error;
    }

    public synchronized void startParse() {
        move(EnumSet.of(PageStatus.FETCHED), PageStatus.PARSING);
    }

    public synchronized void parsed() {
        move(EnumSet.of(PageStatus.PARSING), PageStatus.PARSED);
    }

    public synchronized void persisted() {
        move(EnumSet.of(PageStatus.PARSED), PageStatus.PERSISTED);
    }

    public synchronized void fail(FailureKind kind, String error) {
        move(EnumSet.of(PageStatus.FETCHING, PageStatus.PARSING), PageStatus.FAILED);
        this.failureKind = kind;
        this.lastError = error;
    }

    /** 다른 프로세스가 fetch/parse를 끝낸 페이지: PENDING → PARSED */
    public synchronized void completeRemotely(int attempts) {
        move(EnumSet.of(PageStatus.PENDING), PageStatus.PARSED);
        this.attemptCount += Math.max(1, attempts);
    }

    /** 다른 프로세스에서 실패한 페이지: PENDING → FAILED */
    public synchronized void failRemotely(FailureKind kind, String error, int attempts) {
        move(EnumSet.of(PageStatus.PENDING), PageStatus.FAILED);
        this.attemptCount += Math.max(1, attempts);
        this.failureKind = kind;
        this.lastError = error;
    }

    private void move(Set<PageStatus> allowedFrom, PageStatus to) {
        if (!allowedFrom.contains(status)) {
            throw new IllegalStateException("page " + pageNumber + ": illegal transition " + status + " -> " + to);
        }
        status = to;
    }

    @Override public synchronized String toString() {
        return "PageTask{" + pageNumber + ", " + status + ", attempts=" + attemptCount
                + (lastError == null ? "" : ", lastError=" + lastError) + "}";
    }
}
