package com.bookharvest.core.tier;

import com.bookharvest.core.extract.ParseException;
import com.bookharvest.core.model.ExtractedPage;
import com.bookharvest.core.model.FailureKind;
import com.bookharvest.core.model.FetchOutcome;
import com.bookharvest.core.model.PageTask;
import com.bookharvest.core.persist.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * PageTask 상태기계 구동기. 재시도 루프를 재귀 대신 명시적 상태(PENDING ↔ FETCHING)로 돈다.
 * 블로킹 티어는 {@link #process(PageTask)}를, AsyncTier는 단계별 메서드를 직접 쓴다.
 */
public final class PageProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(PageProcessor.class);

    /** fetch 결과 처리 후 다음 단계 */
    public enum Step { PARSE, RETRY, DONE }

    private final TierContext ctx;

    public PageProcessor(TierContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    /** 영속화 치명 오류는 실행 중지로 바꿔 삼키지 않고 기록한다. */
    public void processGuarded(PageTask task) throws InterruptedException {
        try {
            process(task);
        } catch (PersistenceException e) {
            ctx.fatal(e);
        }
    }

    /** 한 페이지를 PARSED(→ consumer) 또는 FAILED까지. 중지되면 PENDING으로 남긴 채 반환. */
    public void process(PageTask task) throws InterruptedException {
        URI uri = ctx.book().pageUri(task.getPageNumber());
        while (true) {
            if (ctx.shouldStop()) return;
            ctx.limiter().acquire();
            if (ctx.shouldStop()) return;

            task.startFetch();
            FetchOutcome outcome = ctx.session().fetch(uri);
            Step step = afterFetch(task, outcome);
            if (step == Step.PARSE) {
                parseAndEmit(task, outcome.getBody());
                return;
            }
            if (step == Step.DONE) return;
            ctx.sleeper().sleep(retryDelay(task, outcome));
        }
    }

    /** FETCHING 상태의 task에 결과 반영. */
    public Step afterFetch(PageTask task, FetchOutcome outcome) {
        ctx.stats().recordAttempt(outcome.getElapsedMs());
        if (outcome.isConnectionFailure()) {
            if (ctx.monitor().recordConnectionFailure()) {
                ctx.fatal("total connectivity loss: " + ctx.monitor().consecutiveFailures()
                        + " consecutive connection failures");
            }
        } else {
            ctx.monitor().recordResponse();
        }

        int n = task.getPageNumber();
        switch (outcome.getKind()) {
            case OK:
                task.fetched();
                return Step.PARSE;
            case PERMANENT:
                task.fail(FailureKind.MISSING, outcome.describe());
                LOG.warn("Page {} missing ({}), continuing", n, outcome.describe());
                ctx.slog().warn("page-failed", "page", n, "kind", FailureKind.MISSING.name(),
                        "status", outcome.getStatusCode());
                ctx.pageResolved();
                return Step.DONE;
            default:
                break;
        }

        // TRANSIENT / RATE_LIMITED
        int attempt = task.getAttemptCount();
        if (!ctx.retryPolicy().shouldRetry(outcome, attempt)) {
            task.fail(FailureKind.FETCH_EXHAUSTED, outcome.describe());
            LOG.warn("Page {} failed after {} attempts: {}", n, attempt, outcome.describe());
            ctx.slog().warn("page-failed", "page", n, "kind", FailureKind.FETCH_EXHAUSTED.name(),
                    "attempts", attempt, "status", outcome.getStatusCode());
            ctx.pageResolved();
            return Step.DONE;
        }
        task.retry(outcome.describe());
        ctx.stats().recordRetry();
        LOG.debug("Page {} attempt {} {} ({}), will retry", n, attempt, outcome.getKind(), outcome.describe());
        return ctx.shouldStop() ? Step.DONE : Step.RETRY;
    }

    public Duration retryDelay(PageTask task, FetchOutcome outcome) {
        return ctx.retryPolicy().nextDelay(outcome, task.getAttemptCount());
    }

    /** FETCHED → PARSING → PARSED(→ consumer) 또는 FAILED(PARSE_ERROR). */
    public void parseAndEmit(PageTask task, String html) throws InterruptedException {
        int n = task.getPageNumber();
        task.startParse();
        ExtractedPage page;
        try {
            page = ctx.extractor().extract(n, html);
        } catch (ParseException e) {
            task.fail(FailureKind.PARSE_ERROR, e.getMessage());
            LOG.warn("Page {} could not be parsed: {}", n, e.getMessage());
            ctx.slog().warn("page-failed", "page", n, "kind", FailureKind.PARSE_ERROR.name());
            ctx.pageResolved();
            return;
        }
        task.parsed();
        LOG.debug("Page {} parsed by {} ({} chars)", n, page.getMetadata().getParser(), page.getText().length());
        ctx.consumer().accept(task, page);
        ctx.pageResolved();
    }
}
