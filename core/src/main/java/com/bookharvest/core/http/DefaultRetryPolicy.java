package com.bookharvest.core.http;

import com.bookharvest.core.model.ExtractionConfig;
import com.bookharvest.core.model.FetchOutcome;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * TRANSIENT/RATE_LIMITED에서만 재시도. base → 2·base → 4·base (±10% Jitter)
 * RATE_LIMITED는 백오프에 max(Retry-After, cooldown)을 더한다.
 * Retry-After가 붙은 TRANSIENT(주로 503)는 백오프와 Retry-After 중 큰 값.
 */
public final class DefaultRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;
    private final Duration rateLimitCooldown;

    public DefaultRetryPolicy() { this(3, Duration.ofMillis(500), Duration.ofSeconds(5)); }

    public DefaultRetryPolicy(int maxAttempts, Duration baseDelay, Duration rateLimitCooldown) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(1, baseDelay.toMillis());
        this.rateLimitCooldown = Objects.requireNonNull(rateLimitCooldown, "rateLimitCooldown");
    }

    public static DefaultRetryPolicy from(ExtractionConfig cfg) {
        return new DefaultRetryPolicy(cfg.getMaxAttempts(), cfg.getBaseRetryDelay(), cfg.getRateLimitCooldown());
    }

    @Override public boolean shouldRetry(FetchOutcome outcome, int attempt) {
        if (attempt >= maxAttempts) return false;
        FetchOutcome.Kind k = outcome.getKind();
        return k == FetchOutcome.Kind.TRANSIENT || k == FetchOutcome.Kind.RATE_LIMITED;
    }

    @Override public Duration nextDelay(FetchOutcome outcome, int attempt) {
        Duration backoff = backoff(attempt);
        Duration retryAfter = outcome.getRetryAfter();
        if (outcome.getKind() == FetchOutcome.Kind.RATE_LIMITED) {
            Duration cooldown = rateLimitCooldown;
            if (retryAfter != null && retryAfter.compareTo(cooldown) > 0) cooldown = retryAfter;
            return backoff.plus(cooldown);
        }
        if (retryAfter != null && retryAfter.compareTo(backoff) > 0) return retryAfter;
        return backoff;
    }

    Duration backoff(int attempt) {
        long pow = 1L << Math.min(20, Math.max(0, attempt - 1));  // 1,2,4...
        long raw = baseMillis * pow;
        double jitter = 0.9 + ThreadLocalRandom.current().nextDouble(0.2); // ±10%
        return Duration.ofMillis((long) (raw * jitter));
    }

    @Override public int maxAttempts() { return maxAttempts; }
}
