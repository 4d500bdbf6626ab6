package com.bookharvest.core.model;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * 추출 실행 설정(불변). 실행당 한 번 만들어 모든 컴포넌트에 참조로 넘긴다.
 * 생성은 {@link #builder()} → {@link Builder#build()} (검증 포함).
 */
public final class ExtractionConfig {

    public static final String DEFAULT_BASE_URL = "https://shamela.ws";
    public static final String DEFAULT_USER_AGENT = "bookharvest/0.1 (+page-extractor)";

    // 티어 전환점
    private final int threadThreshold;
    private final int asyncThreshold;
    private final int multiprocessThreshold;
    private final boolean forceSequential;

    // 동시성
    private final int workerCount;
    private final int asyncConcurrency;
    private final int processCount;
    private final int minShardSize;
    private final int maxShardRestarts;

    // 영속화
    private final int batchSize;
    private final int persistRetries;
    private final Duration persistRetryDelay;

    // 레이트/재시도
    private final double requestsPerSecond;
    private final int rateBurst;
    private final int maxAttempts;
    private final Duration baseRetryDelay;
    private final Duration rateLimitCooldown;
    private final Duration maxRetryAfter;

    // HTTP
    private final Duration requestTimeout;
    private final Duration connectTimeout;
    private final int maxConnections;
    private final String userAgent;
    private final String sourceBaseUrl;

    // 파서/건강성/재개
    private final boolean useFastParser;
    private final int maxConsecutiveConnectionFailures;
    private final Set<Integer> retryPages;

    private ExtractionConfig(Builder b) {
        this.threadThreshold = b.threadThreshold;
        this.asyncThreshold = b.asyncThreshold;
        this.multiprocessThreshold = b.multiprocessThreshold;
        this.forceSequential = b.forceSequential;
        this.workerCount = b.workerCount;
        this.asyncConcurrency = b.asyncConcurrency;
        this.processCount = b.processCount;
        this.minShardSize = b.minShardSize;
        this.maxShardRestarts = b.maxShardRestarts;
        this.batchSize = b.batchSize;
        this.persistRetries = b.persistRetries;
        this.persistRetryDelay = b.persistRetryDelay;
        this.requestsPerSecond = b.requestsPerSecond;
        this.rateBurst = b.rateBurst;
        this.maxAttempts = b.maxAttempts;
        this.baseRetryDelay = b.baseRetryDelay;
        this.rateLimitCooldown = b.rateLimitCooldown;
        this.maxRetryAfter = b.maxRetryAfter;
        this.requestTimeout = b.requestTimeout;
        this.connectTimeout = b.connectTimeout;
        this.maxConnections = b.maxConnections;
        this.userAgent = b.userAgent;
        this.sourceBaseUrl = b.sourceBaseUrl;
        this.useFastParser = b.useFastParser;
        this.maxConsecutiveConnectionFailures = b.maxConsecutiveConnectionFailures;
        this.retryPages = Collections.unmodifiableSet(new TreeSet<>(b.retryPages));
    }

    public static Builder builder() { return new Builder(); }

    public static ExtractionConfig defaults() { return builder().build(); }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.threadThreshold = threadThreshold;
        b.asyncThreshold = asyncThreshold;
        b.multiprocessThreshold = multiprocessThreshold;
        b.forceSequential = forceSequential;
        b.workerCount = workerCount;
        b.asyncConcurrency = asyncConcurrency;
        b.processCount = processCount;
        b.minShardSize = minShardSize;
        b.maxShardRestarts = maxShardRestarts;
        b.batchSize = batchSize;
        b.persistRetries = persistRetries;
        b.persistRetryDelay = persistRetryDelay;
        b.requestsPerSecond = requestsPerSecond;
        b.rateBurst = rateBurst;
        b.maxAttempts = maxAttempts;
        b.baseRetryDelay = baseRetryDelay;
        b.rateLimitCooldown = rateLimitCooldown;
        b.maxRetryAfter = maxRetryAfter;
        b.requestTimeout = requestTimeout;
        b.connectTimeout = connectTimeout;
        b.maxConnections = maxConnections;
        b.userAgent = userAgent;
        b.sourceBaseUrl = sourceBaseUrl;
        b.useFastParser = useFastParser;
        b.maxConsecutiveConnectionFailures = maxConsecutiveConnectionFailures;
        b.retryPages = new TreeSet<>(retryPages);
        return b;
    }

    // ===== getters =====
    public int getThreadThreshold() { return threadThreshold; }
    public int getAsyncThreshold() { return asyncThreshold; }
    public int getMultiprocessThreshold() { return multiprocessThreshold; }
    public boolean isForceSequential() { return forceSequential; }
    public int getWorkerCount() { return workerCount; }
    public int getAsyncConcurrency() { return asyncConcurrency; }
    public int getProcessCount() { return processCount; }
    public int getMinShardSize() { return minShardSize; }
    public int getMaxShardRestarts() { return maxShardRestarts; }
    public int getBatchSize() { return batchSize; }
    public int getPersistRetries() { return persistRetries; }
    public Duration getPersistRetryDelay() { return persistRetryDelay; }
    public double getRequestsPerSecond() { return requestsPerSecond; }
    public int getRateBurst() { return rateBurst; }
    public int getMaxAttempts() { return maxAttempts; }
    public Duration getBaseRetryDelay() { return baseRetryDelay; }
    public Duration getRateLimitCooldown() { return rateLimitCooldown; }
    public Duration getMaxRetryAfter() { return maxRetryAfter; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public int getMaxConnections() { return maxConnections; }
    public String getUserAgent() { return userAgent; }
    public String getSourceBaseUrl() { return sourceBaseUrl; }
    public boolean isUseFastParser() { return useFastParser; }
    public int getMaxConsecutiveConnectionFailures() { return maxConsecutiveConnectionFailures; }
    public Set<Integer> getRetryPages() { return retryPages; }

    @Override public String toString() {
        return "ExtractionConfig{thresholds=" + threadThreshold + "/" + asyncThreshold + "/" + multiprocessThreshold
                + ", forceSequential=" + forceSequential
                + ", workers=" + workerCount + ", async=" + asyncConcurrency + ", processes=" + processCount
                + ", batchSize=" + batchSize + ", rps=" + requestsPerSecond + ", maxAttempts=" + maxAttempts
                + ", fastParser=" + useFastParser + ", base=" + sourceBaseUrl + "}";
    }

    /** 가변 빌더. build()에서 한 번에 검증. */
    public static final class Builder {
        private int threadThreshold = 10;
        private int asyncThreshold = 500;
        private int multiprocessThreshold = 1000;
        private boolean forceSequential = false;

        private int workerCount = 8;
        private int asyncConcurrency = 15;
        private int processCount = Math.max(1, Math.min(Runtime.getRuntime().availableProcessors(), 8));
        private int minShardSize = 100;
        private int maxShardRestarts = 2;

        private int batchSize = 50;
        private int persistRetries = 3;
        private Duration persistRetryDelay = Duration.ofSeconds(1);

        private double requestsPerSecond = 5.0;
        private int rateBurst = 1;
        private int maxAttempts = 3;
        private Duration baseRetryDelay = Duration.ofMillis(500);
        private Duration rateLimitCooldown = Duration.ofSeconds(5);
        private Duration maxRetryAfter = Duration.ofSeconds(30);

        private Duration requestTimeout = Duration.ofSeconds(30);
        private Duration connectTimeout = Duration.ofSeconds(15);
        private int maxConnections = 30;
        private String userAgent = DEFAULT_USER_AGENT;
        private String sourceBaseUrl = DEFAULT_BASE_URL;

        private boolean useFastParser = true;
        private int maxConsecutiveConnectionFailures = 25;
        private Set<Integer> retryPages = new TreeSet<>();

        private Builder() {}

        public Builder threadThreshold(int v) { this.threadThreshold = v; return this; }
        public Builder asyncThreshold(int v) { this.asyncThreshold = v; return this; }
        public Builder multiprocessThreshold(int v) { this.multiprocessThreshold = v; return this; }
        public Builder forceSequential(boolean v) { this.forceSequential = v; return this; }
        public Builder workerCount(int v) { this.workerCount = v; return this; }
        public Builder asyncConcurrency(int v) { this.asyncConcurrency = v; return this; }
        public Builder processCount(int v) { this.processCount = v; return this; }
        public Builder minShardSize(int v) { this.minShardSize = v; return this; }
        public Builder maxShardRestarts(int v) { this.maxShardRestarts = v; return this; }
        public Builder batchSize(int v) { this.batchSize = v; return this; }
        public Builder persistRetries(int v) { this.persistRetries = v; return this; }
        public Builder persistRetryDelay(Duration v) { this.persistRetryDelay = v; return this; }
        public Builder requestsPerSecond(double v) { this.requestsPerSecond = v; return this; }
        public Builder rateBurst(int v) { this.rateBurst = v; return this; }
        public Builder maxAttempts(int v) { this.maxAttempts = v; return this; }
        public Builder baseRetryDelay(Duration v) { this.baseRetryDelay = v; return this; }
        public Builder rateLimitCooldown(Duration v) { this.rateLimitCooldown = v; return this; }
        public Builder maxRetryAfter(Duration v) { this.maxRetryAfter = v; return this; }
        public Builder requestTimeout(Duration v) { this.requestTimeout = v; return this; }
        public Builder connectTimeout(Duration v) { this.connectTimeout = v; return this; }
        public Builder maxConnections(int v) { this.maxConnections = v; return this; }
        public Builder userAgent(String v) { this.userAgent = v; return this; }
        public Builder sourceBaseUrl(String v) { this.sourceBaseUrl = v; return this; }
        public Builder useFastParser(boolean v) { this.useFastParser = v; return this; }
        public Builder maxConsecutiveConnectionFailures(int v) { this.maxConsecutiveConnectionFailures = v; return this; }
        public Builder retryPages(Set<Integer> v) {
            this.retryPages = new TreeSet<>(Objects.requireNonNull(v, "retryPages"));
            return this;
        }

        public ExtractionConfig build() {
            validate();
            return new ExtractionConfig(this);
        }

        private void validate() {
            if (threadThreshold < 1) throw new IllegalArgumentException("threadThreshold must be >= 1");
            if (asyncThreshold < threadThreshold)
                throw new IllegalArgumentException("asyncThreshold must be >= threadThreshold");
            if (multiprocessThreshold < asyncThreshold)
                throw new IllegalArgumentException("multiprocessThreshold must be >= asyncThreshold");
            if (workerCount < 1) throw new IllegalArgumentException("workerCount must be >= 1");
            if (asyncConcurrency < 1) throw new IllegalArgumentException("asyncConcurrency must be >= 1");
            if (processCount < 1) throw new IllegalArgumentException("processCount must be >= 1");
            if (minShardSize < 1) throw new IllegalArgumentException("minShardSize must be >= 1");
            if (maxShardRestarts < 0) throw new IllegalArgumentException("maxShardRestarts must be >= 0");
            if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
            if (persistRetries < 0) throw new IllegalArgumentException("persistRetries must be >= 0");
            if (!(requestsPerSecond > 0) || Double.isInfinite(requestsPerSecond))
                throw new IllegalArgumentException("requestsPerSecond must be a positive number");
            if (rateBurst < 1) throw new IllegalArgumentException("rateBurst must be >= 1");
            if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
            if (maxConnections < 1) throw new IllegalArgumentException("maxConnections must be >= 1");
            if (maxConsecutiveConnectionFailures < 1)
                throw new IllegalArgumentException("maxConsecutiveConnectionFailures must be >= 1");
            nonNegative(persistRetryDelay, "persistRetryDelay");
            nonNegative(baseRetryDelay, "baseRetryDelay");
            nonNegative(rateLimitCooldown, "rateLimitCooldown");
            nonNegative(maxRetryAfter, "maxRetryAfter");
            positive(requestTimeout, "requestTimeout");
            positive(connectTimeout, "connectTimeout");
            if (userAgent == null || userAgent.isBlank()) throw new IllegalArgumentException("userAgent is blank");
            if (sourceBaseUrl == null || sourceBaseUrl.isBlank())
                throw new IllegalArgumentException("sourceBaseUrl is blank");
            URI u;
            try {
                u = URI.create(sourceBaseUrl.trim());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("sourceBaseUrl is not a valid URI: " + sourceBaseUrl, e);
            }
            String scheme = u.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https")) || u.getHost() == null)
                throw new IllegalArgumentException("sourceBaseUrl must be an absolute http(s) URL: " + sourceBaseUrl);
            sourceBaseUrl = sourceBaseUrl.trim();
            for (Integer p : retryPages) {
                if (p == null || p < 1) throw new IllegalArgumentException("retryPages must contain page numbers >= 1");
            }
        }

        private static void nonNegative(Duration d, String name) {
            if (d == null || d.isNegative()) throw new IllegalArgumentException(name + " must be >= 0");
        }

        private static void positive(Duration d, String name) {
            if (d == null || d.isZero() || d.isNegative()) throw new IllegalArgumentException(name + " must be > 0");
        }
    }
}
