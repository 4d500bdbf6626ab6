package com.bookharvest.core.tier.multiprocess;

import com.bookharvest.core.model.Book;
import com.bookharvest.core.model.ExtractionConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 부모 → 워커로 stdin 한 줄(JSON)로 넘기는 작업 지시서.
 * 워커가 필요한 설정만 단순 타입으로 싣는다.
 */
public final class ShardAssignment {
    private String bookId;
    private int totalPages;
    private String sourceBaseUrl;
    private int shardIndex;
    private int attempt;
    private int[] pages;

    private int workerCount;
    private double requestsPerSecond;
    private int rateBurst;
    private int maxAttempts;
    private long baseRetryDelayMs;
    private long rateLimitCooldownMs;
    private long maxRetryAfterMs;
    private long requestTimeoutMs;
    private long connectTimeoutMs;
    private int maxConnections;
    private String userAgent;
    private boolean useFastParser;
    private int maxConsecutiveConnectionFailures;

    private ShardAssignment() {}

    /**
     * @param requestsPerSecond 이 워커 몫의 요청률(전체 rps / 샤드 수)
     */
    public static ShardAssignment of(Book book, int shardIndex, int attempt, List<Integer> pages,
                                     ExtractionConfig cfg, double requestsPerSecond) {
        ShardAssignment a = new ShardAssignment();
        a.bookId = book.getId();
        a.totalPages = book.getTotalPages();
        a.sourceBaseUrl = book.getSourceBaseUrl();
        a.shardIndex = shardIndex;
        a.attempt = attempt;
        a.pages = pages.stream().mapToInt(Integer::intValue).toArray();
        a.workerCount = cfg.getWorkerCount();
        a.requestsPerSecond = requestsPerSecond;
        a.rateBurst = cfg.getRateBurst();
        a.maxAttempts = cfg.getMaxAttempts();
        a.baseRetryDelayMs = cfg.getBaseRetryDelay().toMillis();
        a.rateLimitCooldownMs = cfg.getRateLimitCooldown().toMillis();
        a.maxRetryAfterMs = cfg.getMaxRetryAfter().toMillis();
        a.requestTimeoutMs = cfg.getRequestTimeout().toMillis();
        a.connectTimeoutMs = cfg.getConnectTimeout().toMillis();
        a.maxConnections = cfg.getMaxConnections();
        a.userAgent = cfg.getUserAgent();
        a.useFastParser = cfg.isUseFastParser();
        a.maxConsecutiveConnectionFailures = cfg.getMaxConsecutiveConnectionFailures();
        return a;
    }

    public Book book() { return new Book(bookId, totalPages, sourceBaseUrl); }

    public int shardIndex() { return shardIndex; }
    public int attempt() { return attempt; }

    public List<Integer> pageList() {
        List<Integer> out = new ArrayList<>(pages == null ? 0 : pages.length);
        if (pages != null) for (int p : pages) out.add(p);
        return out;
    }

    /** 워커 쪽 설정. 워커는 샤드 하나만 돌리므로 티어 임계값은 쓰지 않는다. */
    public ExtractionConfig toConfig() {
        return ExtractionConfig.builder()
                .workerCount(workerCount)
                .requestsPerSecond(requestsPerSecond)
                .rateBurst(rateBurst)
                .maxAttempts(maxAttempts)
                .baseRetryDelay(Duration.ofMillis(baseRetryDelayMs))
                .rateLimitCooldown(Duration.ofMillis(rateLimitCooldownMs))
                .maxRetryAfter(Duration.ofMillis(maxRetryAfterMs))
                .requestTimeout(Duration.ofMillis(requestTimeoutMs))
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .maxConnections(maxConnections)
                .userAgent(userAgent)
                .sourceBaseUrl(sourceBaseUrl)
                .useFastParser(useFastParser)
                .maxConsecutiveConnectionFailures(maxConsecutiveConnectionFailures)
                .build();
    }

    @Override public String toString() {
        return "ShardAssignment{book=" + bookId + ", shard=" + shardIndex + ", attempt=" + attempt
                + ", pages=" + (pages == null ? 0 : pages.length) + ", rps=" + requestsPerSecond + "}";
    }
}
