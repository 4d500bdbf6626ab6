package com.bookharvest.core.http;

import com.bookharvest.core.api.IHttpSession;
import com.bookharvest.core.model.ExtractionConfig;
import com.bookharvest.core.model.FetchOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Semaphore;

/**
 * 책 호스트용 HTTP 세션: 재사용 HttpClient 하나 + 동시 연결 상한(세마포어).
 * 한 번의 fetch는 한 번의 시도이며 결과는 항상 FetchOutcome으로 분류된다.
 */
public class HttpSession implements IHttpSession {

    private static final Logger LOG = LoggerFactory.getLogger(HttpSession.class);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface PageSender {
        HttpResponse<String> send(HttpRequest req) throws Exception;
    }

    private final ExtractionConfig config;
    private final HttpClient client;   // 프로덕션 경로
    private final PageSender sender;   // 테스트 경로(있으면 이걸 사용)
    private final Semaphore connections;

    public HttpSession(ExtractionConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(config.getConnectTimeout())
                .build();
        this.sender = null;
        this.connections = new Semaphore(config.getMaxConnections(), true);
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpSession(ExtractionConfig config, PageSender testSender) {
        this.config = Objects.requireNonNull(config, "config");
        this.client = null;
        this.sender = Objects.requireNonNull(testSender, "testSender");
        this.connections = new Semaphore(config.getMaxConnections(), true);
    }

    @Override
    public FetchOutcome fetch(URI url) throws InterruptedException {
        Objects.requireNonNull(url, "url");
        HttpRequest req = request(url);
        connections.acquire();
        long start = System.nanoTime();
        try {
            HttpResponse<String> resp = (sender != null)
                    ? sender.send(req)
                    : client.send(req, HttpResponse.BodyHandlers.ofString());
            return classify(url, resp.statusCode(), resp.headers(), resp.body(), elapsedMs(start));
        } catch (InterruptedException ie) {
            throw ie;
        } catch (Exception e) {
            LOG.debug("GET {} failed: {}", url, e.toString());
            return connectionFailure(url, e, elapsedMs(start));
        } finally {
            connections.release();
        }
    }

    /**
     * 비동기 1회 시도. 동시 요청 수는 호출 측(AsyncTier)의 in-flight 상한이 잡는다.
     * 실패한 future는 만들지 않는다. 예외도 TRANSIENT 결과로 완료된다.
     */
    @Override
    public CompletableFuture<FetchOutcome> fetchAsync(URI url) {
        Objects.requireNonNull(url, "url");
        if (sender != null) return IHttpSession.super.fetchAsync(url);

        long start = System.nanoTime();
        return client.sendAsync(request(url), HttpResponse.BodyHandlers.ofString())
                .handle((resp, err) -> {
                    if (err != null) {
                        Throwable cause = (err instanceof CompletionException && err.getCause() != null) ? err.getCause() : err;
                        LOG.debug("async GET {} failed: {}", url, cause.toString());
                        return connectionFailure(url, cause, elapsedMs(start));
                    }
                    return classify(url, resp.statusCode(), resp.headers(), resp.body(), elapsedMs(start));
                });
    }

    private HttpRequest request(URI url) {
        return HttpRequest.newBuilder(url)
                .timeout(config.getRequestTimeout())
                .header("User-Agent", config.getUserAgent())
                .header("Accept", "text/html,application/xhtml+xml")
                .header("Accept-Language", "ar,en;q=0.8")
                .GET()
                .build();
    }

    /** 상태코드 → 결과 분류 */
    FetchOutcome classify(URI url, int status, HttpHeaders headers, String body, long elapsedMs) {
        FetchOutcome.Kind kind;
        if (status >= 200 && status < 300) {
            kind = FetchOutcome.Kind.OK;
        } else if (status == 429) {
            kind = FetchOutcome.Kind.RATE_LIMITED;
        } else if (status == 408 || status >= 500) {
            kind = FetchOutcome.Kind.TRANSIENT;
        } else {
            kind = FetchOutcome.Kind.PERMANENT;   // 404/403/410 및 기타 4xx, 따라가지 못한 3xx
        }
        Duration retryAfter = (kind == FetchOutcome.Kind.OK || kind == FetchOutcome.Kind.PERMANENT)
                ? null
                : parseRetryAfter(headers == null ? Optional.empty() : headers.firstValue("Retry-After"),
                                  config.getMaxRetryAfter());
        return FetchOutcome.builder()
                .url(url)
                .kind(kind)
                .statusCode(status)
                .body(kind == FetchOutcome.Kind.OK ? body : "")
                .retryAfter(retryAfter)
                .elapsedMs(elapsedMs)
                .build();
    }

    private static FetchOutcome connectionFailure(URI url, Throwable e, long elapsedMs) {
        return FetchOutcome.builder()
                .url(url)
                .kind(FetchOutcome.Kind.TRANSIENT)
                .statusCode(-1)
                .error(e.getClass().getSimpleName() + (e.getMessage() == null ? "" : ": " + e.getMessage()))
                .elapsedMs(elapsedMs)
                .build();
    }

    /** Retry-After(초 또는 HTTP-date)를 존중하되 상한을 둔다. 해석 불가면 null. */
    static Duration parseRetryAfter(Optional<String> header, Duration cap) {
        if (header.isEmpty()) return null;
        String v = header.get().trim();
        if (v.isEmpty()) return null;
        Duration d;
        try {
            d = Duration.ofSeconds(Math.max(0, Long.parseLong(v)));
        } catch (NumberFormatException notSeconds) {
            try {
                Instant at = ZonedDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
                d = Duration.between(Instant.now(), at);
                if (d.isNegative()) d = Duration.ZERO;
            } catch (DateTimeParseException badDate) {
                LOG.debug("Unparseable Retry-After: {}", v);
                return null;
            }
        }
        return d.compareTo(cap) > 0 ? cap : d;
    }

    private static long elapsedMs(long startNs) {
        return (System.nanoTime() - startNs) / 1_000_000;
    }
}
