package com.bookharvest.core.model;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * 단일 HTTP 시도의 결과. 네트워크 예외도 여기로 흡수된다(status -1).
 */
public final class FetchOutcome {

    public enum Kind {
        /** 2xx */
        OK,
        /** 타임아웃/연결 오류/5xx/408: 백오프 후 재시도 */
        TRANSIENT,
        /** 429: 재시도 + 추가 쿨다운 */
        RATE_LIMITED,
        /** 그 밖의 4xx: 재시도 없이 Missing */
        PERMANENT
    }

    private final URI url;
    private final Kind kind;
    private final int statusCode;       // 예외 시 -1
    private final String body;
    private final Duration retryAfter;  // 서버가 준 Retry-After(상한 적용), 없으면 null
    private final String error;
    private final long elapsedMs;

    private FetchOutcome(Builder b) {
        this.url = b.url;
        this.kind = Objects.requireNonNull(b.kind, "kind");
        this.statusCode = b.statusCode;
        this.body = b.body == null ? "" : b.body;
        this.retryAfter = b.retryAfter;
        this.error = b.error;
        this.elapsedMs = b.elapsedMs;
    }

    public static Builder builder() { return new Builder(); }

    public URI getUrl() { return url; }
    public Kind getKind() { return kind; }
    public int getStatusCode() { return statusCode; }
    public String getBody() { return body; }
    public Duration getRetryAfter() { return retryAfter; }
    public String getError() { return error; }
    public long getElapsedMs() { return elapsedMs; }

    public boolean isOk() { return kind == Kind.OK; }

    /** 응답조차 못 받은 연결 수준 실패 */
    public boolean isConnectionFailure() { return statusCode == -1; }

    /** 로그/lastError용 짧은 설명 */
    public String describe() {
        if (statusCode == -1) return "connection failure: " + (error == null ? "unknown" : error);
        return "HTTP " + statusCode;
    }

    @Override public String toString() {
        return "FetchOutcome{" + kind + ", " + describe() + ", " + elapsedMs + "ms, url=" + url + "}";
    }

    public static final class Builder {
        private URI url;
        private Kind kind;
        private int statusCode;
        private String body;
        private Duration retryAfter;
        private String error;
        private long elapsedMs;

        public Builder url(URI v) { this.url = v; return this; }
        public Builder kind(Kind v) { this.kind = v; return this; }
        public Builder statusCode(int v) { this.statusCode = v; return this; }
        public Builder body(String v) { this.body = v; return this; }
        public Builder retryAfter(Duration v) { this.retryAfter = v; return this; }
        public Builder error(String v) { this.error = v; return this; }
        public Builder elapsedMs(long v) { this.elapsedMs = v; return this; }
        public FetchOutcome build() { return new FetchOutcome(this); }
    }
}
