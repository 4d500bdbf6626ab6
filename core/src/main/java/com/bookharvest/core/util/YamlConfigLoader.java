package com.bookharvest.core.util;

import com.bookharvest.core.model.ExtractionConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.IntConsumer;

/**
 * harvest.yml을 읽어 ExtractionConfig로 변환.
 *
 * 각 키는 최상위(평면)에 써도 되고 해당 섹션 아래에 써도 된다. 둘 다 있으면 섹션이 이긴다.
 *
 * sourceBaseUrl: "https://shamela.ws"
 * useFastParser: true
 * retryPages: [12, 40]
 *
 * tiers:
 *   threadThreshold: 10
 *   asyncThreshold: 500
 *   multiprocessThreshold: 1000
 *   forceSequential: false
 *   workerCount: 8
 *   asyncConcurrency: 15
 *
 * http:
 *   requestsPerSecond: 5.0      # rps 도 허용
 *   rateBurst: 1
 *   maxAttempts: 3
 *   baseRetryDelayMs: 500
 *   rateLimitCooldownMs: 5000
 *   maxRetryAfterMs: 30000
 *   requestTimeoutMs: 30000
 *   connectTimeoutMs: 15000
 *   maxConnections: 30
 *   userAgent: "bookharvest/0.1"
 *   maxConsecutiveConnectionFailures: 25
 *
 * multiprocess:
 *   processCount: 4
 *   minShardSize: 100
 *   maxShardRestarts: 2
 *
 * persistence:
 *   batchSize: 50
 *   persistRetries: 3
 *   persistRetryDelayMs: 1000
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "harvest.yml";

    private YamlConfigLoader() {}

    public static ExtractionConfig loadDefault() throws IOException {
        return load(Path.of(DEFAULT_FILE));
    }

    public static ExtractionConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException(DEFAULT_FILE + " not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            Object root = yaml.load(in);

            ExtractionConfig.Builder b = ExtractionConfig.builder();

            if (!(root instanceof Map<?, ?> map)) {
                // 비어있거나 단순 스칼라면 defaults 유지
                return b.build();
            }

            // 1) 평면 키
            setString(map, "sourceBaseUrl", b::sourceBaseUrl);
            setBoolean(map, "useFastParser", b::useFastParser);
            setIntSet(map, "retryPages", b::retryPages);
            applyTiers(map, b);
            applyHttp(map, b);
            applyMultiprocess(map, b);
            applyPersistence(map, b);

            // 2) 섹션
            Map<String, Object> tiers = getMap(map, "tiers");
            if (tiers != null) applyTiers(tiers, b);

            Map<String, Object> http = getMap(map, "http");
            if (http != null) applyHttp(http, b);

            Map<String, Object> mp = getMap(map, "multiprocess");
            if (mp != null) applyMultiprocess(mp, b);

            Map<String, Object> persistence = getMap(map, "persistence");
            if (persistence != null) applyPersistence(persistence, b);

            // 범위 검증은 build()에서
            return b.build();
        }
    }

    private static void applyTiers(Map<?, ?> m, ExtractionConfig.Builder b) {
        setInt(m, "threadThreshold", b::threadThreshold);
        setInt(m, "asyncThreshold", b::asyncThreshold);
        setInt(m, "multiprocessThreshold", b::multiprocessThreshold);
        setBoolean(m, "forceSequential", b::forceSequential);
        setInt(m, "workerCount", b::workerCount);
        setInt(m, "asyncConcurrency", b::asyncConcurrency);
    }

    private static void applyHttp(Map<?, ?> m, ExtractionConfig.Builder b) {
        setDouble(m, "rps", b::requestsPerSecond);
        setDouble(m, "requestsPerSecond", b::requestsPerSecond);
        setInt(m, "rateBurst", b::rateBurst);
        setInt(m, "maxAttempts", b::maxAttempts);
        setDurationMs(m, "baseRetryDelayMs", b::baseRetryDelay);
        setDurationMs(m, "rateLimitCooldownMs", b::rateLimitCooldown);
        setDurationMs(m, "maxRetryAfterMs", b::maxRetryAfter);
        setDurationMs(m, "requestTimeoutMs", b::requestTimeout);
        setDurationMs(m, "connectTimeoutMs", b::connectTimeout);
        setInt(m, "maxConnections", b::maxConnections);
        setString(m, "userAgent", b::userAgent);
        setInt(m, "maxConsecutiveConnectionFailures", b::maxConsecutiveConnectionFailures);
    }

    private static void applyMultiprocess(Map<?, ?> m, ExtractionConfig.Builder b) {
        setInt(m, "processCount", b::processCount);
        setInt(m, "minShardSize", b::minShardSize);
        setInt(m, "maxShardRestarts", b::maxShardRestarts);
    }

    private static void applyPersistence(Map<?, ?> m, ExtractionConfig.Builder b) {
        setInt(m, "batchSize", b::batchSize);
        setInt(m, "persistRetries", b::persistRetries);
        setDurationMs(m, "persistRetryDelayMs", b::persistRetryDelay);
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setDouble(Map<?, ?> map, String key, DoubleConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.doubleValue());
        else if (v != null) setter.accept(Double.parseDouble(String.valueOf(v).trim()));
    }

    /** 0 허용(재시도 지연 없음). 음수는 build()가 거부한다. */
    private static void setDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        setter.accept(Duration.ofMillis(ms));
    }

    private static void setIntSet(Map<?, ?> map, String key, Consumer<Set<Integer>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        Set<Integer> out = new TreeSet<>();
        if (v instanceof List<?> list) {
            for (Object o : list) {
                if (o instanceof Number n) out.add(n.intValue());
                else if (o != null) out.add(Integer.parseInt(String.valueOf(o).trim()));
            }
        } else {
            // "12, 40" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) {
                if (!p.isEmpty()) out.add(Integer.parseInt(p));
            }
        }
        setter.accept(out);
    }
}
