package com.httpretry.core.util;

import com.httpretry.core.model.RetryConfig;
import com.httpretry.core.model.RetryConfig.Strategy;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * retry.yml을 읽어 RetryConfig로 변환.
 *
 * 예상 YAML 키:
 * strategy: constant | exponential
 * maxAttempts: 3          # 첫 전송 포함 총 횟수
 * waitMs: 100
 * maxWaitMs: 10000        # exponential 상한
 * jitter: 0.1             # ±10%
 * honorRetryAfter: false
 * retryAfterCapMs: 30000
 * callTimeoutMs: 0        # 0이면 마감 없음
 * strictTransport: false
 *
 * transport:
 *   connectTimeoutMs: 10000
 *   requestTimeoutMs: 10000
 *   followRedirects: true
 *
 * evaluator:
 *   retryStatuses: [408]
 *   excludeStatuses: [501]
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static RetryConfig loadDefault() throws IOException {
        return load(Path.of("retry.yml"));
    }

    public static RetryConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("retry.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static RetryConfig load(InputStream in) {
        Objects.requireNonNull(in, "in");
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        RetryConfig cfg = RetryConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setStrategy(map, cfg::setStrategy);
        setInt(map, "maxAttempts", cfg::setMaxAttempts);
        setLong(map, "waitMs", cfg::setWaitMs);
        setMillis(map, "maxWaitMs", cfg::setMaxWait);
        setDouble(map, "jitter", cfg::setJitter);
        setBoolean(map, "honorRetryAfter", cfg::setHonorRetryAfter);
        setMillis(map, "retryAfterCapMs", cfg::setRetryAfterCap);
        setMillis(map, "callTimeoutMs", cfg::setCallTimeout);
        setBoolean(map, "strictTransport", cfg::setStrictTransport);

        // 2) transport.*
        Map<?, ?> transport = getMap(map, "transport");
        if (transport != null) {
            var t = cfg.getTransport();
            setMillis(transport, "connectTimeoutMs", t::setConnectTimeout);
            setMillis(transport, "requestTimeoutMs", t::setRequestTimeout);
            setBoolean(transport, "followRedirects", t::setFollowRedirects);
        }

        // 3) evaluator.*
        Map<?, ?> evaluator = getMap(map, "evaluator");
        if (evaluator != null) {
            var e = cfg.getEvaluator();
            setIntList(evaluator, "retryStatuses", e::setRetryStatuses);
            setIntList(evaluator, "excludeStatuses", e::setExcludeStatuses);
        }

        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    private static Map<?, ?> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        return (v instanceof Map<?, ?> m) ? m : null;
    }

    private static void setStrategy(Map<?, ?> map, Consumer<Strategy> setter) {
        Object v = map.get("strategy");
        if (v == null) return;
        String s = String.valueOf(v).trim().toUpperCase(Locale.ROOT);
        try {
            setter.accept(Strategy.valueOf(s));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown strategy: " + v + " (constant|exponential)", e);
        }
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, Consumer<Integer> setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, Consumer<Long> setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static void setDouble(Map<?, ?> map, String key, Consumer<Double> setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.doubleValue());
        else if (v != null) setter.accept(Double.parseDouble(String.valueOf(v).trim()));
    }

    private static void setMillis(Map<?, ?> map, String key, Consumer<Duration> setter) {
        setLong(map, key, ms -> setter.accept(Duration.ofMillis(ms)));
    }

    private static void setIntList(Map<?, ?> map, String key, Consumer<List<Integer>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<Integer> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(Integer.parseInt(String.valueOf(o).trim()));
        } else {
            // "408, 425" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) {
                if (!p.isEmpty()) out.add(Integer.parseInt(p));
            }
        }
        setter.accept(List.copyOf(out));
    }
}
