package com.httpretry.core.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 재시도 전송 설정 (retry.yml 매핑 대상). 순수 설정 보관용.
 * 드라이버/평가기/전송 구현은 각 팩토리(Retriers, Evaluators, JdkHttpTransport)가 이 값으로 만든다.
 *
 * 시도 횟수 규약: maxAttempts는 첫 전송을 포함한 총 전송 횟수다.
 */
public final class RetryConfig {

    /** 백오프 전략 */
    public enum Strategy { CONSTANT, EXPONENTIAL }

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_WAIT = Duration.ofMillis(100);

    /** 하부 전송 관련 하위 설정: YAML의 `transport:` 섹션과 매핑 */
    public static final class TransportCfg {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(10); // 시도 1회당
        private boolean followRedirects = true;

        public Duration getConnectTimeout() { return connectTimeout; }
        public TransportCfg setConnectTimeout(Duration v) { this.connectTimeout = v; return this; }

        public Duration getRequestTimeout() { return requestTimeout; }
        public TransportCfg setRequestTimeout(Duration v) { this.requestTimeout = v; return this; }

        public boolean isFollowRedirects() { return followRedirects; }
        public TransportCfg setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    }

    /** 평가기 관련 하위 설정: YAML의 `evaluator:` 섹션과 매핑 */
    public static final class EvaluatorCfg {
        /** 기본 규칙(>=500, 429)에 더해 재시도할 상태코드 */
        private List<Integer> retryStatuses = List.of();
        /** 기본 규칙에서 제외할 상태코드 (예: 501) */
        private List<Integer> excludeStatuses = List.of();

        public List<Integer> getRetryStatuses() { return retryStatuses; }
        public EvaluatorCfg setRetryStatuses(List<Integer> v) {
            this.retryStatuses = (v == null) ? List.of() : List.copyOf(v);
            return this;
        }

        public List<Integer> getExcludeStatuses() { return excludeStatuses; }
        public EvaluatorCfg setExcludeStatuses(List<Integer> v) {
            this.excludeStatuses = (v == null) ? List.of() : List.copyOf(v);
            return this;
        }
    }

    // ---------- 기본 필드 ----------
    private Strategy strategy = Strategy.CONSTANT;
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private Duration wait = DEFAULT_WAIT;               // CONSTANT: 매번, EXPONENTIAL: 첫 대기
    private Duration maxWait = Duration.ofSeconds(10);  // EXPONENTIAL 상한
    private double jitter = 0.0;                        // 0.1이면 ±10%

    private boolean honorRetryAfter = false;
    private Duration retryAfterCap = Duration.ofSeconds(30);

    /** 호출 전체 마감. null이면 마감 없음 */
    private Duration callTimeout;

    /** true면 동기 전송 능력이 없는 커넥터를 설치 시점에 거부한다 */
    private boolean strictTransport = false;

    private TransportCfg transport = new TransportCfg();
    private EvaluatorCfg evaluator = new EvaluatorCfg();

    public static RetryConfig defaults() { return new RetryConfig(); }

    // ---------- getters ----------
    public Strategy getStrategy() { return strategy; }
    public int getMaxAttempts() { return maxAttempts; }
    public Duration getWait() { return wait; }
    public long getWaitMs() { return wait.toMillis(); }
    public Duration getMaxWait() { return maxWait; }
    public double getJitter() { return jitter; }
    public boolean isHonorRetryAfter() { return honorRetryAfter; }
    public Duration getRetryAfterCap() { return retryAfterCap; }
    public Duration getCallTimeout() { return callTimeout; }
    public boolean isStrictTransport() { return strictTransport; }
    public TransportCfg getTransport() { return transport; }
    public EvaluatorCfg getEvaluator() { return evaluator; }

    // ---------- fluent setters ----------
    public RetryConfig setStrategy(Strategy strategy) {
        this.strategy = (strategy != null ? strategy : Strategy.CONSTANT);
        return this;
    }
    public RetryConfig setMaxAttempts(int maxAttempts) { this.maxAttempts = Math.max(1, maxAttempts); return this; }
    public RetryConfig setWait(Duration wait) { this.wait = wait; return this; }
    public RetryConfig setWaitMs(long ms) { this.wait = Duration.ofMillis(Math.max(0, ms)); return this; }
    public RetryConfig setMaxWait(Duration maxWait) { this.maxWait = maxWait; return this; }
    public RetryConfig setJitter(double jitter) { this.jitter = Math.max(0.0, Math.min(1.0, jitter)); return this; }
    public RetryConfig setHonorRetryAfter(boolean v) { this.honorRetryAfter = v; return this; }
    public RetryConfig setRetryAfterCap(Duration cap) { this.retryAfterCap = cap; return this; }

    /** null/0 이하이면 마감 없음 */
    public RetryConfig setCallTimeout(Duration callTimeout) {
        this.callTimeout = (callTimeout == null || callTimeout.isNegative() || callTimeout.isZero()) ? null : callTimeout;
        return this;
    }
    public RetryConfig setStrictTransport(boolean v) { this.strictTransport = v; return this; }
    public RetryConfig setTransport(TransportCfg transport) {
        this.transport = (transport != null ? transport : new TransportCfg());
        return this;
    }
    public RetryConfig setEvaluator(EvaluatorCfg evaluator) {
        this.evaluator = (evaluator != null ? evaluator : new EvaluatorCfg());
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(strategy, "strategy");
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (wait == null || wait.isNegative()) throw new IllegalArgumentException("wait must be >= 0");
        if (strategy == Strategy.EXPONENTIAL && (maxWait == null || maxWait.compareTo(wait) < 0))
            throw new IllegalArgumentException("maxWait must be >= wait");
        if (jitter < 0.0 || jitter > 1.0) throw new IllegalArgumentException("jitter must be in [0, 1]");
        if (retryAfterCap == null || retryAfterCap.isNegative())
            throw new IllegalArgumentException("retryAfterCap must be >= 0");

        Objects.requireNonNull(transport, "transport");
        if (transport.getConnectTimeout() == null || transport.getConnectTimeout().isNegative()
                || transport.getConnectTimeout().isZero())
            throw new IllegalArgumentException("transport.connectTimeout must be > 0");
        if (transport.getRequestTimeout() == null || transport.getRequestTimeout().isNegative()
                || transport.getRequestTimeout().isZero())
            throw new IllegalArgumentException("transport.requestTimeout must be > 0");

        Objects.requireNonNull(evaluator, "evaluator");
        for (Integer sc : evaluator.getRetryStatuses()) checkStatus(sc, "evaluator.retryStatuses");
        for (Integer sc : evaluator.getExcludeStatuses()) checkStatus(sc, "evaluator.excludeStatuses");
    }

    private static void checkStatus(Integer sc, String key) {
        if (sc == null || sc < 100 || sc > 599)
            throw new IllegalArgumentException(key + " contains invalid status code: " + sc);
    }
}
