package com.httpretry.core.http;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/** base → 2×base → 4×base ... (maxWait 상한, 선택적 ±jitter) */
public final class ExponentialBackoffPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;
    private final long maxMillis;
    private final double jitter;

    public ExponentialBackoffPolicy(int maxAttempts, Duration base) {
        this(maxAttempts, base, Duration.ofMillis(Long.MAX_VALUE), 0.0);
    }

    public ExponentialBackoffPolicy(int maxAttempts, Duration base, Duration maxWait, double jitter) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(maxWait, "maxWait");
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(0, base.toMillis());
        this.maxMillis = Math.max(this.baseMillis, maxWait.toMillis());
        this.jitter = Math.max(0.0, Math.min(1.0, jitter));
    }

    @Override public int maxAttempts() { return maxAttempts; }

    @Override
    public Duration nextDelay(int attempt) {
        int shift = Math.min(Math.max(0, attempt - 1), 30);   // 1,2,4... (오버플로 방지)
        long raw = baseMillis << shift;
        if (raw < 0 || raw > maxMillis) raw = maxMillis;
        if (jitter == 0.0) return Duration.ofMillis(raw);
        double factor = (1.0 - jitter) + ThreadLocalRandom.current().nextDouble(2 * jitter);
        return Duration.ofMillis((long) (raw * factor));
    }

    @Override
    public String toString() {
        return "exponential(" + maxAttempts + ", " + baseMillis + "ms)";
    }
}
