package com.httpretry.core.http;

import java.time.Duration;
import java.util.Objects;

/** 매 시도 사이 같은 시간만큼 대기. 기본 3회, 100ms */
public final class ConstantBackoffPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final Duration wait;

    public ConstantBackoffPolicy(int maxAttempts, Duration wait) {
        Objects.requireNonNull(wait, "wait");
        if (wait.isNegative()) throw new IllegalArgumentException("wait must be >= 0");
        this.maxAttempts = Math.max(1, maxAttempts);
        this.wait = wait;
    }

    @Override public int maxAttempts() { return maxAttempts; }
    @Override public Duration nextDelay(int attempt) { return wait; }

    @Override
    public String toString() {
        return "constant(" + maxAttempts + ", " + wait.toMillis() + "ms)";
    }
}
