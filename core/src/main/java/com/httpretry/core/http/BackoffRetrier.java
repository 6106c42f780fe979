package com.httpretry.core.http;

import com.httpretry.core.api.IRetrier;
import com.httpretry.core.api.RetriesExhaustedException;
import com.httpretry.core.util.DefaultSleeper;
import com.httpretry.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * RetryPolicy 하나로 시도 함수를 반복 실행하는 기본 드라이버.
 * 시도는 순차적이며 대기는 호출 스레드를 막는다. 세션 상태(시도 수)는 run() 호출 안에서만 산다.
 * 상태가 없으므로 여러 호출/스레드가 하나의 인스턴스를 공유해도 된다.
 */
public final class BackoffRetrier implements IRetrier {

    private static final Logger LOG = LoggerFactory.getLogger(BackoffRetrier.class);

    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final boolean honorRetryAfter;
    private final Duration retryAfterCap;

    public BackoffRetrier(RetryPolicy policy) {
        this(policy, new DefaultSleeper(), false, Duration.ofSeconds(30));
    }

    public BackoffRetrier(RetryPolicy policy, Sleeper sleeper) {
        this(policy, sleeper, false, Duration.ofSeconds(30));
    }

    /** honorRetryAfter면 ServerResponseException의 Retry-After를 정책 지연보다 우선(상한 retryAfterCap) */
    public BackoffRetrier(RetryPolicy policy, Sleeper sleeper, boolean honorRetryAfter, Duration retryAfterCap) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.honorRetryAfter = honorRetryAfter;
        this.retryAfterCap = Objects.requireNonNull(retryAfterCap, "retryAfterCap");
    }

    public RetryPolicy getPolicy() { return policy; }

    @Override
    public void run(Attempt attempt) throws RetriesExhaustedException, InterruptedException {
        Objects.requireNonNull(attempt, "attempt");
        int n = 0;
        while (true) {
            n++;
            Exception verdict = attempt.run();
            if (verdict == null) return;
            if (n >= policy.maxAttempts()) {
                throw new RetriesExhaustedException(n, verdict);
            }
            Duration delay = resolveDelay(policy.nextDelay(n), verdict);
            LOG.debug("attempt {} failed ({}), next in {}ms", n, verdict.getMessage(), delay.toMillis());
            sleeper.sleep(delay);
        }
    }

    private Duration resolveDelay(Duration fallback, Exception verdict) {
        if (!honorRetryAfter || !(verdict instanceof ServerResponseException sre)) return fallback;
        Optional<Duration> ra = sre.getRetryAfter();
        if (ra.isEmpty()) return fallback;
        return ra.get().compareTo(retryAfterCap) > 0 ? retryAfterCap : ra.get();
    }

    @Override
    public String toString() {
        return "BackoffRetrier{" + policy + (honorRetryAfter ? ", retry-after" : "") + "}";
    }
}
