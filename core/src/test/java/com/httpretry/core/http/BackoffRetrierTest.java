package com.httpretry.core.http;

import com.httpretry.core.api.IRetrier;
import com.httpretry.core.api.RetriesExhaustedException;
import com.httpretry.core.model.RetryConfig;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class BackoffRetrierTest {

    @Test
    void stops_immediately_when_attempt_returns_null() throws Exception {
        RecordingSleeper sleeper = new RecordingSleeper();
        var retrier = new BackoffRetrier(new ConstantBackoffPolicy(3, Duration.ofMillis(100)), sleeper);
        AtomicInteger n = new AtomicInteger();

        retrier.run(() -> { n.incrementAndGet(); return null; });

        assertEquals(1, n.get());
        assertThat(sleeper.sleeps).isEmpty();
    }

    @Test
    void retries_until_success_with_policy_delays() throws Exception {
        RecordingSleeper sleeper = new RecordingSleeper();
        var retrier = new BackoffRetrier(new ExponentialBackoffPolicy(5, Duration.ofMillis(100)), sleeper);
        AtomicInteger n = new AtomicInteger();

        retrier.run(() -> n.incrementAndGet() < 3 ? new IOException("boom") : null);

        assertEquals(3, n.get());
        assertThat(sleeper.sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
    }

    @Test
    void exhaustion_reports_attempts_and_last_verdict() {
        RecordingSleeper sleeper = new RecordingSleeper();
        var retrier = new BackoffRetrier(new ConstantBackoffPolicy(3, Duration.ofMillis(100)), sleeper);
        AtomicInteger n = new AtomicInteger();

        RetriesExhaustedException ex = assertThrows(RetriesExhaustedException.class,
                () -> retrier.run(() -> new IOException("fail #" + n.incrementAndGet())));

        assertEquals(3, ex.getAttempts());
        assertThat(ex.getCause()).isInstanceOf(IOException.class).hasMessage("fail #3");
        assertEquals(3, n.get());
        assertThat(sleeper.sleeps).hasSize(2);   // 시도 사이에만 대기
    }

    @Test
    void single_attempt_budget_never_sleeps() {
        RecordingSleeper sleeper = new RecordingSleeper();
        var retrier = new BackoffRetrier(new ConstantBackoffPolicy(1, Duration.ofMillis(100)), sleeper);

        assertThrows(RetriesExhaustedException.class, () -> retrier.run(() -> new IOException("x")));
        assertThat(sleeper.sleeps).isEmpty();
    }

    @Test
    void retryAfter_is_honored_and_capped_when_enabled() throws Exception {
        RecordingSleeper sleeper = new RecordingSleeper();
        var retrier = new BackoffRetrier(new ConstantBackoffPolicy(4, Duration.ofMillis(100)), sleeper,
                true, Duration.ofSeconds(5));
        AtomicInteger n = new AtomicInteger();

        retrier.run(() -> switch (n.incrementAndGet()) {
            case 1 -> new ServerResponseException(429, Duration.ofSeconds(1));
            case 2 -> new ServerResponseException(503, Duration.ofSeconds(60));
            case 3 -> new ServerResponseException(503, null);
            default -> null;
        });

        assertThat(sleeper.sleeps).containsExactly(
                Duration.ofSeconds(1), Duration.ofSeconds(5), Duration.ofMillis(100));
    }

    @Test
    void retryAfter_is_ignored_by_default() throws Exception {
        RecordingSleeper sleeper = new RecordingSleeper();
        var retrier = new BackoffRetrier(new ConstantBackoffPolicy(2, Duration.ofMillis(100)), sleeper);
        AtomicInteger n = new AtomicInteger();

        retrier.run(() -> n.incrementAndGet() == 1 ? new ServerResponseException(429, Duration.ofSeconds(9)) : null);

        assertThat(sleeper.sleeps).containsExactly(Duration.ofMillis(100));
    }

    @Test
    void interrupted_sleep_propagates() {
        var retrier = new BackoffRetrier(new ConstantBackoffPolicy(3, Duration.ofMillis(100)),
                d -> { throw new InterruptedException("stop"); });
        AtomicInteger n = new AtomicInteger();

        assertThrows(InterruptedException.class, () -> retrier.run(() -> {
            n.incrementAndGet();
            return new IOException("x");
        }));
        assertEquals(1, n.get());
    }

    @Test
    void fromConfig_builds_the_configured_policy() {
        RetryConfig cfg = RetryConfig.defaults()
                .setStrategy(RetryConfig.Strategy.EXPONENTIAL)
                .setMaxAttempts(5)
                .setWaitMs(50);

        IRetrier r = Retriers.fromConfig(cfg, new RecordingSleeper());

        assertThat(r).isInstanceOf(BackoffRetrier.class);
        RetryPolicy p = ((BackoffRetrier) r).getPolicy();
        assertThat(p).isInstanceOf(ExponentialBackoffPolicy.class);
        assertEquals(5, p.maxAttempts());
        assertEquals(Duration.ofMillis(50), p.nextDelay(1));
    }

    @Test
    void fromConfig_rejects_invalid_config_before_building() {
        RetryConfig cfg = RetryConfig.defaults().setWait(null);

        assertThrows(IllegalArgumentException.class, () -> Retriers.fromConfig(cfg, new RecordingSleeper()));
    }

    @Test
    void defaults_are_constant_three_attempts_100ms() {
        RetryPolicy p = ((BackoffRetrier) Retriers.defaults()).getPolicy();
        assertThat(p).isInstanceOf(ConstantBackoffPolicy.class);
        assertEquals(3, p.maxAttempts());
        assertEquals(Duration.ofMillis(100), p.nextDelay(2));
    }
}
