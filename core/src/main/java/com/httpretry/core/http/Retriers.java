package com.httpretry.core.http;

import com.httpretry.core.api.IRetrier;
import com.httpretry.core.model.RetryConfig;
import com.httpretry.core.util.DefaultSleeper;
import com.httpretry.core.util.Sleeper;

import java.time.Duration;
import java.util.Objects;

/** 내장 드라이버 팩토리: 고정 백오프 / 지수 백오프. */
public final class Retriers {
    private Retriers() {}

    /** 기본값: 고정 백오프, 총 3회, 100ms */
    public static IRetrier defaults() {
        return constant(RetryConfig.DEFAULT_MAX_ATTEMPTS, RetryConfig.DEFAULT_WAIT);
    }

    public static IRetrier constant(int maxAttempts, Duration wait) {
        return new BackoffRetrier(new ConstantBackoffPolicy(maxAttempts, wait));
    }

    public static IRetrier exponential(int maxAttempts, Duration base) {
        return new BackoffRetrier(new ExponentialBackoffPolicy(maxAttempts, base));
    }

    public static IRetrier fromConfig(RetryConfig cfg) {
        return fromConfig(cfg, new DefaultSleeper());
    }

    public static IRetrier fromConfig(RetryConfig cfg, Sleeper sleeper) {
        Objects.requireNonNull(cfg, "cfg");
        cfg.validate();
        RetryPolicy policy = switch (cfg.getStrategy()) {
            case CONSTANT -> new ConstantBackoffPolicy(cfg.getMaxAttempts(), cfg.getWait());
            case EXPONENTIAL -> new ExponentialBackoffPolicy(
                    cfg.getMaxAttempts(), cfg.getWait(), cfg.getMaxWait(), cfg.getJitter());
        };
        return new BackoffRetrier(policy, sleeper, cfg.isHonorRetryAfter(), cfg.getRetryAfterCap());
    }
}
