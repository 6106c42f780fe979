package com.httpretry.core.api;

/** 재시도 드라이버가 시도 예산을 모두 소진했음을 알린다. cause = 마지막 시도의 판정 결과. */
public class RetriesExhaustedException extends Exception {
    private final int attempts;

    public RetriesExhaustedException(int attempts, Exception lastVerdict) {
        super("retries exhausted after " + attempts + " attempt(s)", lastVerdict);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
