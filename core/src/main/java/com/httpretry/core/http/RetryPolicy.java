package com.httpretry.core.http;

import java.time.Duration;

/** 재시도 횟수/지연을 결정하는 백오프 정책. 재시도 여부 판정은 Evaluator 몫이다. */
public interface RetryPolicy {
    /** 최대 시도 횟수(첫 전송 포함). 예: 3이면 최대 3번 전송. */
    int maxAttempts();
    /** attempt는 1부터 시작(방금 실패한 시도 번호). 다음 시도 전 대기 시간. */
    Duration nextDelay(int attempt);
}
