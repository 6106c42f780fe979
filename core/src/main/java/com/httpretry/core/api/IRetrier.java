// IRetrier.java
package com.httpretry.core.api;

/**
 * 재시도 드라이버 최소 계약: "몇 번, 얼마나 기다릴지"는 구현체가 소유한다.
 * 호출자는 시도 함수만 넘긴다.
 */
public interface IRetrier {

    /** 한 번의 시도. null을 돌려주면 종료, 예외 값을 돌려주면 예산이 남는 한 다시 시도. */
    @FunctionalInterface
    interface Attempt {
        Exception run() throws InterruptedException;
    }

    /**
     * attempt가 null을 돌려줄 때까지 정책에 따라 반복 실행한다.
     *
     * @throws RetriesExhaustedException 예산을 다 쓰고도 종료 신호를 받지 못한 경우
     * @throws InterruptedException      대기 중 또는 시도 중 인터럽트
     */
    void run(Attempt attempt) throws RetriesExhaustedException, InterruptedException;
}
