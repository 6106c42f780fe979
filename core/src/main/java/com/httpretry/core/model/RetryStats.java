package com.httpretry.core.model;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/** 재시도 전송 텔레메트리 누적기 (스레드 세이프). 여러 호출이 하나의 인스턴스를 공유해도 된다. */
public final class RetryStats {
    private final AtomicLong callsTotal     = new AtomicLong(0); // send() 호출 수
    private final AtomicLong attemptsTotal  = new AtomicLong(0); // 실제 전송(재시도 포함) 총합
    private final AtomicLong retriesTotal   = new AtomicLong(0); // attempts - 1 의 합
    private final AtomicLong exhaustedTotal = new AtomicLong(0); // 예산 소진으로 끝난 호출
    private final AtomicLong fatalTotal     = new AtomicLong(0); // 시도 전 실패(본문 읽기 등)
    private final AtomicLong sumWallMs      = new AtomicLong(0); // 호출별 벽시계 합(대기 포함)

    /** 호출 1건 종료 시 기록. attempts = 1 + retries */
    public void recordCall(int attempts, boolean exhausted, long wallMs) {
        callsTotal.incrementAndGet();
        attemptsTotal.addAndGet(attempts);
        retriesTotal.addAndGet(Math.max(0, attempts - 1));
        if (exhausted) exhaustedTotal.incrementAndGet();
        sumWallMs.addAndGet(Math.max(0, wallMs));
    }

    public void recordFatal() {
        callsTotal.incrementAndGet();
        fatalTotal.incrementAndGet();
    }

    public Snapshot snapshot() {
        long calls = callsTotal.get();
        long avgCallMs = sumWallMs.get() / Math.max(1, calls - fatalTotal.get());
        return new Snapshot(Instant.now(), calls, attemptsTotal.get(), retriesTotal.get(),
                exhaustedTotal.get(), fatalTotal.get(), avgCallMs);
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final Instant takenAt;
        public final long callsTotal;
        public final long attemptsTotal;
        public final long retriesTotal;
        public final long exhaustedTotal;
        public final long fatalTotal;
        public final long avgCallMs;

        public Snapshot(Instant takenAt, long calls, long attempts, long retries,
                        long exhausted, long fatal, long avgCallMs) {
            this.takenAt = takenAt;
            this.callsTotal = calls;
            this.attemptsTotal = attempts;
            this.retriesTotal = retries;
            this.exhaustedTotal = exhausted;
            this.fatalTotal = fatal;
            this.avgCallMs = avgCallMs;
        }
    }
}
