package com.httpretry.core.http;

import com.httpretry.core.api.IConnector;
import com.httpretry.core.api.IRetrier;
import com.httpretry.core.api.ITransport;
import com.httpretry.core.api.RetriesExhaustedException;
import com.httpretry.core.model.HttpResponseData;
import com.httpretry.core.model.OutboundRequest;
import com.httpretry.core.model.RetryStats;
import com.httpretry.core.pipeline.TransportBinding;
import com.httpretry.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * 하부 전송을 감싸 실패한 요청을 투명하게 재시도하는 전송.
 *
 * 한 번의 send() 흐름:
 *  1) 본문을 한 번 캡처(실패 시 BodyReadException, 시도 0회)
 *  2) 드라이버가 "복제 → 송신 → 평가" 시도를 반복
 *  3) 드라이버가 멈춘 이유(성공/예산 소진)와 무관하게 마지막 시도의 (응답, 오류)를 그대로 반환
 *  4) 바인딩이 있으면 모든 종료 경로에서 원래 커넥터로 되돌림
 *
 * 호출 마감(callTimeout)이 지났거나 스레드가 인터럽트되면 남은 예산을 쓰지 않고 바로 끝낸다.
 */
public final class RetryingTransport implements ITransport {

    private static final Logger LOG = LoggerFactory.getLogger(RetryingTransport.class);
    private static final StructuredLog SLOG = StructuredLog.get(RetryingTransport.class);

    private final ITransport delegate;
    private final IRetrier retrier;
    private final Evaluator evaluator;
    private final TransportBinding binding;   // null이면 복원 없음(단독 사용)
    private final IConnector restoreTo;
    private final RetryStats stats;           // null 허용
    private final Duration callTimeout;       // null이면 마감 없음
    private final Clock clock;

    private RetryingTransport(Builder b) {
        this.delegate = b.delegate;
        this.retrier = b.retrier;
        this.evaluator = b.evaluator;
        this.binding = b.binding;
        this.restoreTo = b.restoreTo;
        this.stats = b.stats;
        this.callTimeout = b.callTimeout;
        this.clock = b.clock;
    }

    public ITransport delegate() { return delegate; }
    public IRetrier retrier() { return retrier; }
    public Evaluator evaluator() { return evaluator; }

    @Override
    public HttpResponseData send(OutboundRequest request) throws IOException, InterruptedException {
        Objects.requireNonNull(request, "request");
        long t0 = System.nanoTime();
        try {
            CapturedBody body;
            try {
                body = BodyCapture.capture(request);
            } catch (BodyReadException e) {
                if (stats != null) stats.recordFatal();
                SLOG.warn("body-capture-failed", "method", request.getMethod(), "uri", request.getUri(),
                        "cause", String.valueOf(e.getCause()));
                throw e;
            }

            Call call = new Call(request, body, callTimeout == null ? null : clock.instant().plus(callTimeout));
            boolean exhausted = false;
            try {
                retrier.run(call::attempt);
            } catch (RetriesExhaustedException e) {
                // 드라이버의 소진 신호는 노출하지 않는다. 마지막 실제 시도 결과가 곧 결과다.
                exhausted = true;
                SLOG.info("retries-exhausted", "method", request.getMethod(), "uri", request.getUri(),
                        "attempts", e.getAttempts(), "last", e.getCause().getMessage());
            } finally {
                if (stats != null) stats.recordCall(call.attempts, exhausted, (System.nanoTime() - t0) / 1_000_000);
            }
            return call.outcome();
        } finally {
            if (binding != null) binding.restore(restoreTo);
        }
    }

    /** send() 1회의 상태. 시도는 순차적이라 동기화가 필요 없다. */
    private final class Call {
        private final OutboundRequest request;
        private final CapturedBody body;
        private final Instant deadline;

        private int attempts;
        private HttpResponseData lastResponse;
        private Exception lastError;

        Call(OutboundRequest request, CapturedBody body, Instant deadline) {
            this.request = request;
            this.body = body;
            this.deadline = deadline;
        }

        Exception attempt() throws InterruptedException {
            // 대기 중에 마감이 지났으면 보내지 않는다. 직전 시도의 결과가 그대로 결과가 된다.
            if (attempts > 0 && deadlinePassed()) {
                LOG.debug("call deadline passed before attempt {} for {}, not sending", attempts + 1, request);
                return null;
            }
            attempts++;
            OutboundRequest copy = prepare();
            lastResponse = null;
            lastError = null;
            try {
                lastResponse = delegate.send(copy);
            } catch (IOException | RuntimeException e) {
                lastError = e;
            }

            Exception verdict = evaluator.evaluate(lastError, lastResponse, request);
            SLOG.debug("retry-attempt", "method", request.getMethod(), "uri", request.getUri(),
                    "attempt", attempts,
                    "status", lastResponse == null ? null : lastResponse.getStatusCode(),
                    "error", lastError == null ? null : lastError.getClass().getSimpleName(),
                    "retryable", verdict != null);

            if (verdict != null && deadlinePassed()) {
                LOG.debug("call deadline passed after attempt {} for {}, not retrying", attempts, request);
                return null;
            }
            return verdict;
        }

        /** 원본 요청 + 새 본문 뷰. 마감이 있으면 시도 타임아웃을 남은 시간으로 줄인다. */
        private OutboundRequest prepare() {
            OutboundRequest copy = request.withBody(body.newView());
            if (deadline == null) return copy;
            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isNegative() || remaining.isZero()) return copy;   // 첫 시도만 해당
            Duration own = request.getTimeout();
            return (own != null && own.compareTo(remaining) <= 0) ? copy : copy.withTimeout(remaining);
        }

        private boolean deadlinePassed() {
            return deadline != null && !clock.instant().isBefore(deadline);
        }

        HttpResponseData outcome() throws IOException {
            if (attempts == 0) {
                throw new IllegalStateException("retrier " + retrier + " finished without running any attempt");
            }
            if (lastError == null) return lastResponse;
            if (lastError instanceof IOException io) throw io;
            if (lastError instanceof RuntimeException re) throw re;
            throw new IllegalStateException("unexpected transport error", lastError);
        }
    }

    // ----- 빌더 -----
    public static Builder builder(ITransport delegate) { return new Builder(delegate); }

    public static final class Builder {
        private final ITransport delegate;
        private IRetrier retrier;
        private Evaluator evaluator;
        private TransportBinding binding;
        private IConnector restoreTo;
        private RetryStats stats;
        private Duration callTimeout;
        private Clock clock = Clock.systemUTC();

        private Builder(ITransport delegate) {
            this.delegate = Objects.requireNonNull(delegate, "delegate");
        }

        /** null이면 기본 드라이버(고정 백오프 3회, 100ms) */
        public Builder retrier(IRetrier retrier) { this.retrier = retrier; return this; }
        /** null이면 기본 평가기 */
        public Builder evaluator(Evaluator evaluator) { this.evaluator = evaluator; return this; }

        /** 호출이 끝나면 binding을 restoreTo로 되돌린다. */
        public Builder bindTo(TransportBinding binding, IConnector restoreTo) {
            this.binding = Objects.requireNonNull(binding, "binding");
            this.restoreTo = Objects.requireNonNull(restoreTo, "restoreTo");
            return this;
        }
        public Builder stats(RetryStats stats) { this.stats = stats; return this; }

        /** null/0 이하이면 마감 없음 */
        public Builder callTimeout(Duration callTimeout) {
            this.callTimeout = (callTimeout == null || callTimeout.isNegative() || callTimeout.isZero()) ? null : callTimeout;
            return this;
        }
        public Builder clock(Clock clock) { this.clock = Objects.requireNonNull(clock, "clock"); return this; }

        public RetryingTransport build() {
            if (retrier == null) retrier = Retriers.defaults();
            if (evaluator == null) evaluator = Evaluators.defaultEvaluator();
            return new RetryingTransport(this);
        }
    }
}
