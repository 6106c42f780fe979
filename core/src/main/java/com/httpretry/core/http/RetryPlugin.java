package com.httpretry.core.http;

import com.httpretry.core.api.IConnector;
import com.httpretry.core.api.IRetrier;
import com.httpretry.core.api.ITransport;
import com.httpretry.core.model.RetryConfig;
import com.httpretry.core.model.RetryStats;
import com.httpretry.core.pipeline.BlockingConnector;
import com.httpretry.core.pipeline.Chain;
import com.httpretry.core.pipeline.Phase;
import com.httpretry.core.pipeline.Plugin;
import com.httpretry.core.pipeline.RequestContext;
import com.httpretry.core.pipeline.TransportBinding;
import com.httpretry.core.util.StructuredLog;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * 송신 직전(BEFORE_DIAL)에 요청 문맥의 커넥터를 RetryingTransport로 바꿔 끼우는 설치기.
 *
 * 엄격 모드(strict)는 동기 송신 능력(ITransport)이 없는 커넥터를 설정 오류로 거부하고
 * 파이프라인을 중단한다. 기본 모드는 어떤 커넥터든 BlockingConnector로 감싸 설치한다.
 */
public final class RetryPlugin implements Plugin {

    private static final StructuredLog SLOG = StructuredLog.get(RetryPlugin.class);

    private final IRetrier retrier;
    private final Evaluator evaluator;
    private final boolean strict;
    private final RetryStats stats;
    private final Duration callTimeout;

    private RetryPlugin(IRetrier retrier, Evaluator evaluator, boolean strict, RetryStats stats, Duration callTimeout) {
        this.retrier = (retrier != null) ? retrier : Retriers.defaults();
        this.evaluator = (evaluator != null) ? evaluator : Evaluators.defaultEvaluator();
        this.strict = strict;
        this.stats = stats;
        this.callTimeout = callTimeout;
    }

    /** 기본 드라이버 + 기본 평가기 */
    public static RetryPlugin create() { return create(null, null); }

    /** retrier가 null이면 기본 드라이버(고정 백오프 3회, 100ms) */
    public static RetryPlugin create(IRetrier retrier) { return create(retrier, null); }

    public static RetryPlugin create(IRetrier retrier, Evaluator evaluator) {
        return new RetryPlugin(retrier, evaluator, false, null, null);
    }

    public static RetryPlugin strict(IRetrier retrier, Evaluator evaluator) {
        return new RetryPlugin(retrier, evaluator, true, null, null);
    }

    public static RetryPlugin fromConfig(RetryConfig cfg) {
        Objects.requireNonNull(cfg, "cfg");
        cfg.validate();
        return new RetryPlugin(Retriers.fromConfig(cfg), Evaluators.fromConfig(cfg),
                cfg.isStrictTransport(), null, cfg.getCallTimeout());
    }

    public RetryPlugin withStats(RetryStats stats) {
        return new RetryPlugin(retrier, evaluator, strict, stats, callTimeout);
    }

    public RetryPlugin withCallTimeout(Duration callTimeout) {
        return new RetryPlugin(retrier, evaluator, strict, stats, callTimeout);
    }

    public boolean isStrict() { return strict; }

    @Override
    public Phase phase() { return Phase.BEFORE_DIAL; }

    @Override
    public void handle(RequestContext ctx, Chain chain) throws IOException, InterruptedException {
        IConnector replaced = ctx.binding().current();
        try {
            interceptTransport(ctx);
        } catch (TransportUnsupportedException e) {
            SLOG.warn("transport-unsupported", "uri", ctx.request().getUri(), "connector", replaced.getClass().getName());
            chain.fail(ctx, e);
            return;
        }
        try {
            chain.next(ctx);
        } finally {
            ctx.binding().restore(replaced);
        }
    }

    /**
     * 요청 문맥의 바인딩을 RetryingTransport로 교체한다. 클라이언트의 커넥터는 건드리지 않는다.
     *
     * @throws TransportUnsupportedException 엄격 모드에서 현재 커넥터가 ITransport가 아닐 때
     */
    public RetryingTransport interceptTransport(RequestContext ctx) {
        Objects.requireNonNull(ctx, "ctx");
        TransportBinding binding = ctx.binding();
        IConnector current = binding.current();

        ITransport base;
        if (current instanceof ITransport t) {
            base = t;
        } else if (strict) {
            throw new TransportUnsupportedException(current.getClass());
        } else {
            base = BlockingConnector.of(current);
        }

        RetryingTransport rt = RetryingTransport.builder(base)
                .retrier(retrier)
                .evaluator(evaluator)
                .stats(stats)
                .callTimeout(callTimeout)
                .bindTo(binding, current)
                .build();
        binding.swap(rt);
        SLOG.debug("transport-installed", "uri", ctx.request().getUri(), "retrier", String.valueOf(retrier));
        return rt;
    }
}
