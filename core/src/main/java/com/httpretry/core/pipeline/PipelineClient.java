package com.httpretry.core.pipeline;

import com.httpretry.core.api.IConnector;
import com.httpretry.core.model.HttpResponseData;
import com.httpretry.core.model.OutboundRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 플러그인 파이프라인을 가진 최소 HTTP 클라이언트.
 *  - 클라이언트 단위 플러그인(use) + 요청 단위 플러그인(send의 가변 인자)
 *  - 단계 순서: REQUEST → BEFORE_DIAL → 송신, 같은 단계는 등록 순서
 *  - 송신은 요청 문맥의 TransportBinding이 가리키는 커넥터로 한다
 *
 * 클라이언트의 커넥터는 생성 후 바뀌지 않으므로 여러 스레드가 하나의 클라이언트로 동시에 보내도 된다.
 */
public final class PipelineClient {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineClient.class);

    private final IConnector connector;
    private final List<Plugin> plugins = new CopyOnWriteArrayList<>();

    public PipelineClient(IConnector connector) {
        this.connector = Objects.requireNonNull(connector, "connector");
    }

    public IConnector getConnector() { return connector; }

    public PipelineClient use(Plugin plugin) {
        plugins.add(Objects.requireNonNull(plugin, "plugin"));
        return this;
    }

    public HttpResponseData send(OutboundRequest request, Plugin... requestPlugins)
            throws IOException, InterruptedException {
        List<Plugin> ordered = new ArrayList<>(plugins);
        if (requestPlugins != null) {
            for (Plugin p : requestPlugins) ordered.add(Objects.requireNonNull(p, "plugin"));
        }
        ordered.sort(Comparator.comparing(Plugin::phase)); // 안정 정렬: 같은 단계는 등록 순서 유지

        RequestContext ctx = new RequestContext(this, request);
        new Step(ordered, 0).next(ctx);

        if (ctx.failure() != null) {
            LOG.debug("pipeline aborted for {}: {}", request, ctx.failure().toString());
            throw new PipelineException("pipeline aborted: " + ctx.failure().getMessage(), ctx.failure());
        }
        if (ctx.response() == null) {
            throw new PipelineException("pipeline did not reach dispatch for " + request, null);
        }
        return ctx.response();
    }

    private void dispatch(RequestContext ctx) throws IOException, InterruptedException {
        var transport = BlockingConnector.of(ctx.binding().current());
        ctx.setResponse(transport.send(ctx.request()));
    }

    /** plugins[index]부터 이어가는 1회용 핸들 */
    private final class Step implements Chain {
        private final List<Plugin> chain;
        private final int index;
        private boolean used;

        Step(List<Plugin> chain, int index) {
            this.chain = chain;
            this.index = index;
        }

        @Override
        public void next(RequestContext ctx) throws IOException, InterruptedException {
            markUsed();
            if (index < chain.size()) {
                chain.get(index).handle(ctx, new Step(chain, index + 1));
            } else {
                dispatch(ctx);
            }
        }

        @Override
        public void fail(RequestContext ctx, Exception cause) {
            markUsed();
            ctx.setFailure(Objects.requireNonNull(cause, "cause"));
        }

        private void markUsed() {
            if (used) throw new IllegalStateException("chain continuation already used");
            used = true;
        }
    }
}
