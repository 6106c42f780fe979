package com.httpretry.core.pipeline;

import com.httpretry.core.model.HttpResponseData;
import com.httpretry.core.model.OutboundRequest;

import java.util.Objects;

/** 요청 1건의 파이프라인 문맥. send() 호출마다 새로 만들어진다. */
public final class RequestContext {
    private final TransportBinding binding;
    private OutboundRequest request;
    private HttpResponseData response;
    private Exception failure;

    RequestContext(PipelineClient client, OutboundRequest request) {
        Objects.requireNonNull(client, "client");
        this.request = Objects.requireNonNull(request, "request");
        this.binding = new TransportBinding(client.getConnector());
    }

    public TransportBinding binding() { return binding; }

    public OutboundRequest request() { return request; }

    /** REQUEST 단계 플러그인이 요청을 바꿔 끼울 때 */
    public void setRequest(OutboundRequest request) {
        this.request = Objects.requireNonNull(request, "request");
    }

    public HttpResponseData response() { return response; }
    void setResponse(HttpResponseData response) { this.response = response; }

    public Exception failure() { return failure; }
    void setFailure(Exception failure) { this.failure = failure; }
}
