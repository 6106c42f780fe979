package com.httpretry.core.pipeline;

import com.httpretry.core.api.IConnector;
import com.httpretry.core.api.ITransport;
import com.httpretry.core.model.HttpResponseData;
import com.httpretry.core.model.OutboundRequest;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/** 비동기 커넥터를 동기 전송 계약으로 감싼다(future 완료까지 호출 스레드가 기다림). */
public final class BlockingConnector implements ITransport {
    private final IConnector delegate;

    private BlockingConnector(IConnector delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    /** 이미 ITransport면 그대로, 아니면 감싼다. */
    public static ITransport of(IConnector connector) {
        if (connector instanceof ITransport t) return t;
        return new BlockingConnector(connector);
    }

    public IConnector delegate() { return delegate; }

    @Override
    public HttpResponseData send(OutboundRequest request) throws IOException, InterruptedException {
        CompletableFuture<HttpResponseData> f = delegate.sendAsync(request);
        try {
            return f.get();
        } catch (InterruptedException ie) {
            f.cancel(true);
            throw ie;
        } catch (ExecutionException ee) {
            Throwable c = ee.getCause();
            if (c instanceof IOException io) throw io;
            if (c instanceof InterruptedException ie) throw ie;
            if (c instanceof RuntimeException re) throw re;
            if (c instanceof Error err) throw err;
            throw new IOException(c);
        }
    }

    @Override
    public CompletableFuture<HttpResponseData> sendAsync(OutboundRequest request) {
        return delegate.sendAsync(request);
    }
}
