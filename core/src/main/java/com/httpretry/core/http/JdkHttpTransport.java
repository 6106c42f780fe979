package com.httpretry.core.http;

import com.httpretry.core.api.ITransport;
import com.httpretry.core.model.HttpResponseData;
import com.httpretry.core.model.OutboundRequest;
import com.httpretry.core.model.RetryConfig;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/** java.net.http.HttpClient 위의 실제 네트워크 전송: 요청 1건 송신 → HttpResponseData 매핑 */
public final class JdkHttpTransport implements ITransport {

    // HttpClient가 직접 관리하는 헤더(설정하면 IllegalArgumentException)
    private static final Set<String> RESTRICTED = Set.of("connection", "content-length", "expect", "host", "upgrade");

    private final HttpClient client;
    private final Duration requestTimeout;

    public JdkHttpTransport(RetryConfig config) {
        Objects.requireNonNull(config, "config");
        RetryConfig.TransportCfg t = config.getTransport();
        this.client = HttpClient.newBuilder()
                .followRedirects(t.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(t.getConnectTimeout())
                .build();
        this.requestTimeout = t.getRequestTimeout();
    }

    public JdkHttpTransport(HttpClient client, Duration requestTimeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.requestTimeout = requestTimeout;
    }

    @Override
    public HttpResponseData send(OutboundRequest request) throws IOException, InterruptedException {
        long start = System.nanoTime();
        HttpResponse<byte[]> resp = client.send(toJdk(request), HttpResponse.BodyHandlers.ofByteArray());
        return toData(request, resp, (System.nanoTime() - start) / 1_000_000);
    }

    @Override
    public CompletableFuture<HttpResponseData> sendAsync(OutboundRequest request) {
        long start = System.nanoTime();
        HttpRequest jdk;
        try {
            jdk = toJdk(request);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(e);
        }
        return client.sendAsync(jdk, HttpResponse.BodyHandlers.ofByteArray())
                .thenApply(r -> toData(request, r, (System.nanoTime() - start) / 1_000_000));
    }

    private HttpRequest toJdk(OutboundRequest request) throws IOException {
        HttpRequest.Builder b = HttpRequest.newBuilder(request.getUri());
        Duration timeout = request.getTimeout() != null ? request.getTimeout() : requestTimeout;
        if (timeout != null) b.timeout(timeout);

        for (Map.Entry<String, List<String>> e : request.getHeaders().entrySet()) {
            if (RESTRICTED.contains(e.getKey().toLowerCase(Locale.ROOT))) continue;
            for (String v : e.getValue()) b.header(e.getKey(), v);
        }
        b.method(request.getMethod(), publisherOf(request.getBody()));
        return b.build();
    }

    // 본문을 바이트로 읽어 Content-Length가 정확히 붙도록 한다
    private static HttpRequest.BodyPublisher publisherOf(InputStream body) throws IOException {
        if (body == null) return HttpRequest.BodyPublishers.noBody();
        try (body) {
            return HttpRequest.BodyPublishers.ofByteArray(body.readAllBytes());
        }
    }

    private static HttpResponseData toData(OutboundRequest request, HttpResponse<byte[]> resp, long elapsedMs) {
        Map<String, List<String>> headers = resp.headers().map();
        return HttpResponseData.builder()
                .url(resp.uri() != null ? resp.uri() : request.getUri())
                .statusCode(resp.statusCode())
                .headers(headers)
                .body(resp.body())
                .contentType(resp.headers().firstValue("Content-Type").orElse(null))
                .responseTimeMs(elapsedMs)
                .build();
    }
}
