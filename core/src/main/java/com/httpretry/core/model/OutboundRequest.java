package com.httpretry.core.model;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 나가는 요청(메서드/대상/헤더/본문).
 * 본문은 한 번만 읽을 수 있는 InputStream이다. 재전송이 필요하면 withBody()로 복제본을 만든다.
 */
public final class OutboundRequest {
    private final String method;
    private final URI uri;
    private final Map<String, List<String>> headers;
    private final InputStream body;      // null이면 본문 없음
    private final Duration timeout;      // null이면 전송 구현 기본값

    private OutboundRequest(Builder b) {
        this.method = b.method;
        this.uri = b.uri;
        this.headers = Collections.unmodifiableMap(copyHeaders(b.headers));
        this.body = b.body;
        this.timeout = b.timeout;
    }

    public String getMethod() { return method; }
    public URI getUri() { return uri; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public InputStream getBody() { return body; }
    public Duration getTimeout() { return timeout; }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        if (name == null) return null;
        for (var e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) {
                List<String> vs = e.getValue();
                return vs.isEmpty() ? null : vs.get(0);
            }
        }
        return null;
    }

    /** 같은 메서드/대상/헤더에 본문만 바꾼 복제본. */
    public OutboundRequest withBody(InputStream newBody) {
        return toBuilder().body(newBody).build();
    }

    /** 같은 요청에 타임아웃만 바꾼 복제본. */
    public OutboundRequest withTimeout(Duration newTimeout) {
        return toBuilder().timeout(newTimeout).build();
    }

    public Builder toBuilder() {
        Builder b = new Builder().method(method).uri(uri).body(body).timeout(timeout);
        for (var e : headers.entrySet()) b.headers.put(e.getKey(), new ArrayList<>(e.getValue()));
        return b;
    }

    @Override
    public String toString() {
        return method + " " + uri;
    }

    private static Map<String, List<String>> copyHeaders(Map<String, List<String>> src) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (var e : src.entrySet()) out.put(e.getKey(), List.copyOf(e.getValue()));
        return out;
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static Builder get(URI uri) { return new Builder().method("GET").uri(uri); }

    public static Builder post(URI uri, String body) {
        return new Builder().method("POST").uri(uri).body(body);
    }

    public static final class Builder {
        private String method = "GET";
        private URI uri;
        private final Map<String, List<String>> headers = new LinkedHashMap<>();
        private InputStream body;
        private Duration timeout;

        public Builder method(String method) {
            this.method = Objects.requireNonNull(method, "method").toUpperCase(Locale.ROOT);
            return this;
        }
        public Builder uri(URI uri) { this.uri = uri; return this; }
        public Builder uri(String uri) { this.uri = URI.create(uri); return this; }

        public Builder header(String name, String value) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
            return this;
        }
        public Builder body(InputStream body) { this.body = body; return this; }
        public Builder body(byte[] body) {
            this.body = (body == null) ? null : new ByteArrayInputStream(body.clone());
            return this;
        }
        public Builder body(String body) {
            return body((body == null) ? null : body.getBytes(StandardCharsets.UTF_8));
        }
        public Builder timeout(Duration timeout) { this.timeout = timeout; return this; }

        public OutboundRequest build() {
            Objects.requireNonNull(uri, "uri");
            return new OutboundRequest(this);
        }
    }
}
