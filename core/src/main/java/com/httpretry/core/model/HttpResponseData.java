package com.httpretry.core.model;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** 한 번의 전송으로 얻은 HTTP 응답(본문은 바이트 그대로 보관) */
public final class HttpResponseData {
    private final URI url;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final byte[] body;
    private final String contentType;
    private final long responseTimeMs;

    private HttpResponseData(Builder b) {
        this.url = b.url;
        this.statusCode = b.statusCode;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(b.headers);
        this.body = (b.body == null) ? new byte[0] : b.body;
        this.contentType = b.contentType;
        this.responseTimeMs = b.responseTimeMs;
    }

    public URI getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public String getContentType() { return contentType; }
    public long getResponseTimeMs() { return responseTimeMs; }

    /** 본문 사본. */
    public byte[] getBody() { return body.clone(); }

    /** UTF-8 텍스트로 본 본문. */
    public String bodyAsString() { return new String(body, StandardCharsets.UTF_8); }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        if (name == null) return null;
        for (var e : headers.entrySet()) {
            final String k = e.getKey();
            if (k != null && k.equalsIgnoreCase(name)) {
                final List<String> vs = e.getValue();
                return (vs == null || vs.isEmpty()) ? null : vs.get(0);
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "HttpResponseData{" + statusCode + " " + url + ", " + body.length + " bytes}";
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI url;
        private int statusCode;
        private Map<String, List<String>> headers;
        private byte[] body;
        private String contentType;
        private long responseTimeMs;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder body(byte[] body) { this.body = (body == null) ? null : body.clone(); return this; }
        public Builder body(String body) {
            this.body = (body == null) ? null : body.getBytes(StandardCharsets.UTF_8);
            return this;
        }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder responseTimeMs(long responseTimeMs) { this.responseTimeMs = responseTimeMs; return this; }

        public HttpResponseData build() {
            Objects.requireNonNull(url, "url");
            return new HttpResponseData(this);
        }
    }
}
