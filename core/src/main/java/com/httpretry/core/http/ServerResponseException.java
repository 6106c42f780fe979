package com.httpretry.core.http;

import com.httpretry.core.model.HttpResponseData;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * "서버가 과부하/실패/속도제한을 알렸다"는 재시도 표식 (기본: status >= 500 또는 429).
 * 평가기가 드라이버에게 돌려주는 값이며 호출자에게 던져지지 않는다.
 * 호출자는 마지막 시도의 응답을 그대로 받는다.
 */
public class ServerResponseException extends Exception {
    private final int statusCode;
    private final Duration retryAfter; // null이면 헤더 없음/해석 불가

    public ServerResponseException(int statusCode, Duration retryAfter) {
        super("retry: server response error (status " + statusCode + ")");
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
    }

    /** 응답의 상태코드와 Retry-After(초 단위 형식만)를 담는다. */
    public static ServerResponseException of(HttpResponseData response) {
        Objects.requireNonNull(response, "response");
        return new ServerResponseException(response.getStatusCode(), parseRetryAfter(response.header("Retry-After")));
    }

    public int getStatusCode() { return statusCode; }

    public Optional<Duration> getRetryAfter() { return Optional.ofNullable(retryAfter); }

    // HTTP-date 형태는 해석하지 않는다(정책 지연 사용)
    static Duration parseRetryAfter(String value) {
        if (value == null) return null;
        try {
            long sec = Long.parseLong(value.trim());
            return sec < 0 ? null : Duration.ofSeconds(sec);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
