package com.httpretry.core.http;

import java.io.IOException;

/** 요청 본문을 끝까지 읽지 못함. 시도 전 치명 오류라 재시도하지 않는다. */
public class BodyReadException extends IOException {
    public BodyReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
