package com.httpretry.core.http;

import com.httpretry.core.model.OutboundRequest;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/** 요청 본문을 끝까지 한 번 읽어 메모리에 보관하고 원본 스트림을 닫는다. */
public final class BodyCapture {
    private BodyCapture() {}

    /**
     * @throws BodyReadException 원본을 끝까지 읽지 못한 경우(치명, 시도 전 중단)
     */
    public static CapturedBody capture(OutboundRequest request) throws BodyReadException {
        Objects.requireNonNull(request, "request");
        InputStream in = request.getBody();
        if (in == null) return CapturedBody.NONE;

        byte[] bytes;
        try (in) {
            bytes = in.readAllBytes();
        } catch (IOException e) {
            throw new BodyReadException("retry: cannot read request body of " + request, e);
        }
        return new CapturedBody(bytes);
    }
}
