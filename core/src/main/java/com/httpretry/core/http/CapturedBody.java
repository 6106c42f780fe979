package com.httpretry.core.http;

import java.io.ByteArrayInputStream;
import java.io.InputStream;

/** 한 번 캡처한 요청 본문. 바이트는 불변이며 시도마다 독립된 읽기 위치를 가진 뷰를 새로 만든다. */
public final class CapturedBody {
    static final CapturedBody NONE = new CapturedBody(null);

    private final byte[] bytes; // null이면 원래 본문이 없었음

    CapturedBody(byte[] bytes) {
        this.bytes = bytes;
    }

    public boolean isPresent() { return bytes != null; }

    public int length() { return bytes == null ? 0 : bytes.length; }

    /** 새 뷰. 본문이 없었으면 null. */
    public InputStream newView() {
        return bytes == null ? null : new ByteArrayInputStream(bytes);
    }

    /** 사본 */
    public byte[] toByteArray() {
        return bytes == null ? new byte[0] : bytes.clone();
    }
}
