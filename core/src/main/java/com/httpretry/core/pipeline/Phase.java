package com.httpretry.core.pipeline;

/** 파이프라인 확장 지점. 선언 순서대로 실행되고 BEFORE_DIAL 다음이 실제 송신이다. */
public enum Phase {
    REQUEST,
    BEFORE_DIAL
}
