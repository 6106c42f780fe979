package com.httpretry.core.http;

/** 엄격 모드 설치기: 현재 커넥터에 동기 송신 능력이 없어 감쌀 수 없음. 설정 오류이며 재시도 대상이 아니다. */
public class TransportUnsupportedException extends IllegalStateException {
    public TransportUnsupportedException(Class<?> connectorType) {
        super("retry: transport is not supported: " + (connectorType == null ? "null" : connectorType.getName()));
    }
}
