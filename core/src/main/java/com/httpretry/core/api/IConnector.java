// IConnector.java
package com.httpretry.core.api;

import com.httpretry.core.model.HttpResponseData;
import com.httpretry.core.model.OutboundRequest;

import java.util.concurrent.CompletableFuture;

/**
 * 호스트 클라이언트가 들고 있는 "현재 전송 구현"의 최소 계약.
 * 비동기 송신만 보장한다. 동기 송신 능력은 {@link ITransport}가 추가로 선언한다.
 */
@FunctionalInterface
public interface IConnector {
    CompletableFuture<HttpResponseData> sendAsync(OutboundRequest request);
}
