// ITransport.java
package com.httpretry.core.api;

import com.httpretry.core.model.HttpResponseData;
import com.httpretry.core.model.OutboundRequest;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * 요청 1건을 동기로 보내고 응답을 돌려주는 전송 계약.
 * 같은 내용의 서로 다른 요청 복제본으로 여러 번 호출될 수 있어야 한다.
 */
@FunctionalInterface
public interface ITransport extends IConnector {

    /** 네트워크 오류는 IOException, 스레드 인터럽트는 InterruptedException. 상태코드는 예외가 아니다. */
    HttpResponseData send(OutboundRequest request) throws IOException, InterruptedException;

    /** 기본 구현: 호출 스레드에서 send()를 실행하고 완료된 future로 감싼다. */
    @Override
    default CompletableFuture<HttpResponseData> sendAsync(OutboundRequest request) {
        try {
            return CompletableFuture.completedFuture(send(request));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return CompletableFuture.failedFuture(ie);
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
