package com.httpretry.core.http;

import com.httpretry.core.api.ITransport;
import com.httpretry.core.model.HttpResponseData;
import com.httpretry.core.model.OutboundRequest;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 미리 정한 결과(상태코드 / 예외)를 순서대로 돌려주는 가짜 전송.
 * 대본이 끝나면 마지막 항목을 반복한다. 받은 요청과 본문 바이트를 기록한다.
 */
final class ScriptedTransport implements ITransport {

    final List<OutboundRequest> received = new ArrayList<>();
    final List<byte[]> bodies = new ArrayList<>();
    private final Deque<Object> script = new ArrayDeque<>();
    private Object last;
    private Runnable onSend = () -> { };

    ScriptedTransport then(int status) { script.add(status); return this; }
    ScriptedTransport thenThrow(Exception e) { script.add(e); return this; }
    /** 매 송신 직전에 실행(예: 가짜 시계 전진) */
    ScriptedTransport onSend(Runnable r) { onSend = r; return this; }

    int calls() { return received.size(); }

    @Override
    public HttpResponseData send(OutboundRequest request) throws IOException, InterruptedException {
        onSend.run();
        received.add(request);
        InputStream in = request.getBody();
        bodies.add(in == null ? null : in.readAllBytes());

        Object step = script.isEmpty() ? last : script.poll();
        last = step;
        if (step instanceof IOException io) throw io;
        if (step instanceof InterruptedException ie) throw ie;
        if (step instanceof RuntimeException re) throw re;
        int status = (Integer) step;
        return HttpResponseData.builder()
                .url(request.getUri())
                .statusCode(status)
                .body("status " + status)
                .build();
    }
}
