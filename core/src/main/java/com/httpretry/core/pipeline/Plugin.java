package com.httpretry.core.pipeline;

import java.io.IOException;

/** 파이프라인 플러그인: 지정한 단계에서 요청 문맥을 보고 chain을 이어간다. */
public interface Plugin {
    Phase phase();

    void handle(RequestContext ctx, Chain chain) throws IOException, InterruptedException;
}
