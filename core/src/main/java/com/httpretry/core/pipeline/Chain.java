package com.httpretry.core.pipeline;

import java.io.IOException;

/** 플러그인에 넘겨지는 이어가기 핸들. 한 플러그인은 next 또는 fail 중 하나를 정확히 한 번 호출한다. */
public interface Chain {
    /** 다음 플러그인(마지막이면 송신)으로 진행 */
    void next(RequestContext ctx) throws IOException, InterruptedException;

    /** 재시도 불가능한 치명 오류로 파이프라인 중단. 송신은 일어나지 않는다. */
    void fail(RequestContext ctx, Exception cause);
}
