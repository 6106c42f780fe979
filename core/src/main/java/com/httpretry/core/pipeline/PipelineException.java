package com.httpretry.core.pipeline;

import java.io.IOException;

/** 플러그인이 chain.fail(...)로 중단시킨 요청. cause에 원인(예: 설정 오류)이 들어있다. */
public class PipelineException extends IOException {
    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
