package com.httpretry.core.http;

import com.httpretry.core.model.HttpResponseData;
import com.httpretry.core.model.OutboundRequest;

/**
 * 한 번의 시도 결과를 분류한다. 부수효과 없는 순수 함수여야 한다.
 *
 * 반환값이 null이면 종료(성공 또는 재시도하지 않을 실패),
 * null이 아니면 재시도 대상(드라이버 예산이 남아 있으면 다시 시도).
 */
@FunctionalInterface
public interface Evaluator {
    /**
     * @param error    하부 전송이 던진 오류(없으면 null)
     * @param response 얻은 응답(error가 있으면 보통 null)
     * @param request  원본 요청(문맥 참고용, 본문은 이미 소비됨)
     */
    Exception evaluate(Exception error, HttpResponseData response, OutboundRequest request);
}
