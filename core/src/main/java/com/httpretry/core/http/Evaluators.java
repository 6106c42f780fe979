package com.httpretry.core.http;

import com.httpretry.core.model.HttpResponseData;
import com.httpretry.core.model.RetryConfig;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/** 평가기 팩토리. 전역 가변 기본값 대신 매번 새 값을 만들어 생성 시점에 주입한다. */
public final class Evaluators {
    private Evaluators() {}

    /** 전송 오류는 그대로 재시도, 응답이 >= 500 또는 429면 ServerResponseException, 나머지는 종료. */
    public static Evaluator defaultEvaluator() {
        return (err, res, req) -> {
            if (err != null) return err;
            if (res != null && isServerError(res.getStatusCode())) return ServerResponseException.of(res);
            return null;
        };
    }

    /** 전송 오류 + 지정한 상태코드만 재시도. */
    public static Evaluator onStatuses(int... statuses) {
        Set<Integer> codes = toSet(statuses);
        return (err, res, req) -> {
            if (err != null) return err;
            if (res != null && codes.contains(res.getStatusCode())) return ServerResponseException.of(res);
            return null;
        };
    }

    /** base가 재시도라고 해도 지정한 상태코드 응답이면 종료. */
    public static Evaluator excluding(Evaluator base, int... statuses) {
        Objects.requireNonNull(base, "base");
        Set<Integer> codes = toSet(statuses);
        return (err, res, req) -> {
            if (err == null && res != null && codes.contains(res.getStatusCode())) return null;
            return base.evaluate(err, res, req);
        };
    }

    /** 어떤 결과든 종료. 재시도 없이 한 번만 보낸다. */
    public static Evaluator never() {
        return (err, res, req) -> null;
    }

    /** 설정의 evaluator.retryStatuses/excludeStatuses를 기본 규칙 위에 얹는다. */
    public static Evaluator fromConfig(RetryConfig cfg) {
        Objects.requireNonNull(cfg, "cfg");
        Set<Integer> extra = new TreeSet<>(cfg.getEvaluator().getRetryStatuses());
        Set<Integer> excluded = new TreeSet<>(cfg.getEvaluator().getExcludeStatuses());
        Evaluator base = defaultEvaluator();
        Evaluator withExtra = extra.isEmpty() ? base : (err, res, req) -> {
            if (err == null && res != null && extra.contains(res.getStatusCode())) return ServerResponseException.of(res);
            return base.evaluate(err, res, req);
        };
        return excluded.isEmpty() ? withExtra : excluding(withExtra, excluded.stream().mapToInt(Integer::intValue).toArray());
    }

    static boolean isServerError(int statusCode) {
        return statusCode >= 500 || statusCode == 429;
    }

    private static Set<Integer> toSet(int... statuses) {
        Set<Integer> out = new TreeSet<>();
        if (statuses != null) for (int s : statuses) out.add(s);
        return Set.copyOf(out);
    }
}
