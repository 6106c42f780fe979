package com.httpretry.core.pipeline;

import com.httpretry.core.api.IConnector;

import java.util.Objects;

/**
 * 요청 1건 동안 "지금 송신에 쓸 커넥터"를 가리키는 참조.
 * RequestContext마다 새로 만들어지므로 클라이언트의 커넥터 필드는 절대 바뀌지 않는다.
 * 한 요청 안에서만 쓰이며 스레드 세이프하지 않다.
 */
public final class TransportBinding {
    private final IConnector original;
    private IConnector current;

    public TransportBinding(IConnector original) {
        this.original = Objects.requireNonNull(original, "original");
        this.current = original;
    }

    public IConnector current() { return current; }

    public IConnector original() { return original; }

    public boolean isSwapped() { return current != original; }

    /** 교체하고 이전 값을 돌려준다. */
    public IConnector swap(IConnector next) {
        IConnector prev = current;
        current = Objects.requireNonNull(next, "next");
        return prev;
    }

    /** 지정한 커넥터로 되돌린다(여러 번 호출해도 안전). */
    public void restore(IConnector connector) {
        current = Objects.requireNonNull(connector, "connector");
    }
}
