package com.ryuqq.relay.engine.session;

import com.ryuqq.relay.core.model.HostKey;
import com.ryuqq.relay.core.spi.HttpTransport;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 시도 하나 동안 빌린 세션.
 *
 * <p>반드시 try-with-resources로 사용하며, 백오프 대기 동안 들고 있으면 안 됩니다.
 * 반납 전에 풀에서 밀려난 세션은 마지막 lease가 반납될 때 닫힙니다.</p>
 *
 * <pre>{@code
 * try (SessionLease lease = pool.lease(request.hostKey())) {
 *     response = lease.transport().send(request, timeout, cancellation);
 * }
 * }</pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class SessionLease implements AutoCloseable {

    private final SessionPool pool;
    private final SessionEntry entry;
    private final AtomicBoolean released = new AtomicBoolean(false);

    SessionLease(SessionPool pool, SessionEntry entry) {
        this.pool = pool;
        this.entry = entry;
    }

    public HttpTransport transport() {
        return entry.transport();
    }

    public HostKey hostKey() {
        return entry.hostKey();
    }

    /**
     * 풀에 반납. 두 번째 호출부터는 아무 동작도 하지 않습니다.
     */
    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            pool.release(entry);
        }
    }
}
