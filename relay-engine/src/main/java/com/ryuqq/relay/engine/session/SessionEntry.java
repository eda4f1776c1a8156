package com.ryuqq.relay.engine.session;

import com.ryuqq.relay.core.model.HostKey;
import com.ryuqq.relay.core.spi.HttpTransport;

/**
 * 풀이 소유하는 호스트 세션 하나.
 *
 * <p>모든 필드는 {@link SessionPool}의 락 안에서만 변경됩니다.</p>
 */
final class SessionEntry {

    private final HostKey hostKey;
    private final HttpTransport transport;
    private long lastUsedAtNanos;
    private int leases;
    private boolean retired;

    SessionEntry(HostKey hostKey, HttpTransport transport, long nowNanos) {
        this.hostKey = hostKey;
        this.transport = transport;
        this.lastUsedAtNanos = nowNanos;
    }

    HostKey hostKey() {
        return hostKey;
    }

    HttpTransport transport() {
        return transport;
    }

    long lastUsedAtNanos() {
        return lastUsedAtNanos;
    }

    void touch(long nowNanos) {
        lastUsedAtNanos = nowNanos;
        leases++;
    }

    /**
     * @return 반납 후 남은 lease 수
     */
    int release() {
        leases--;
        return leases;
    }

    int leases() {
        return leases;
    }

    boolean isRetired() {
        return retired;
    }

    void retire() {
        retired = true;
    }
}
