package com.ryuqq.relay.engine.session;

import com.ryuqq.relay.core.model.HostKey;
import com.ryuqq.relay.core.spi.HttpTransport;
import com.ryuqq.relay.core.spi.TransportFactory;
import com.ryuqq.relay.core.time.Ticker;
import com.ryuqq.relay.engine.config.SessionPoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 호스트별 Transport를 재사용하는 LRU 세션 풀.
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>키: scheme://host:port ({@link HostKey})</li>
 *   <li>Hit: 기존 Transport 반환, 가장 최근 사용으로 이동</li>
 *   <li>Miss: {@link TransportFactory}로 생성, 용량 초과 시 가장 오래 사용하지 않은 세션을
 *       같은 락 구간에서 제거</li>
 *   <li>제거된 세션은 사용 중인 lease가 없으면 즉시, 있으면 마지막 lease 반납 시 닫힘</li>
 * </ul>
 *
 * <p>Transport 종료와 네트워크 I/O는 락 밖에서 수행합니다.
 * Transport 생성은 같은 호스트에 두 개가 만들어지지 않도록 락 안에서 수행합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class SessionPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionPool.class);

    private final TransportFactory transportFactory;
    private final int maxSessions;
    private final Ticker ticker;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<HostKey, SessionEntry> entries = new LinkedHashMap<>(16, 0.75f, true);
    private boolean closed;

    public SessionPool(TransportFactory transportFactory, SessionPoolConfig config) {
        this(transportFactory, config, Ticker.system());
    }

    /**
     * @param transportFactory 호스트별 Transport 생성기
     * @param config 풀 설정
     * @param ticker 유휴 시간 측정용 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public SessionPool(TransportFactory transportFactory, SessionPoolConfig config, Ticker ticker) {
        if (transportFactory == null) {
            throw new IllegalArgumentException("transportFactory cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (ticker == null) {
            throw new IllegalArgumentException("ticker cannot be null");
        }
        this.transportFactory = transportFactory;
        this.maxSessions = config.maxSessions();
        this.ticker = ticker;
    }

    /**
     * 호스트 세션 대여.
     *
     * @param hostKey 대상 호스트
     * @return 반드시 close해야 하는 lease
     * @throws IllegalStateException 풀이 닫힌 경우
     */
    public SessionLease lease(HostKey hostKey) {
        if (hostKey == null) {
            throw new IllegalArgumentException("hostKey cannot be null");
        }
        List<SessionEntry> toClose = new ArrayList<>();
        SessionEntry entry;
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("SessionPool is closed");
            }
            long now = ticker.read();
            entry = entries.get(hostKey);
            if (entry == null) {
                // 1. 새 Transport 생성 (실패하면 기존 세션은 그대로)
                HttpTransport transport = transportFactory.create(hostKey);
                // 2. 용량 초과분 제거 (LRU)
                Iterator<SessionEntry> eldest = entries.values().iterator();
                while (entries.size() >= maxSessions && eldest.hasNext()) {
                    SessionEntry evicted = eldest.next();
                    eldest.remove();
                    evicted.retire();
                    log.info("Evicting session [{}] (idle {}ms, {} active leases)",
                        evicted.hostKey().getValue(),
                        Duration.ofNanos(now - evicted.lastUsedAtNanos()).toMillis(),
                        evicted.leases());
                    if (evicted.leases() == 0) {
                        toClose.add(evicted);
                    }
                }
                entry = new SessionEntry(hostKey, transport, now);
                entries.put(hostKey, entry);
                log.debug("Created session [{}] ({}/{})", hostKey.getValue(), entries.size(), maxSessions);
            }
            entry.touch(now);
        } finally {
            lock.unlock();
        }
        toClose.forEach(this::closeQuietly);
        return new SessionLease(this, entry);
    }

    void release(SessionEntry entry) {
        boolean closeNow;
        lock.lock();
        try {
            closeNow = entry.release() == 0 && entry.isRetired();
        } finally {
            lock.unlock();
        }
        if (closeNow) {
            closeQuietly(entry);
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(HostKey hostKey) {
        lock.lock();
        try {
            return entries.containsKey(hostKey);
        } finally {
            lock.unlock();
        }
    }

    public int getMaxSessions() {
        return maxSessions;
    }

    /**
     * 모든 세션 종료. 사용 중인 세션은 마지막 lease 반납 시 닫힙니다.
     */
    @Override
    public void close() {
        List<SessionEntry> toClose = new ArrayList<>();
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            for (SessionEntry entry : entries.values()) {
                entry.retire();
                if (entry.leases() == 0) {
                    toClose.add(entry);
                }
            }
            entries.clear();
        } finally {
            lock.unlock();
        }
        log.info("SessionPool closed ({} sessions)", toClose.size());
        toClose.forEach(this::closeQuietly);
    }

    private void closeQuietly(SessionEntry entry) {
        HttpTransport transport = entry.transport();
        try {
            transport.close();
            log.debug("Closed session [{}]", entry.hostKey().getValue());
        } catch (RuntimeException e) {
            log.warn("Failed to close session [{}]", entry.hostKey().getValue(), e);
        }
    }
}
