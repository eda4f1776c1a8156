package com.ryuqq.relay.adapter.inmemory.transport;

import com.ryuqq.relay.core.model.HostKey;
import com.ryuqq.relay.core.model.RequestSpec;
import com.ryuqq.relay.core.spi.HttpTransport;
import com.ryuqq.relay.core.spi.TransportResponse;
import com.ryuqq.relay.core.spi.TransportTimeoutException;
import com.ryuqq.relay.core.time.CancellationToken;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory {@link HttpTransport} bound to one host.
 *
 * <p>Replies come from the owning {@link InMemoryTransportFactory}. Sending on a closed
 * transport fails with {@link IOException} so tests can detect use-after-evict.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class InMemoryTransport implements HttpTransport {

    private final HostKey hostKey;
    private final InMemoryTransportFactory factory;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    InMemoryTransport(HostKey hostKey, InMemoryTransportFactory factory) {
        this.hostKey = hostKey;
        this.factory = factory;
    }

    @Override
    public TransportResponse send(RequestSpec request, Duration timeout, CancellationToken cancellation)
            throws IOException, InterruptedException {
        if (closed.get()) {
            throw new IOException("transport for " + hostKey.getValue() + " is closed");
        }
        if (cancellation.isCancelled()) {
            throw new CancellationException("request cancelled before send");
        }

        factory.enter();
        try {
            InMemoryTransportFactory.ScriptedReply reply = factory.next(new RecordedRequest(hostKey, request, timeout));
            Duration latency = reply.latency();
            if (!latency.isZero()) {
                boolean timedOut = latency.compareTo(timeout) > 0;
                Duration wait = timedOut ? timeout : latency;
                if (cancellation.await(wait)) {
                    throw new CancellationException("request cancelled in flight");
                }
                if (timedOut) {
                    throw new TransportTimeoutException("no response within " + timeout.toMillis() + "ms");
                }
            }
            if (reply.error() != null) {
                throw reply.error();
            }
            return reply.response();
        } finally {
            factory.exit();
        }
    }

    @Override
    public void close() {
        closed.set(true);
    }

    public boolean isClosed() {
        return closed.get();
    }

    public HostKey getHostKey() {
        return hostKey;
    }
}
