package com.ryuqq.relay.adapter.inmemory.transport;

import com.ryuqq.relay.core.model.HostKey;
import com.ryuqq.relay.core.model.RequestSpec;

import java.time.Duration;

/**
 * A request observed by {@link InMemoryTransport}.
 *
 * @param hostKey host the transport was bound to
 * @param request request as sent, including final headers
 * @param timeout per-attempt timeout passed by the caller
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record RecordedRequest(HostKey hostKey, RequestSpec request, Duration timeout) {

    public String key() {
        return InMemoryTransportFactory.key(request.method(), request.url().getPath());
    }

    public String header(String name) {
        return request.headers().entrySet().stream()
            .filter(e -> e.getKey().equalsIgnoreCase(name))
            .map(java.util.Map.Entry::getValue)
            .findFirst()
            .orElse(null);
    }
}
