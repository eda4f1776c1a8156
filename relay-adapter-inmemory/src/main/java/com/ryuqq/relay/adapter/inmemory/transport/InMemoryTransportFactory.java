package com.ryuqq.relay.adapter.inmemory.transport;

import com.ryuqq.relay.core.model.HostKey;
import com.ryuqq.relay.core.model.HttpMethod;
import com.ryuqq.relay.core.model.Payload;
import com.ryuqq.relay.core.spi.HttpTransport;
import com.ryuqq.relay.core.spi.TransportFactory;
import com.ryuqq.relay.core.spi.TransportResponse;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link TransportFactory} with scripted replies.
 *
 * <p>Replies are keyed by {@code "METHOD path"} (query strings are ignored) and consumed
 * in FIFO order. When a key's queue is empty the sticky reply registered with
 * {@link #respondRepeatedly} is used, and without one the transport answers 404.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryTransportFactory transports = new InMemoryTransportFactory();
 * transports.respond(HttpMethod.GET, "/items", 503, "busy", Map.of());
 * transports.respond(HttpMethod.GET, "/items", 200, "{\"ok\":true}", Map.of());
 *
 * // first attempt sees 503, the retry sees 200
 * engine.get("https://api.example.com/items");
 * assertThat(transports.requestCount(HttpMethod.GET, "/items")).isEqualTo(2);
 * </pre>
 *
 * <p>All operations are thread-safe.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class InMemoryTransportFactory implements TransportFactory {

    private final Map<String, Deque<ScriptedReply>> scripts = new ConcurrentHashMap<>();
    private final Map<String, ScriptedReply> sticky = new ConcurrentHashMap<>();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
    private final List<InMemoryTransport> created = new CopyOnWriteArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    @Override
    public HttpTransport create(HostKey hostKey) {
        InMemoryTransport transport = new InMemoryTransport(hostKey, this);
        created.add(transport);
        return transport;
    }

    // ============================================================
    // Scripting
    // ============================================================

    public InMemoryTransportFactory respond(HttpMethod method, String path, TransportResponse response) {
        return enqueue(method, path, new ScriptedReply(response, null, Duration.ZERO));
    }

    public InMemoryTransportFactory respond(HttpMethod method, String path, int status, String body, Map<String, String> headers) {
        return respond(method, path, TransportResponse.of(status, headers, body == null ? Payload.empty() : Payload.of(body)));
    }

    /**
     * Replies with the given response after a real delay.
     *
     * <p>If the delay exceeds the caller's timeout the transport raises a timeout instead.</p>
     */
    public InMemoryTransportFactory respondAfter(HttpMethod method, String path, Duration latency, TransportResponse response) {
        return enqueue(method, path, new ScriptedReply(response, null, latency));
    }

    public InMemoryTransportFactory fail(HttpMethod method, String path, IOException error) {
        return enqueue(method, path, new ScriptedReply(null, error, Duration.ZERO));
    }

    /**
     * Registers a reply used whenever the FIFO queue for the key is empty.
     */
    public InMemoryTransportFactory respondRepeatedly(HttpMethod method, String path, int status, String body, Map<String, String> headers) {
        TransportResponse response = TransportResponse.of(status, headers, body == null ? Payload.empty() : Payload.of(body));
        sticky.put(key(method, path), new ScriptedReply(response, null, Duration.ZERO));
        return this;
    }

    private InMemoryTransportFactory enqueue(HttpMethod method, String path, ScriptedReply reply) {
        Deque<ScriptedReply> queue = scripts.computeIfAbsent(key(method, path), k -> new ArrayDeque<>());
        synchronized (queue) {
            queue.addLast(reply);
        }
        return this;
    }

    // ============================================================
    // Inspection
    // ============================================================

    public List<RecordedRequest> requests() {
        return List.copyOf(requests);
    }

    public int requestCount(HttpMethod method, String path) {
        String key = key(method, path);
        return (int) requests.stream().filter(r -> r.key().equals(key)).count();
    }

    public List<InMemoryTransport> createdTransports() {
        return List.copyOf(created);
    }

    /**
     * @return highest number of sends observed in flight at the same time
     */
    public int maxConcurrentSends() {
        return maxInFlight.get();
    }

    // ============================================================
    // Internal (called by InMemoryTransport)
    // ============================================================

    ScriptedReply next(RecordedRequest request) {
        requests.add(request);
        String key = request.key();
        Deque<ScriptedReply> queue = scripts.get(key);
        if (queue != null) {
            synchronized (queue) {
                ScriptedReply reply = queue.pollFirst();
                if (reply != null) {
                    return reply;
                }
            }
        }
        ScriptedReply fallback = sticky.get(key);
        if (fallback != null) {
            return fallback;
        }
        return new ScriptedReply(TransportResponse.of(404, Map.of(), Payload.of("no reply scripted for " + key)), null, Duration.ZERO);
    }

    void enter() {
        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);
    }

    void exit() {
        inFlight.decrementAndGet();
    }

    static String key(HttpMethod method, String path) {
        return method.name() + " " + (path == null || path.isEmpty() ? "/" : path);
    }

    record ScriptedReply(TransportResponse response, IOException error, Duration latency) {
    }
}
