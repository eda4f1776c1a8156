package com.ryuqq.relay.adapter.inmemory.transport;

import com.ryuqq.relay.core.model.HostKey;
import com.ryuqq.relay.core.model.HttpMethod;
import com.ryuqq.relay.core.model.Payload;
import com.ryuqq.relay.core.model.RequestSpec;
import com.ryuqq.relay.core.spi.HttpTransport;
import com.ryuqq.relay.core.spi.TransportResponse;
import com.ryuqq.relay.core.spi.TransportTimeoutException;
import com.ryuqq.relay.core.time.CancellationToken;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryTransport tests.
 *
 * @author Relay Team
 * @since 1.0.0
 */
class InMemoryTransportTest {

    private static final URI ITEMS = URI.create("https://api.example.com/items?page=2");
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final InMemoryTransportFactory factory = new InMemoryTransportFactory();

    @Test
    void send_ScriptedRepliesConsumedInOrder() throws Exception {
        // given
        factory.respond(HttpMethod.GET, "/items", 503, "busy", Map.of());
        factory.respond(HttpMethod.GET, "/items", 200, "{\"ok\":true}", Map.of("Content-Type", "application/json"));
        HttpTransport transport = factory.create(HostKey.of(ITEMS));
        RequestSpec request = RequestSpec.of(HttpMethod.GET, ITEMS);

        // when
        TransportResponse first = transport.send(request, TIMEOUT, CancellationToken.none());
        TransportResponse second = transport.send(request, TIMEOUT, CancellationToken.none());
        TransportResponse third = transport.send(request, TIMEOUT, CancellationToken.none());

        // then
        assertThat(first.statusCode()).isEqualTo(503);
        assertThat(second.statusCode()).isEqualTo(200);
        assertThat(second.body().asString()).isEqualTo("{\"ok\":true}");
        assertThat(third.statusCode()).isEqualTo(404);
        assertThat(factory.requestCount(HttpMethod.GET, "/items")).isEqualTo(3);
    }

    @Test
    void send_StickyReplyUsedWhenQueueEmpty() throws Exception {
        // given
        factory.respondRepeatedly(HttpMethod.GET, "/status", 202, null, Map.of());
        HttpTransport transport = factory.create(HostKey.of(ITEMS));
        RequestSpec request = RequestSpec.of(HttpMethod.GET, URI.create("https://api.example.com/status"));

        // then
        for (int i = 0; i < 3; i++) {
            assertThat(transport.send(request, TIMEOUT, CancellationToken.none()).statusCode()).isEqualTo(202);
        }
    }

    @Test
    void send_ScriptedFailure_Throws() {
        // given
        factory.fail(HttpMethod.POST, "/items", new ConnectException("refused"));
        HttpTransport transport = factory.create(HostKey.of(ITEMS));
        RequestSpec request = RequestSpec.of(HttpMethod.POST, ITEMS).withBody(Payload.of("{}"));

        // when & then
        assertThatThrownBy(() -> transport.send(request, TIMEOUT, CancellationToken.none()))
            .isInstanceOf(ConnectException.class);
    }

    @Test
    void send_LatencyBeyondTimeout_ThrowsTimeout() {
        // given
        factory.respondAfter(HttpMethod.GET, "/items", Duration.ofSeconds(10),
            TransportResponse.of(200, Map.of(), Payload.empty()));
        HttpTransport transport = factory.create(HostKey.of(ITEMS));

        // when & then
        assertThatThrownBy(() -> transport.send(RequestSpec.of(HttpMethod.GET, ITEMS), Duration.ofMillis(20), CancellationToken.none()))
            .isInstanceOf(TransportTimeoutException.class);
    }

    @Test
    void send_CancelledInFlight_ThrowsCancellation() {
        // given
        factory.respondAfter(HttpMethod.GET, "/items", Duration.ofSeconds(30),
            TransportResponse.of(200, Map.of(), Payload.empty()));
        HttpTransport transport = factory.create(HostKey.of(ITEMS));
        CancellationToken token = CancellationToken.create();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        scheduler.schedule(token::cancel, 50, TimeUnit.MILLISECONDS);

        try {
            // when & then
            assertThatThrownBy(() -> transport.send(RequestSpec.of(HttpMethod.GET, ITEMS), Duration.ofSeconds(60), token))
                .isInstanceOf(CancellationException.class);
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void send_AfterClose_ThrowsIOException() {
        // given
        InMemoryTransport transport = (InMemoryTransport) factory.create(HostKey.of(ITEMS));

        // when
        transport.close();

        // then
        assertThat(transport.isClosed()).isTrue();
        assertThatThrownBy(() -> transport.send(RequestSpec.of(HttpMethod.GET, ITEMS), TIMEOUT, CancellationToken.none()))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("closed");
    }
}
