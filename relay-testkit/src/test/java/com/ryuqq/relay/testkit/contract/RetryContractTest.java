package com.ryuqq.relay.testkit.contract;

import com.ryuqq.relay.core.model.HttpMethod;
import com.ryuqq.relay.core.model.Payload;
import com.ryuqq.relay.core.model.RequestSpec;
import com.ryuqq.relay.core.result.ErrorKind;
import com.ryuqq.relay.core.result.OperationResult;
import com.ryuqq.relay.engine.RequestEngine;
import com.ryuqq.relay.engine.RequestOptions;
import com.ryuqq.relay.engine.config.EngineConfig;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: retry and backoff behaviour.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Transient failures are retried until success</li>
 *   <li>Backoff doubles per attempt and is capped at the max delay</li>
 *   <li>Retry-After replaces the computed backoff</li>
 *   <li>Non-idempotent requests are not replayed after a server error</li>
 *   <li>Permanent failures return immediately</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
class RetryContractTest extends AbstractEngineContractTest {

    private static final String PATH = "/v1/orders";

    @Test
    void testTransientFailures_RetriedUntilSuccess() {
        // Given
        transports.respond(HttpMethod.GET, PATH, 502, null, Map.of());
        transports.fail(HttpMethod.GET, PATH, new ConnectException("connection reset"));
        transports.respond(HttpMethod.GET, PATH, 200, "[]", Map.of());
        RequestEngine engine = newEngine(baseConfig());

        // When
        OperationResult result = engine.get(url(PATH));

        // Then
        assertSuccess(result, 200);
        assertEquals(3, result.attempts());
        assertSleeps(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    void testBackoff_DoublesAndCapsAtMaxDelay() {
        // Given
        EngineConfig config = baseConfig();
        config = config.withRetry(config.retry().withMaxRetries(5).withMaxDelay(Duration.ofSeconds(5)));
        transports.respondRepeatedly(HttpMethod.GET, PATH, 503, null, Map.of());
        RequestEngine engine = newEngine(config);

        // When
        OperationResult result = engine.execute(RequestSpec.of(HttpMethod.GET, URI.create(url(PATH))), null);

        // Then
        assertFailure(result, ErrorKind.TRANSIENT_NETWORK);
        assertEquals(6, result.attempts());
        assertEquals(503, result.statusCode());
        assertSleeps(
                Duration.ofSeconds(1),
                Duration.ofSeconds(2),
                Duration.ofSeconds(4),
                Duration.ofSeconds(5),
                Duration.ofSeconds(5));
    }

    @Test
    void testRetryAfter_ReplacesComputedBackoff() {
        // Given
        transports.respond(HttpMethod.GET, PATH, 503, null, Map.of("Retry-After", "10"));
        transports.respond(HttpMethod.GET, PATH, 200, "[]", Map.of());
        RequestEngine engine = newEngine(baseConfig());

        // When
        OperationResult result = engine.get(url(PATH));

        // Then
        assertSuccess(result, 200);
        assertSleeps(Duration.ofSeconds(10));
    }

    @Test
    void testNonIdempotentPost_NotReplayedAfterServerError() {
        // Given
        transports.respondRepeatedly(HttpMethod.POST, PATH, 500, null, Map.of());
        RequestEngine engine = newEngine(baseConfig());

        // When
        OperationResult result = engine.execute(
                RequestSpec.of(HttpMethod.POST, URI.create(url(PATH))).withBody(Payload.of("{\"qty\":1}")), null);

        // Then
        assertFailure(result, ErrorKind.TRANSIENT_NETWORK);
        assertEquals(1, result.attempts());
        assertRequestCount(HttpMethod.POST, PATH, 1);
    }

    @Test
    void testIdempotencyOverride_AllowsPostRetry() {
        // Given
        transports.respond(HttpMethod.POST, PATH, 500, null, Map.of());
        transports.respond(HttpMethod.POST, PATH, 201, "{\"id\":9}", Map.of());
        RequestEngine engine = newEngine(baseConfig());

        // When
        OperationResult result = engine.post(url(PATH), Payload.of("{}"),
                RequestOptions.defaults().withIdempotent(true).withHeader("Idempotency-Key", "order-9"));

        // Then
        assertSuccess(result, 201);
        assertEquals(2, result.attempts());
        assertEquals("order-9", transports.requests().get(1).header("Idempotency-Key"));
    }

    @Test
    void testPermanentFailure_ReturnedWithoutRetry() {
        // Given
        transports.respondRepeatedly(HttpMethod.GET, PATH, 422, "{\"error\":\"invalid\"}", Map.of());
        RequestEngine engine = newEngine(baseConfig());

        // When
        OperationResult result = engine.execute(RequestSpec.of(HttpMethod.GET, URI.create(url(PATH))), null);

        // Then
        assertFailure(result, ErrorKind.OPERATION);
        assertEquals(1, result.attempts());
        assertEquals("{\"error\":\"invalid\"}", result.payload().asString());
        assertTrue(clock.sleeps().isEmpty(), "Permanent failures must not back off");
    }
}
