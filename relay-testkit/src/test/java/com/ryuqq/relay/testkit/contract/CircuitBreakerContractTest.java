package com.ryuqq.relay.testkit.contract;

import com.ryuqq.relay.core.exception.CircuitOpenException;
import com.ryuqq.relay.core.model.HttpMethod;
import com.ryuqq.relay.core.model.RequestSpec;
import com.ryuqq.relay.core.protection.CircuitBreakerConfig;
import com.ryuqq.relay.core.protection.CircuitBreakerState;
import com.ryuqq.relay.core.result.ErrorKind;
import com.ryuqq.relay.core.result.OperationResult;
import com.ryuqq.relay.core.time.CancellationToken;
import com.ryuqq.relay.engine.RequestEngine;
import com.ryuqq.relay.engine.RequestOptions;
import com.ryuqq.relay.engine.config.EngineConfig;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: circuit breaker integration.
 *
 * <p>The breaker counts logical calls, not attempts, and only failures that reflect
 * the health of the remote service.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
class CircuitBreakerContractTest extends AbstractEngineContractTest {

    private static final String PATH = "/v1/accounts";
    private static final Duration OPEN_TIMEOUT = Duration.ofSeconds(30);

    private EngineConfig breakerConfig(int threshold, int maxRetries) {
        EngineConfig config = baseConfig();
        return config
                .withRetry(config.retry().withMaxRetries(maxRetries))
                .withCircuitBreaker(new CircuitBreakerConfig(threshold, OPEN_TIMEOUT));
    }

    private OperationResult call(RequestEngine engine) {
        return engine.execute(RequestSpec.of(HttpMethod.GET, URI.create(url(PATH))), null);
    }

    // ===================================================================
    // COUNTING
    // ===================================================================

    @Test
    void testRetriedCall_CountsAsSingleFailure() {
        // Given
        transports.respondRepeatedly(HttpMethod.GET, PATH, 503, null, Map.of());
        RequestEngine engine = newEngine(breakerConfig(2, 3));

        // When
        OperationResult result = call(engine);

        // Then
        assertEquals(4, result.attempts());
        assertEquals(1, circuitBreaker.getConsecutiveFailures());
        assertEquals(CircuitBreakerState.CLOSED, circuitBreaker.getState());
    }

    @Test
    void testClientErrors_DoNotOpenCircuit() {
        // Given
        transports.respondRepeatedly(HttpMethod.GET, PATH, 404, null, Map.of());
        RequestEngine engine = newEngine(breakerConfig(1, 0));

        // When
        for (int i = 0; i < 3; i++) {
            assertFailure(call(engine), ErrorKind.OPERATION);
        }

        // Then
        assertEquals(CircuitBreakerState.CLOSED, circuitBreaker.getState());
        assertEquals(0, circuitBreaker.getConsecutiveFailures());
    }

    @Test
    void testCancelledCall_DoesNotCountAsFailure() {
        // Given
        RequestEngine engine = newEngine(breakerConfig(1, 0));
        CancellationToken token = CancellationToken.create();
        token.cancel();

        // When
        OperationResult result = engine.execute(
                RequestSpec.of(HttpMethod.GET, URI.create(url(PATH))),
                RequestOptions.defaults().withCancellation(token));

        // Then
        assertFailure(result, ErrorKind.CANCELLED);
        assertEquals(CircuitBreakerState.CLOSED, circuitBreaker.getState());
        assertEquals(0, circuitBreaker.getConsecutiveFailures());
    }

    // ===================================================================
    // STATE TRANSITIONS
    // ===================================================================

    @Test
    void testThresholdReached_RejectsWithoutTouchingTransport() {
        // Given
        transports.respondRepeatedly(HttpMethod.GET, PATH, 500, null, Map.of());
        RequestEngine engine = newEngine(breakerConfig(3, 0));
        for (int i = 0; i < 3; i++) {
            call(engine);
        }
        assertEquals(CircuitBreakerState.OPEN, circuitBreaker.getState());

        // When
        CircuitOpenException e = assertThrows(CircuitOpenException.class, () -> engine.get(url(PATH)));

        // Then
        assertEquals(0, e.getAttempts());
        assertRequestCount(HttpMethod.GET, PATH, 3);
    }

    @Test
    void testOpenTimeout_TrialSuccessClosesCircuit() {
        // Given
        transports.respond(HttpMethod.GET, PATH, 500, null, Map.of());
        transports.respond(HttpMethod.GET, PATH, 200, "{}", Map.of());
        RequestEngine engine = newEngine(breakerConfig(1, 0));
        call(engine);
        assertEquals(CircuitBreakerState.OPEN, circuitBreaker.getState());

        // When
        clock.advance(OPEN_TIMEOUT);
        OperationResult trial = call(engine);

        // Then
        assertSuccess(trial, 200);
        assertEquals(CircuitBreakerState.CLOSED, circuitBreaker.getState());
    }

    @Test
    void testOpenTimeout_TrialFailureReopensCircuit() {
        // Given
        transports.respondRepeatedly(HttpMethod.GET, PATH, 500, null, Map.of());
        RequestEngine engine = newEngine(breakerConfig(1, 0));
        call(engine);

        // When
        clock.advance(OPEN_TIMEOUT);
        OperationResult trial = call(engine);
        OperationResult afterTrial = call(engine);

        // Then
        assertFailure(trial, ErrorKind.TRANSIENT_NETWORK);
        assertFailure(afterTrial, ErrorKind.CIRCUIT_OPEN);
        assertEquals(CircuitBreakerState.OPEN, circuitBreaker.getState());
        assertRequestCount(HttpMethod.GET, PATH, 2);
    }
}
