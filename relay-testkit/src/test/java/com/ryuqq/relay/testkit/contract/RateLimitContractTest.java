package com.ryuqq.relay.testkit.contract;

import com.ryuqq.relay.core.model.HttpMethod;
import com.ryuqq.relay.core.model.RequestSpec;
import com.ryuqq.relay.core.protection.CircuitBreakerState;
import com.ryuqq.relay.core.protection.RateLimiterConfig;
import com.ryuqq.relay.core.result.ErrorKind;
import com.ryuqq.relay.core.result.OperationResult;
import com.ryuqq.relay.engine.RequestEngine;
import com.ryuqq.relay.engine.RequestOptions;
import com.ryuqq.relay.engine.config.EngineConfig;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: outbound rate limiting.
 *
 * <p>Over any window W the engine starts at most {@code burst + rate * W} requests.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
class RateLimitContractTest extends AbstractEngineContractTest {

    private static final String PATH = "/v1/quotes";

    private EngineConfig limited(double callsPerSecond, double burst) {
        return baseConfig().withRateLimiter(new RateLimiterConfig(callsPerSecond, burst));
    }

    @Test
    void testSequentialCalls_PacedAtConfiguredRate() {
        // Given
        transports.respondRepeatedly(HttpMethod.GET, PATH, 200, "{}", Map.of());
        RequestEngine engine = newEngine(limited(2.0, 1.0));

        // When
        for (int i = 0; i < 5; i++) {
            assertSuccess(engine.get(url(PATH)), 200);
        }

        // Then: four waits of 500ms after the initial token
        assertEquals(2000, clock.totalSlept().toMillis());
        assertEquals(4, clock.sleeps().size());
    }

    @Test
    void testBurst_StartsImmediately() {
        // Given
        transports.respondRepeatedly(HttpMethod.GET, PATH, 200, "{}", Map.of());
        RequestEngine engine = newEngine(limited(2.0, 3.0));

        // When
        for (int i = 0; i < 3; i++) {
            engine.get(url(PATH));
        }

        // Then
        assertTrue(clock.sleeps().isEmpty(), "Burst capacity must not wait");
    }

    @Test
    void testWindowBound_BurstPlusRateTimesWindow() {
        // Given
        transports.respondRepeatedly(HttpMethod.GET, PATH, 200, "{}", Map.of());
        RequestEngine engine = newEngine(limited(4.0, 2.0));
        long start = clock.read();

        // When
        for (int i = 0; i < 10; i++) {
            engine.get(url(PATH));
        }

        // Then: (10 - burst) / rate = 2 seconds at least
        assertTrue(clock.elapsedSince(start).toMillis() >= 2000,
                "Elapsed " + clock.elapsedSince(start).toMillis() + "ms is below the rate bound");
    }

    @Test
    void testRetries_ArePacedByLimiter() {
        // Given
        transports.respond(HttpMethod.GET, PATH, 503, null, Map.of());
        transports.respond(HttpMethod.GET, PATH, 200, "{}", Map.of());
        EngineConfig config = limited(1.0, 1.0);
        config = config.withRetry(config.retry().withBaseDelay(Duration.ofMillis(200)));
        RequestEngine engine = newEngine(config);

        // When
        OperationResult result = engine.get(url(PATH));

        // Then: 200ms backoff, then the limiter waits for the next token
        assertSuccess(result, 200);
        assertEquals(Duration.ofMillis(200), clock.sleeps().get(0));
        assertEquals(1000, clock.totalSlept().toMillis());
    }

    @Test
    void testWaitLongerThanDeadline_FailsFastWithoutSending() {
        // Given
        transports.respondRepeatedly(HttpMethod.GET, PATH, 200, "{}", Map.of());
        RequestEngine engine = newEngine(limited(0.1, 1.0));
        engine.get(url(PATH));

        // When
        OperationResult result = engine.execute(
                RequestSpec.of(HttpMethod.GET, URI.create(url(PATH))),
                RequestOptions.defaults().withTimeout(Duration.ofSeconds(1)));

        // Then
        assertFailure(result, ErrorKind.TIMEOUT);
        assertEquals(0, result.attempts());
        assertRequestCount(HttpMethod.GET, PATH, 1);
        assertEquals(CircuitBreakerState.CLOSED, circuitBreaker.getState());
        assertEquals(0, circuitBreaker.getConsecutiveFailures());
    }
}
