package com.ryuqq.relay.engine;

import com.ryuqq.relay.adapter.inmemory.time.ManualTicker;
import com.ryuqq.relay.adapter.inmemory.transport.InMemoryTransport;
import com.ryuqq.relay.adapter.inmemory.transport.InMemoryTransportFactory;
import com.ryuqq.relay.adapter.inmemory.transport.RecordedRequest;
import com.ryuqq.relay.adapter.protection.ConsecutiveFailureCircuitBreaker;
import com.ryuqq.relay.core.exception.AuthenticationException;
import com.ryuqq.relay.core.exception.CircuitOpenException;
import com.ryuqq.relay.core.exception.OperationFailedException;
import com.ryuqq.relay.core.exception.RateLimitedException;
import com.ryuqq.relay.core.exception.RequestCancelledException;
import com.ryuqq.relay.core.exception.RequestTimeoutException;
import com.ryuqq.relay.core.model.HttpMethod;
import com.ryuqq.relay.core.model.Payload;
import com.ryuqq.relay.core.model.RequestSpec;
import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.CircuitBreakerConfig;
import com.ryuqq.relay.core.protection.CircuitBreakerState;
import com.ryuqq.relay.core.protection.RateLimiterConfig;
import com.ryuqq.relay.core.protection.noop.NoOpCircuitBreaker;
import com.ryuqq.relay.core.protection.noop.NoOpRateLimiter;
import com.ryuqq.relay.core.result.ErrorKind;
import com.ryuqq.relay.core.result.OperationResult;
import com.ryuqq.relay.core.spi.HttpTransport;
import com.ryuqq.relay.core.spi.TransportFactory;
import com.ryuqq.relay.core.spi.TransportResponse;
import com.ryuqq.relay.core.time.CancellationToken;
import com.ryuqq.relay.engine.config.EngineConfig;
import com.ryuqq.relay.engine.config.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * RequestEngine 유닛 테스트.
 *
 * <ul>
 *   <li>헤더 병합 (기본 헤더, 인증, 옵션, If-Match)</li>
 *   <li>Circuit Breaker 연동 (거부, 논리 호출당 1회 기록)</li>
 *   <li>202 비동기 작업 폴링</li>
 *   <li>실패 결과의 예외 매핑</li>
 *   <li>취소/호출 마감</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
class RequestEngineTest {

    private static final String BASE = "https://api.example.com";
    private static final String ITEMS = "/v1/items";
    private static final String TOKEN = "secret-token";

    private ManualTicker clock;
    private InMemoryTransportFactory transports;
    private EngineConfig config;

    @BeforeEach
    void setUp() {
        clock = new ManualTicker();
        transports = new InMemoryTransportFactory();
        config = EngineConfig.defaults()
            .withRateLimiter(RateLimiterConfig.unlimited())
            .withRetry(RetryConfig.defaults().withJitter(1.0, 1.0));
    }

    // ============================================================
    // 1. 생성 / 헤더
    // ============================================================

    @Test
    void requireAuth인데_토큰이_없으면_생성_실패() {
        EngineConfig authRequired = config.withRequireAuth(true);

        assertThatThrownBy(() -> new RequestEngine(authRequired, " ", transports, new NoOpCircuitBreaker(), new NoOpRateLimiter()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("bearerToken is required when requireAuth is enabled");
    }

    @Test
    void 기본_헤더와_Bearer_토큰이_모든_요청에_포함() {
        // given
        transports.respond(HttpMethod.GET, ITEMS, 200, "[]", Map.of());
        RequestEngine engine = engine(new NoOpCircuitBreaker());

        // when
        engine.get(BASE + ITEMS);

        // then
        RecordedRequest sent = transports.requests().get(0);
        assertThat(sent.header("Authorization")).isEqualTo("Bearer " + TOKEN);
        assertThat(sent.header("Content-Type")).isEqualTo("application/json");
        assertThat(sent.header("Accept")).isEqualTo("application/json");
        assertThat(sent.header("Prefer")).isEqualTo("return=representation");
    }

    @Test
    void 옵션_헤더가_기본_헤더를_덮어쓰고_If_Match_추가() {
        // given
        transports.respond(HttpMethod.PATCH, ITEMS + "/1", 200, "{}", Map.of());
        RequestEngine engine = engine(new NoOpCircuitBreaker());
        RequestOptions options = RequestOptions.defaults()
            .withHeader("Accept", "text/csv")
            .withIfMatch("\"v7\"");

        // when
        engine.patch(BASE + ITEMS + "/1", Payload.of("{\"name\":\"x\"}"), options);

        // then
        RecordedRequest sent = transports.requests().get(0);
        assertThat(sent.header("Accept")).isEqualTo("text/csv");
        assertThat(sent.header("If-Match")).isEqualTo("\"v7\"");
        assertThat(sent.request().body().asString()).isEqualTo("{\"name\":\"x\"}");
    }

    @Test
    void 헤더_이름은_대소문자_구분없이_덮어씀() {
        // given
        transports.respond(HttpMethod.POST, ITEMS, 201, "{}", Map.of());
        RequestEngine engine = engine(new NoOpCircuitBreaker());
        RequestOptions options = RequestOptions.defaults()
            .withHeader("content-type", "application/merge-patch+json")
            .withHeader("authorization", "Bearer override");

        // when
        engine.post(BASE + ITEMS, Payload.of("{}"), options);

        // then
        Map<String, String> sent = transports.requests().get(0).request().headers();
        assertThat(sent.keySet().stream().filter("Content-Type"::equalsIgnoreCase)).hasSize(1);
        assertThat(sent.keySet().stream().filter("Authorization"::equalsIgnoreCase)).hasSize(1);
        assertThat(transports.requests().get(0).header("Content-Type")).isEqualTo("application/merge-patch+json");
        assertThat(transports.requests().get(0).header("Authorization")).isEqualTo("Bearer override");
    }

    @Test
    void 토큰_없이_생성하면_Authorization_헤더_없음() {
        // given
        transports.respond(HttpMethod.GET, ITEMS, 200, "[]", Map.of());
        RequestEngine engine = new RequestEngine(
            config, null, transports, new NoOpCircuitBreaker(), new NoOpRateLimiter(), clock, clock, null);

        // when
        engine.get(BASE + ITEMS);

        // then
        assertThat(transports.requests().get(0).header("Authorization")).isNull();
    }

    // ============================================================
    // 2. 성공 / 폴링
    // ============================================================

    @Test
    void 성공_결과에_상태코드_본문_시도횟수() {
        // given
        transports.respond(HttpMethod.GET, ITEMS, 503, null, Map.of());
        transports.respond(HttpMethod.GET, ITEMS, 200, "[{\"id\":1}]", Map.of());
        RequestEngine engine = engine(new NoOpCircuitBreaker());

        // when
        OperationResult result = engine.get(BASE + ITEMS);

        // then
        assertThat(result.success()).isTrue();
        assertThat(result.statusCode()).isEqualTo(200);
        assertThat(result.payload().asString()).isEqualTo("[{\"id\":1}]");
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(result.polls()).isZero();
        assertThat(result.totalElapsed()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("202 Accepted + Location이면 완료까지 폴링하고 최종 응답을 반환")
    void acceptedOperationIsPolledToCompletion() {
        // given
        transports.respond(HttpMethod.POST, "/v1/jobs", 202, null, Map.of("Location", "/v1/jobs/7/status"));
        transports.respond(HttpMethod.GET, "/v1/jobs/7/status", 202, null, Map.of());
        transports.respond(HttpMethod.GET, "/v1/jobs/7/status", 200, "{\"id\":7,\"state\":\"done\"}", Map.of());
        RequestEngine engine = engine(new NoOpCircuitBreaker());

        // when
        OperationResult result = engine.post(BASE + "/v1/jobs", Payload.of("{}"));

        // then
        assertThat(result.success()).isTrue();
        assertThat(result.payload().asString()).contains("done");
        assertThat(result.polls()).isEqualTo(2);
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(result.totalElapsed()).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void 옵션으로_멱등성을_지정하면_POST도_재시도() {
        // given
        transports.respond(HttpMethod.POST, ITEMS, 502, null, Map.of());
        transports.respond(HttpMethod.POST, ITEMS, 201, "{\"id\":2}", Map.of());
        RequestEngine engine = engine(new NoOpCircuitBreaker());

        // when
        OperationResult result = engine.post(BASE + ITEMS, Payload.of("{}"), RequestOptions.defaults().withIdempotent(true));

        // then
        assertThat(result.statusCode()).isEqualTo(201);
        assertThat(result.attempts()).isEqualTo(2);
    }

    // ============================================================
    // 3. 실패 → 예외
    // ============================================================

    @Test
    void 인증_실패는_AuthenticationException() {
        // given
        transports.respond(HttpMethod.GET, ITEMS, 401, "{\"error\":\"expired\"}", Map.of());
        RequestEngine engine = engine(new NoOpCircuitBreaker());

        // when
        AuthenticationException e = catchThrowableOfType(() -> engine.get(BASE + ITEMS), AuthenticationException.class);

        // then
        assertThat(e.getStatusCode()).isEqualTo(401);
        assertThat(e.getAttempts()).isEqualTo(1);
        assertThat(e.getResult().payload().asString()).contains("expired");
    }

    @Test
    void 기타_4xx는_OperationFailedException() {
        transports.respond(HttpMethod.DELETE, ITEMS + "/9", 404, null, Map.of());
        RequestEngine engine = engine(new NoOpCircuitBreaker());

        assertThatThrownBy(() -> engine.delete(BASE + ITEMS + "/9"))
            .isInstanceOf(OperationFailedException.class)
            .hasMessageContaining("status=404");
    }

    @Test
    void 상태429_소진은_RateLimitedException() {
        transports.respondRepeatedly(HttpMethod.GET, ITEMS, 429, null, Map.of("Retry-After", "1"));
        RequestEngine engine = engine(new NoOpCircuitBreaker());

        RateLimitedException e = catchThrowableOfType(() -> engine.get(BASE + ITEMS), RateLimitedException.class);

        assertThat(e.getAttempts()).isEqualTo(4);
        assertThat(e.getErrorKind()).isEqualTo(ErrorKind.RATE_LIMITED);
    }

    @Test
    void execute는_예외없이_실패_결과_반환() {
        // given
        transports.respond(HttpMethod.GET, ITEMS, 400, "bad", Map.of());
        RequestEngine engine = engine(new NoOpCircuitBreaker());

        // when
        OperationResult result = engine.execute(RequestSpec.of(HttpMethod.GET, URI.create(BASE + ITEMS)), null);

        // then
        assertThat(result.success()).isFalse();
        assertThat(result.errorKind()).isEqualTo(ErrorKind.OPERATION);
        assertThat(result.statusCode()).isEqualTo(400);
    }

    // ============================================================
    // 4. Circuit Breaker
    // ============================================================

    @Test
    void 연속_실패로_OPEN되면_전송없이_CircuitOpenException() {
        // given
        config = config
            .withRetry(config.retry().withMaxRetries(0))
            .withCircuitBreaker(new CircuitBreakerConfig(2, Duration.ofSeconds(60)));
        ConsecutiveFailureCircuitBreaker breaker = new ConsecutiveFailureCircuitBreaker(config.circuitBreaker(), clock);
        transports.respondRepeatedly(HttpMethod.GET, ITEMS, 503, null, Map.of());
        RequestEngine engine = engine(breaker);

        // when
        OperationResult first = engine.execute(RequestSpec.of(HttpMethod.GET, URI.create(BASE + ITEMS)), null);
        OperationResult second = engine.execute(RequestSpec.of(HttpMethod.GET, URI.create(BASE + ITEMS)), null);
        CircuitOpenException rejected = catchThrowableOfType(() -> engine.get(BASE + ITEMS), CircuitOpenException.class);

        // then
        assertThat(first.errorKind()).isEqualTo(ErrorKind.TRANSIENT_NETWORK);
        assertThat(second.errorKind()).isEqualTo(ErrorKind.TRANSIENT_NETWORK);
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(rejected.getAttempts()).isZero();
        assertThat(transports.requestCount(HttpMethod.GET, ITEMS)).isEqualTo(2);
    }

    @Test
    void OPEN_타임아웃_후_시험_호출이_성공하면_CLOSED() {
        // given
        config = config
            .withRetry(config.retry().withMaxRetries(0))
            .withCircuitBreaker(new CircuitBreakerConfig(1, Duration.ofSeconds(30)));
        ConsecutiveFailureCircuitBreaker breaker = new ConsecutiveFailureCircuitBreaker(config.circuitBreaker(), clock);
        transports.respond(HttpMethod.GET, ITEMS, 500, null, Map.of());
        transports.respond(HttpMethod.GET, ITEMS, 200, "[]", Map.of());
        RequestEngine engine = engine(breaker);
        engine.execute(RequestSpec.of(HttpMethod.GET, URI.create(BASE + ITEMS)), null);

        // when
        clock.advance(Duration.ofSeconds(30));
        OperationResult result = engine.get(BASE + ITEMS);

        // then
        assertThat(result.success()).isTrue();
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    @DisplayName("HALF_OPEN 시험 호출에서 Transport가 RuntimeException을 던져도 OPERATION 실패로 끝나고 다음 호출이 시험 슬롯을 얻는다")
    void 시험_호출의_예기치_못한_예외() {
        // given
        config = config
            .withRetry(config.retry().withMaxRetries(0))
            .withCircuitBreaker(new CircuitBreakerConfig(1, Duration.ofSeconds(60)));
        ConsecutiveFailureCircuitBreaker breaker = new ConsecutiveFailureCircuitBreaker(config.circuitBreaker(), clock);
        transports.respond(HttpMethod.GET, ITEMS, 500, null, Map.of());
        transports.respondRepeatedly(HttpMethod.GET, ITEMS, 200, "[]", Map.of());
        TransportFactory rejectsConnectionHeader = hostKey -> {
            HttpTransport delegate = transports.create(hostKey);
            return new HttpTransport() {
                @Override
                public TransportResponse send(RequestSpec request, Duration timeout, CancellationToken cancellation)
                        throws IOException, InterruptedException {
                    if (request.headers().containsKey("Connection")) {
                        throw new IllegalArgumentException("restricted header name: \"Connection\"");
                    }
                    return delegate.send(request, timeout, cancellation);
                }

                @Override
                public void close() {
                    delegate.close();
                }
            };
        };
        RequestEngine engine = new RequestEngine(
            config, TOKEN, rejectsConnectionHeader, breaker, new NoOpRateLimiter(), clock, clock, null);
        RequestSpec request = RequestSpec.of(HttpMethod.GET, URI.create(BASE + ITEMS));
        engine.execute(request, null);
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        clock.advance(Duration.ofSeconds(60));

        // when
        OperationResult trial = engine.execute(request, RequestOptions.defaults().withHeader("Connection", "close"));
        OperationResult next = engine.execute(request, null);

        // then
        assertThat(trial.success()).isFalse();
        assertThat(trial.errorKind()).isEqualTo(ErrorKind.OPERATION);
        assertThat(trial.message()).contains("restricted header name");
        assertThat(next.success()).isTrue();
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void 세션_풀이_닫힌_뒤의_호출은_예외없이_OPERATION_실패() {
        // given
        CircuitBreaker breaker = permissiveBreaker();
        RequestEngine engine = engine(breaker);
        engine.close();

        // when
        OperationResult result = engine.execute(RequestSpec.of(HttpMethod.GET, URI.create(BASE + ITEMS)), null);

        // then
        assertThat(result.success()).isFalse();
        assertThat(result.errorKind()).isEqualTo(ErrorKind.OPERATION);
        assertThat(result.message()).contains("SessionPool is closed");
        verify(breaker).releasePermit();
        verify(breaker, never()).recordFailure(any());
        verify(breaker, never()).recordSuccess();
    }

    @Test
    void 재시도가_여러번이어도_Breaker_기록은_논리_호출당_1회() {
        // given
        CircuitBreaker breaker = permissiveBreaker();
        transports.respondRepeatedly(HttpMethod.GET, ITEMS, 503, null, Map.of());
        RequestEngine engine = engine(breaker);

        // when
        engine.execute(RequestSpec.of(HttpMethod.GET, URI.create(BASE + ITEMS)), null);

        // then
        assertThat(transports.requestCount(HttpMethod.GET, ITEMS)).isEqualTo(4);
        verify(breaker, times(1)).recordFailure(any());
        verify(breaker, never()).recordSuccess();
        verify(breaker, never()).releasePermit();
    }

    @Test
    void 서버가_응답한_4xx는_Breaker에_성공으로_기록() {
        // given
        CircuitBreaker breaker = permissiveBreaker();
        transports.respond(HttpMethod.GET, ITEMS, 403, null, Map.of());
        RequestEngine engine = engine(breaker);

        // when
        engine.execute(RequestSpec.of(HttpMethod.GET, URI.create(BASE + ITEMS)), null);

        // then
        verify(breaker).recordSuccess();
        verify(breaker, never()).recordFailure(any());
    }

    // ============================================================
    // 5. 취소 / 호출 마감
    // ============================================================

    @Test
    void 취소된_호출은_RequestCancelledException이고_Breaker_허가만_반납() {
        // given
        CircuitBreaker breaker = permissiveBreaker();
        CancellationToken token = CancellationToken.create();
        token.cancel();
        RequestEngine engine = engine(breaker);

        // when
        RequestCancelledException e = catchThrowableOfType(
            () -> engine.get(BASE + ITEMS, RequestOptions.defaults().withCancellation(token)),
            RequestCancelledException.class);

        // then
        assertThat(e.getErrorKind()).isEqualTo(ErrorKind.CANCELLED);
        assertThat(transports.requests()).isEmpty();
        verify(breaker).releasePermit();
        verify(breaker, never()).recordFailure(any());
        verify(breaker, never()).recordSuccess();
    }

    @Test
    void 호출_마감을_넘기면_RequestTimeoutException() {
        // given
        CircuitBreaker breaker = permissiveBreaker();
        transports.respondRepeatedly(HttpMethod.GET, ITEMS, 503, null, Map.of());
        RequestEngine engine = engine(breaker);

        // when
        RequestTimeoutException e = catchThrowableOfType(
            () -> engine.get(BASE + ITEMS, RequestOptions.defaults().withTimeout(Duration.ofMillis(1500))),
            RequestTimeoutException.class);

        // then
        assertThat(e.getAttempts()).isEqualTo(2);
        verify(breaker).releasePermit();
        verify(breaker, never()).recordFailure(any());
    }

    // ============================================================
    // 6. 종료
    // ============================================================

    @Test
    void close하면_모든_Transport_종료() {
        // given
        transports.respond(HttpMethod.GET, ITEMS, 200, "[]", Map.of());
        transports.respond(HttpMethod.GET, "/v2/items", 200, "[]", Map.of());
        RequestEngine engine = engine(new NoOpCircuitBreaker());
        engine.get(BASE + ITEMS);
        engine.get("https://other.example.com/v2/items");

        // when
        engine.close();

        // then
        assertThat(transports.createdTransports()).hasSize(2).allMatch(InMemoryTransport::isClosed);
    }

    private RequestEngine engine(CircuitBreaker breaker) {
        return new RequestEngine(config, TOKEN, transports, breaker, new NoOpRateLimiter(), clock, clock, null);
    }

    private static CircuitBreaker permissiveBreaker() {
        CircuitBreaker breaker = mock(CircuitBreaker.class);
        when(breaker.tryAcquire()).thenReturn(true);
        when(breaker.getState()).thenReturn(CircuitBreakerState.CLOSED);
        return breaker;
    }
}
