package com.ryuqq.relay.adapter.jdkhttp;

import com.ryuqq.relay.core.model.HostKey;
import com.ryuqq.relay.core.model.Payload;
import com.ryuqq.relay.core.model.RequestSpec;
import com.ryuqq.relay.core.spi.HttpTransport;
import com.ryuqq.relay.core.spi.TransportResponse;
import com.ryuqq.relay.core.spi.TransportTimeoutException;
import com.ryuqq.relay.core.time.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link java.net.http.HttpClient} 기반 {@link HttpTransport}.
 *
 * <p>호스트 하나당 HttpClient 하나를 사용하며, HttpClient 내부 커넥션 풀이
 * keep-alive 커넥션을 재사용합니다.</p>
 *
 * <p><strong>타임아웃/취소:</strong></p>
 * <ul>
 *   <li>요청은 {@code sendAsync}로 보내고 {@code timeout} 동안만 기다립니다.</li>
 *   <li>타임아웃 또는 취소 시 future를 cancel하여 진행 중인 교환을 중단합니다.</li>
 *   <li>취소된 경우 {@code future.get}이 {@link java.util.concurrent.CancellationException}을 그대로 던집니다.</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class JdkHttpTransport implements HttpTransport {

    private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);

    private final HostKey hostKey;
    private final HttpClient client;
    private final ExecutorService executor;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * @param hostKey 대상 호스트
     * @param client 이 호스트 전용 HttpClient
     * @param executor client에 설정된 executor (close 시 종료, 없으면 null)
     */
    public JdkHttpTransport(HostKey hostKey, HttpClient client, ExecutorService executor) {
        if (hostKey == null) {
            throw new IllegalArgumentException("hostKey cannot be null");
        }
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        this.hostKey = hostKey;
        this.client = client;
        this.executor = executor;
    }

    @Override
    public TransportResponse send(RequestSpec request, Duration timeout, CancellationToken cancellation)
            throws IOException, InterruptedException {
        if (closed.get()) {
            throw new IOException("transport for " + hostKey.getValue() + " is closed");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new TransportTimeoutException("no time left for request to " + request.url());
        }

        HttpRequest httpRequest = toHttpRequest(request, timeout);
        CompletableFuture<HttpResponse<byte[]>> future =
            client.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray());

        try (CancellationToken.Registration ignored = cancellation.onCancel(() -> future.cancel(true))) {
            HttpResponse<byte[]> response = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return toTransportResponse(response, request);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransportTimeoutException("no response within " + timeout.toMillis() + "ms from " + request.url(), e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            throw unwrap(e, request);
        }
    }

    private static HttpRequest toHttpRequest(RequestSpec request, Duration timeout) {
        HttpRequest.BodyPublisher body = request.body().isEmpty()
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofByteArray(request.body().bytes());

        HttpRequest.Builder builder = HttpRequest.newBuilder(request.url())
            .timeout(timeout)
            .method(request.method().name(), body);
        try {
            request.headers().forEach(builder::header);
            return builder.build();
        } catch (IllegalArgumentException e) {
            // 제한 헤더(Connection, Host 등)나 잘못된 헤더 값: 재시도해도 같은 결과
            throw new IllegalArgumentException("invalid request to " + request.url() + ": " + e.getMessage(), e);
        }
    }

    private static TransportResponse toTransportResponse(HttpResponse<byte[]> response, RequestSpec request)
            throws IOException {
        int status = response.statusCode();
        if (status < 100 || status > 599) {
            throw new IOException("invalid response status " + status + " from " + request.url());
        }
        return new TransportResponse(status, response.headers().map(), Payload.of(response.body()));
    }

    private static IOException unwrap(ExecutionException e, RequestSpec request) {
        Throwable cause = e.getCause();
        if (cause instanceof HttpTimeoutException timeout) {
            return new TransportTimeoutException(timeout.getMessage(), timeout);
        }
        if (cause instanceof IOException io) {
            return io;
        }
        return new IOException("request to " + request.url() + " failed", cause);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.debug("Closing HTTP transport for {}", hostKey.getValue());
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public HostKey getHostKey() {
        return hostKey;
    }

    public boolean isClosed() {
        return closed.get();
    }
}
