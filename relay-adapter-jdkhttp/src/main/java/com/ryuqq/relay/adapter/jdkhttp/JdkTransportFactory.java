package com.ryuqq.relay.adapter.jdkhttp;

import com.ryuqq.relay.core.model.HostKey;
import com.ryuqq.relay.core.spi.HttpTransport;
import com.ryuqq.relay.core.spi.TransportFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 호스트별 {@link JdkHttpTransport} 생성기.
 *
 * <p>각 Transport는 자신만의 HttpClient와 데몬 스레드 풀을 가지며,
 * Session Pool에서 제거될 때 스레드 풀이 종료됩니다. 리다이렉트는 따라가지 않습니다
 * (202 Location은 엔진이 직접 폴링).</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class JdkTransportFactory implements TransportFactory {

    private static final Logger log = LoggerFactory.getLogger(JdkTransportFactory.class);

    private final Duration connectTimeout;
    private final int threadsPerHost;

    /**
     * 기본값: connectTimeout=10s, 호스트당 스레드 2개.
     */
    public JdkTransportFactory() {
        this(Duration.ofSeconds(10), 2);
    }

    public JdkTransportFactory(Duration connectTimeout, int threadsPerHost) {
        if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive (current: " + connectTimeout + ")");
        }
        if (threadsPerHost <= 0) {
            throw new IllegalArgumentException("threadsPerHost must be positive (current: " + threadsPerHost + ")");
        }
        this.connectTimeout = connectTimeout;
        this.threadsPerHost = threadsPerHost;
    }

    @Override
    public HttpTransport create(HostKey hostKey) {
        ExecutorService executor = Executors.newFixedThreadPool(threadsPerHost, daemonThreads(hostKey));
        HttpClient client = HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .followRedirects(HttpClient.Redirect.NEVER)
            .executor(executor)
            .build();
        log.debug("Created HTTP transport for {}", hostKey.getValue());
        return new JdkHttpTransport(hostKey, client, executor);
    }

    private static ThreadFactory daemonThreads(HostKey hostKey) {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "relay-http-" + hostKey.getHost() + "-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
