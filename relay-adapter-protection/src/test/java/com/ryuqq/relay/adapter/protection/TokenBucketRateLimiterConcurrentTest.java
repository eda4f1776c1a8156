package com.ryuqq.relay.adapter.protection;

import com.ryuqq.relay.core.protection.RateLimiterConfig;
import com.ryuqq.relay.core.time.CallContext;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * TokenBucketRateLimiter 동시성 테스트 (실제 시계).
 *
 * @author Relay Team
 * @since 1.0.0
 */
class TokenBucketRateLimiterConcurrentTest {

    @Test
    void acquire_여러_스레드가_경쟁해도_전체_속도_유지() throws Exception {
        // given
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(new RateLimiterConfig(50, 1));
        ExecutorService executor = Executors.newFixedThreadPool(8);
        int total = 26;

        // when
        long start = System.nanoTime();
        List<Future<Duration>> futures = new ArrayList<>();
        for (int i = 0; i < total; i++) {
            Callable<Duration> task = () -> limiter.acquire(CallContext.none());
            futures.add(executor.submit(task));
        }
        for (Future<Duration> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        executor.shutdown();

        // then: 1 burst + 25 more at 50/s → at least 500ms
        assertThat(elapsedMs).isGreaterThanOrEqualTo(450);
    }
}
