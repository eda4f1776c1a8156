package com.ryuqq.relay.engine.config;

import java.time.Duration;

/**
 * AsyncOperationPoller 설정.
 *
 * @author Relay Team
 * @since 1.0.0
 * @param pollInterval Retry-After가 없을 때의 폴링 간격 (양수, 기본 5s)
 * @param maxWait 첫 202 이후 완료를 기다리는 최대 시간 (pollInterval 이상, 기본 300s)
 */
public record PollerConfig(Duration pollInterval, Duration maxWait) {

    public PollerConfig {
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException(
                "pollInterval must be positive (current: " + pollInterval + ")"
            );
        }
        if (maxWait == null || maxWait.compareTo(pollInterval) < 0) {
            throw new IllegalArgumentException(
                "maxWait must be >= pollInterval (interval: " + pollInterval + ", maxWait: " + maxWait + ")"
            );
        }
    }

    public static PollerConfig defaults() {
        return new PollerConfig(Duration.ofSeconds(5), Duration.ofSeconds(300));
    }

    public PollerConfig withPollInterval(Duration pollInterval) {
        return new PollerConfig(pollInterval, maxWait);
    }

    public PollerConfig withMaxWait(Duration maxWait) {
        return new PollerConfig(pollInterval, maxWait);
    }
}
