package com.ryuqq.relay.engine.config;

/**
 * SessionPool 설정.
 *
 * @author Relay Team
 * @since 1.0.0
 * @param maxSessions 동시에 유지하는 호스트 세션 최대 수 (1 이상, 기본 50)
 */
public record SessionPoolConfig(int maxSessions) {

    public SessionPoolConfig {
        if (maxSessions <= 0) {
            throw new IllegalArgumentException(
                "maxSessions must be positive (current: " + maxSessions + ")"
            );
        }
    }

    public static SessionPoolConfig defaults() {
        return new SessionPoolConfig(50);
    }
}
