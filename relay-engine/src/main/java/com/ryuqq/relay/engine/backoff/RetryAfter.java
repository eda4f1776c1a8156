package com.ryuqq.relay.engine.backoff;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Retry-After 헤더 파서.
 *
 * <p>두 형식을 지원합니다.</p>
 * <ul>
 *   <li>delta-seconds: {@code Retry-After: 120} (소수 허용)</li>
 *   <li>HTTP-date: {@code Retry-After: Wed, 21 Oct 2015 07:28:00 GMT}, 과거 시각이면 0</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class RetryAfter {

    private RetryAfter() {
    }

    /**
     * 헤더 값 해석.
     *
     * @param value 헤더 값 (null 허용)
     * @param clock HTTP-date 비교 기준 시계
     * @return 대기 시간 (해석 불가, 음수이면 empty)
     */
    public static Optional<Duration> parse(String value, Clock clock) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        if (Character.isDigit(trimmed.charAt(0)) || trimmed.charAt(0) == '.') {
            return parseSeconds(trimmed);
        }
        try {
            ZonedDateTime at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
            Duration delta = Duration.between(clock.instant(), at.toInstant());
            return Optional.of(delta.isNegative() ? Duration.ZERO : delta);
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<Duration> parseSeconds(String value) {
        try {
            double seconds = Double.parseDouble(value);
            if (Double.isNaN(seconds) || Double.isInfinite(seconds) || seconds < 0) {
                return Optional.empty();
            }
            return Optional.of(Duration.ofNanos(Math.round(seconds * 1_000_000_000.0)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
