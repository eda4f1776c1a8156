package com.ryuqq.relay.adapter.inmemory.time;

import com.ryuqq.relay.core.time.CallAbortedException;
import com.ryuqq.relay.core.time.CallContext;
import com.ryuqq.relay.core.time.CancellationToken;
import com.ryuqq.relay.core.time.Deadline;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ManualTicker tests.
 *
 * @author Relay Team
 * @since 1.0.0
 */
class ManualTickerTest {

    @Test
    void sleep_AdvancesClockAndRecords() {
        // given
        ManualTicker clock = new ManualTicker();

        // when
        clock.sleep(Duration.ofMillis(250), CallContext.none());
        clock.sleep(Duration.ofSeconds(1), CallContext.none());

        // then
        assertThat(clock.read()).isEqualTo(Duration.ofMillis(1250).toNanos());
        assertThat(clock.sleeps()).containsExactly(Duration.ofMillis(250), Duration.ofSeconds(1));
        assertThat(clock.totalSlept()).isEqualTo(Duration.ofMillis(1250));
    }

    @Test
    void sleep_CancelledContext_Throws() {
        // given
        ManualTicker clock = new ManualTicker();
        CancellationToken token = CancellationToken.create();
        token.cancel();

        // when & then
        assertThatThrownBy(() -> clock.sleep(Duration.ofSeconds(1), new CallContext(Deadline.none(), token)))
            .isInstanceOf(CallAbortedException.class);
        assertThat(clock.read()).isZero();
    }
}
