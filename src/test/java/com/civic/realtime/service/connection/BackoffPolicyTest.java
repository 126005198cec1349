package com.civic.realtime.service.connection;

import com.civic.realtime.service.config.RealtimeConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffPolicyTest {

    @Test
    @DisplayName("Delays never decrease and never exceed the cap")
    void monotonicAndCapped() {
        var policy = BackoffPolicy.from(new RealtimeConfig.Reconnect(), new Random(42));

        long previous = -1;
        for (int attempt = 0; attempt < 40; attempt++) {
            long delay = policy.delayFor(attempt);
            assertThat(delay).isGreaterThanOrEqualTo(previous);
            assertThat(delay).isLessThanOrEqualTo(30_000);
            previous = delay;
        }
        assertThat(policy.delayFor(10)).isEqualTo(30_000);
    }

    @Test
    void jitterStaysWithinBounds() {
        var policy = new BackoffPolicy(1000, 30_000, 1000, new Random(7));

        for (int i = 0; i < 100; i++) {
            assertThat(policy.delayFor(0)).isBetween(1000L, 1999L);
            assertThat(policy.delayFor(2)).isBetween(4000L, 4999L);
        }
    }

    @Test
    void zeroJitterIsDeterministic() {
        var policy = new BackoffPolicy(100, 1000, 0, new Random());

        assertThat(policy.delayFor(0)).isEqualTo(100);
        assertThat(policy.delayFor(1)).isEqualTo(200);
        assertThat(policy.delayFor(3)).isEqualTo(800);
        assertThat(policy.delayFor(4)).isEqualTo(1000);
    }

    @Test
    void hugeAttemptNumbersSaturate() {
        var policy = new BackoffPolicy(1000, 30_000, 1000, new Random());

        assertThat(policy.delayFor(62)).isEqualTo(30_000);
        assertThat(policy.delayFor(Integer.MAX_VALUE)).isEqualTo(30_000);
    }

    @Test
    void rejectsInvalidParameters() {
        assertThatThrownBy(() -> new BackoffPolicy(1000, 500, 0, new Random()))
                .isInstanceOf(RealtimeException.class);
        assertThatThrownBy(() -> new BackoffPolicy(-1, 500, 0, new Random()))
                .isInstanceOf(RealtimeException.class);
        assertThatThrownBy(() -> new BackoffPolicy(100, 500, 0, new Random()).delayFor(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
