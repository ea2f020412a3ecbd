package com.newspulse.ingestor.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryScheduleTest {

    private static RetryPolicy policy(int maxRetries) {
        return RetryPolicy.builder()
                .maxRetries(maxRetries)
                .initialDelay(Duration.ofMillis(100))
                .maxDelay(Duration.ofMillis(1000))
                .multiplier(2.0)
                .jitterFactor(0)
                .build();
    }

    @Test
    void delaysGrowExponentiallyUpToTheCap() {
        RetrySchedule schedule = policy(5).newSchedule();

        assertThat(schedule.nextDelay()).isEqualTo(Duration.ofMillis(100));
        assertThat(schedule.nextDelay()).isEqualTo(Duration.ofMillis(200));
        assertThat(schedule.nextDelay()).isEqualTo(Duration.ofMillis(400));
        assertThat(schedule.nextDelay()).isEqualTo(Duration.ofMillis(800));
        assertThat(schedule.nextDelay()).isEqualTo(Duration.ofMillis(1000));
    }

    @Test
    void budgetIsBoundedByMaxRetries() {
        RetrySchedule schedule = policy(2).newSchedule();

        assertThat(schedule.canRetry()).isTrue();
        schedule.nextDelay();
        schedule.nextDelay();

        assertThat(schedule.canRetry()).isFalse();
        assertThat(schedule.retries()).isEqualTo(2);
        assertThatThrownBy(schedule::nextDelay).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void zeroRetriesNeverRetries() {
        assertThat(policy(0).newSchedule().canRetry()).isFalse();
    }

    @Test
    void serverHintReplacesComputedDelayButIsCapped() {
        RetrySchedule schedule = policy(3).newSchedule();

        assertThat(schedule.nextDelay(Duration.ofMillis(750))).isEqualTo(Duration.ofMillis(750));
        assertThat(schedule.nextDelay(Duration.ofSeconds(60))).isEqualTo(Duration.ofMillis(1000));
        assertThat(schedule.retries()).isEqualTo(2);
    }

    @Test
    void jitterKeepsDelaysWithinTheRandomizationBand() {
        RetryPolicy jittered = RetryPolicy.builder()
                .maxRetries(1)
                .initialDelay(Duration.ofMillis(1000))
                .maxDelay(Duration.ofSeconds(10))
                .jitterFactor(0.5)
                .build();

        for (int i = 0; i < 50; i++) {
            assertThat(jittered.newSchedule().nextDelay().toMillis()).isBetween(500L, 1500L);
        }
    }

    @Test
    void schedulesAreIndependent() {
        RetryPolicy shared = policy(1);
        RetrySchedule first = shared.newSchedule();
        first.nextDelay();

        assertThat(first.canRetry()).isFalse();
        assertThat(shared.newSchedule().canRetry()).isTrue();
    }
}
