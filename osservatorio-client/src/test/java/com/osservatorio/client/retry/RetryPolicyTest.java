package com.osservatorio.client.retry;

import com.osservatorio.common.exception.RateLimitExceededException;
import com.osservatorio.common.exception.TransientUpstreamException;
import com.osservatorio.common.exception.UpstreamRejectedException;
import com.osservatorio.common.model.RateTier;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPolicyTest {

    private final RetryPolicy policy = RetryPolicy.builder()
            .maxAttempts(4)
            .initialBackoff(Duration.ofSeconds(1))
            .multiplier(2.0)
            .maxBackoff(Duration.ofSeconds(5))
            .build();

    @Test
    void backoffDoublesAndIsCapped() {
        assertThat(policy.backoffAfter(1, 0.5)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.backoffAfter(2, 0.5)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.backoffAfter(3, 0.5)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.backoffAfter(4, 0.5)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void jitterStaysWithinItsBand() {
        RetryPolicy jittered = policy.toBuilder().jitter(0.2).build();

        assertThat(jittered.backoffAfter(1, 0.0)).isEqualTo(Duration.ofMillis(800));
        assertThat(jittered.backoffAfter(1, 0.999)).isBetween(Duration.ofMillis(1190), Duration.ofMillis(1200));
    }

    @Test
    void retriesOnlyTransientErrorsWithinTheAttemptBudget() {
        TransientUpstreamException transientError = new TransientUpstreamException("503", 503, null);

        assertThat(policy.shouldRetry(1, transientError)).isTrue();
        assertThat(policy.shouldRetry(3, transientError)).isTrue();
        assertThat(policy.shouldRetry(4, transientError)).isFalse();
        assertThat(policy.shouldRetry(1, new UpstreamRejectedException(404, "missing"))).isFalse();
        assertThat(policy.shouldRetry(1, new RateLimitExceededException("id", RateTier.MINUTE,
                Duration.ofSeconds(3), Instant.now()))).isFalse();
    }

    @Test
    void noRetryAllowsASingleAttempt() {
        assertThat(RetryPolicy.noRetry().shouldRetry(1, new TransientUpstreamException("x", 0, null))).isFalse();
    }
}
