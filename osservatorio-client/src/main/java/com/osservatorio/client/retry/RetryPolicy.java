package com.osservatorio.client.retry;

import com.osservatorio.common.exception.TransientUpstreamException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Data-only description of how to retry: how many attempts, how long to wait
 * between them and which failures are worth another attempt. The loop that
 * applies it lives with the caller.
 */
@Value
@Builder(toBuilder = true)
public class RetryPolicy {

    @Builder.Default
    int maxAttempts = 4;
    @Builder.Default
    Duration initialBackoff = Duration.ofSeconds(1);
    @Builder.Default
    double multiplier = 2.0;
    @Builder.Default
    Duration maxBackoff = Duration.ofSeconds(30);
    // fraction of the delay randomized in both directions, 0 disables jitter
    @Builder.Default
    double jitter = 0.0;
    @Builder.Default
    Predicate<Throwable> retryable = e -> e instanceof TransientUpstreamException;

    public static RetryPolicy noRetry() {
        return RetryPolicy.builder().maxAttempts(1).build();
    }

    /**
     * @param attemptsMade attempts already made, including the one that just failed
     */
    public boolean shouldRetry(int attemptsMade, Throwable error) {
        return attemptsMade < maxAttempts && retryable.test(error);
    }

    /**
     * Delay before the next attempt, growing exponentially: with the defaults
     * 1s, 2s, 4s after the first, second and third failure.
     *
     * @param attemptsMade attempts already made (1 after the first failure)
     * @param random       value in [0, 1) used for jitter
     */
    public Duration backoffAfter(int attemptsMade, double random) {
        double base = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, attemptsMade - 1));
        double capped = Math.min(base, maxBackoff.toMillis());
        double jittered = capped * (1.0 - jitter + 2.0 * jitter * random);
        return Duration.ofMillis(Math.max(0L, Math.round(jittered)));
    }
}
