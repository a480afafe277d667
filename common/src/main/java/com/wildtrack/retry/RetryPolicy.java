package com.wildtrack.retry;

import com.wildtrack.config.PipelineConfig;
import com.wildtrack.errors.TransientTransportException;
import lombok.NonNull;
import lombok.Value;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * How often and how patiently a unit of work is retried.
 *
 * <p>The delay is fixed between attempts.  Only failures accepted by {@code retryOn} are
 * retried; everything else (configuration, malformed payloads) fails on the first attempt.</p>
 */
@Value
public class RetryPolicy {

    /** Total attempts, including the first one. */
    int maxAttempts;

    @NonNull
    Duration delay;

    @NonNull
    Predicate<Throwable> retryOn;

    public RetryPolicy(int maxAttempts, Duration delay, Predicate<Throwable> retryOn) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.delay = delay;
        this.retryOn = retryOn;
    }

    /**
     * Fixed-delay policy that retries transport failures only.
     */
    public static RetryPolicy onTransientTransport(int maxAttempts, Duration delay) {
        return new RetryPolicy(maxAttempts, delay, TransientTransportException.class::isInstance);
    }

    public static RetryPolicy fromConfig(PipelineConfig.RetrySection section) {
        return onTransientTransport(section.getMaxAttempts(), Duration.ofMillis(section.getDelayMs()));
    }

    public boolean isRetryable(Throwable failure) {
        return retryOn.test(failure);
    }
}
