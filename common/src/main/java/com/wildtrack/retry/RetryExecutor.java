package com.wildtrack.retry;

import com.wildtrack.errors.Failures;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Applies a {@link RetryPolicy} around an asynchronous unit of work.
 *
 * <p>Each attempt calls the supplier again, so the work must be re-runnable.  Waiting
 * between attempts is scheduled with {@link CompletableFuture#delayedExecutor}; no thread
 * is blocked while the delay elapses.</p>
 *
 * <p>The returned future completes with the first successful value, or exceptionally with
 * the unwrapped cause of the last failed attempt.</p>
 */
@Slf4j
public class RetryExecutor {

    private final RetryPolicy policy;
    private final Executor executor;

    public RetryExecutor(RetryPolicy policy) {
        this(policy, ForkJoinPool.commonPool());
    }

    public RetryExecutor(RetryPolicy policy, Executor executor) {
        this.policy = policy;
        this.executor = executor;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    /**
     * Runs {@code work} until it succeeds, fails with a non-retryable error, or the attempts
     * are exhausted.
     *
     * @param operation short description used in log lines
     * @param work      produces a fresh attempt each time it is called
     */
    public <T> CompletableFuture<T> execute(String operation, Supplier<CompletableFuture<T>> work) {
        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(operation, work, 1, result);
        return result;
    }

    private <T> void attempt(String operation, Supplier<CompletableFuture<T>> work,
                             int attemptNumber, CompletableFuture<T> result) {
        CompletableFuture<T> future;
        try {
            future = work.get();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }

        future.whenComplete((value, throwable) -> {
            if (throwable == null) {
                result.complete(value);
                return;
            }

            Throwable cause = Failures.unwrap(throwable);
            if (attemptNumber < policy.getMaxAttempts() && policy.isRetryable(cause)) {
                log.warn("{} failed on attempt {}/{}, retrying in {} ms: {}",
                        operation, attemptNumber, policy.getMaxAttempts(),
                        policy.getDelay().toMillis(), cause.getMessage());
                Executor delayed = CompletableFuture.delayedExecutor(
                        policy.getDelay().toMillis(), TimeUnit.MILLISECONDS, executor);
                delayed.execute(() -> attempt(operation, work, attemptNumber + 1, result));
            } else {
                if (attemptNumber > 1) {
                    log.error("{} failed after {} attempt(s): {}",
                            operation, attemptNumber, cause.getMessage());
                }
                result.completeExceptionally(cause);
            }
        });
    }
}
