package com.wildtrack.retry;

import com.wildtrack.errors.TransientTransportException;
import com.wildtrack.errors.WildtrackException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryExecutorTest {

    private final RetryExecutor executor =
            new RetryExecutor(RetryPolicy.onTransientTransport(3, Duration.ZERO));

    @Test
    void returnsFirstSuccessWithoutRetrying() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute("op", () -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture("ok");
        }).join();

        assertEquals("ok", result);
        assertEquals(1, calls.get());
    }

    @Test
    void retriesTransientFailuresUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute("op", () -> calls.incrementAndGet() < 3
                ? CompletableFuture.<String>failedFuture(new TransientTransportException("boom", 503))
                : CompletableFuture.completedFuture("ok")).join();

        assertEquals("ok", result);
        assertEquals(3, calls.get());
    }

    @Test
    void givesUpAfterMaxAttemptsWithLastCause() {
        AtomicInteger calls = new AtomicInteger();

        CompletionException e = assertThrows(CompletionException.class, () -> executor.execute("op", () -> {
            calls.incrementAndGet();
            return CompletableFuture.<String>failedFuture(new TransientTransportException("down", 502));
        }).join());

        assertEquals(3, calls.get());
        assertInstanceOf(TransientTransportException.class, e.getCause());
        assertEquals(502, ((TransientTransportException) e.getCause()).getStatusCode());
    }

    @Test
    void doesNotRetryNonTransientFailures() {
        AtomicInteger calls = new AtomicInteger();

        CompletionException e = assertThrows(CompletionException.class, () -> executor.execute("op", () -> {
            calls.incrementAndGet();
            return CompletableFuture.<String>failedFuture(new WildtrackException("bad payload"));
        }).join());

        assertEquals(1, calls.get());
        assertEquals("bad payload", e.getCause().getMessage());
    }

    @Test
    void treatsSynchronousThrowAsFailedAttempt() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute("op", () -> {
            if (calls.incrementAndGet() == 1) {
                throw new TransientTransportException("refused", new java.io.IOException("refused"));
            }
            return CompletableFuture.completedFuture("ok");
        }).join();

        assertEquals("ok", result);
        assertEquals(2, calls.get());
    }

    @Test
    void rejectsPolicyWithoutAttempts() {
        assertThrows(IllegalArgumentException.class,
                () -> RetryPolicy.onTransientTransport(0, Duration.ZERO));
    }
}
