package com.wildtrack.staging;

import com.wildtrack.errors.Failures;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Serialises asynchronous tasks that share a key without blocking any thread.
 *
 * <p>Each submission is chained behind the previous one for the same key; tasks for
 * different keys run independently.  The tail entry is removed once the last queued task
 * finishes, so idle keys hold no memory.</p>
 */
final class KeyedSequencer {

    private final ConcurrentMap<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    <T> CompletableFuture<T> submit(String key, Supplier<CompletableFuture<T>> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        CompletableFuture<Void> done = new CompletableFuture<>();
        CompletableFuture<Void> predecessor = tails.put(key, done);
        CompletableFuture<Void> start = predecessor != null
                ? predecessor : CompletableFuture.completedFuture(null);

        start.thenCompose(ignored -> start(task))
                .whenComplete((value, error) -> {
                    tails.remove(key, done);
                    done.complete(null);
                    if (error != null) {
                        result.completeExceptionally(Failures.unwrap(error));
                    } else {
                        result.complete(value);
                    }
                });
        return result;
    }

    int activeKeys() {
        return tails.size();
    }

    private static <T> CompletableFuture<T> start(Supplier<CompletableFuture<T>> task) {
        try {
            return task.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
