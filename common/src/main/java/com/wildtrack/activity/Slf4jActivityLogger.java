package com.wildtrack.activity;

import com.wildtrack.errors.Failures;
import com.wildtrack.model.Integration;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * {@link ActivityLogger} that writes the action lifecycle to the application log.
 */
@Slf4j
public class Slf4jActivityLogger implements ActivityLogger {

    @Override
    public <T> CompletableFuture<T> run(Integration integration, String actionId,
                                        Supplier<CompletableFuture<T>> action) {
        long startNanos = System.nanoTime();
        log.info("Action '{}' started for integration {}", actionId, integration.getId());

        CompletableFuture<T> future;
        try {
            future = action.get();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }

        return future.whenComplete((result, error) -> {
            long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
            if (error == null) {
                log.info("Action '{}' completed for integration {} in {} ms: {}",
                        actionId, integration.getId(), elapsedMs, result);
            } else {
                log.atError()
                        .addKeyValue("integration_id", integration.getId())
                        .addKeyValue("action_id", actionId)
                        .log("Action '{}' failed for integration {} after {} ms: {}",
                                actionId, integration.getId(), elapsedMs, Failures.describe(error));
            }
        });
    }
}
