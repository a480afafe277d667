package com.wildtrack.activity;

import com.wildtrack.model.Integration;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Audits every top-level action invocation (start, completion, failure).
 */
public interface ActivityLogger {

    /**
     * Runs the action and records its lifecycle.  The returned future mirrors the action's.
     */
    <T> CompletableFuture<T> run(Integration integration, String actionId, Supplier<CompletableFuture<T>> action);
}
