package com.wildtrack.errors;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for classifying failures that travelled through a {@code CompletableFuture}.
 */
public final class Failures {

    private Failures() {
        // utility class
    }

    /**
     * Strips {@link CompletionException} / {@link ExecutionException} wrappers.
     */
    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Message of the unwrapped failure, falling back to its class name when it has none.
     */
    public static String describe(Throwable throwable) {
        Throwable cause = unwrap(throwable);
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    /**
     * Innermost cause of the failure chain.
     */
    public static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }
}
