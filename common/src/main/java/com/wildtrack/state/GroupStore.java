package com.wildtrack.state;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Shared store of named string sets ("groups").
 *
 * <p>Implementations are shared across concurrent integration runs.  Every method may
 * suspend on I/O, hence the asynchronous signatures.  {@link #move} must be atomic per value:
 * an observer never sees a value in both groups or in neither.</p>
 */
public interface GroupStore {

    /** Adds the values to the group, creating it when absent. */
    CompletableFuture<Void> add(String group, Collection<String> values);

    CompletableFuture<Boolean> isMember(String group, String value);

    /**
     * Moves each value that is a member of {@code fromGroup} into {@code toGroup}.
     * Values that are not members of {@code fromGroup} are left untouched.
     */
    CompletableFuture<Void> move(String fromGroup, String toGroup, Collection<String> values);

    /** Snapshot of the group's members in insertion order. */
    CompletableFuture<Set<String>> members(String group);
}
