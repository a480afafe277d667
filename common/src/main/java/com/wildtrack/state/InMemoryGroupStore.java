package com.wildtrack.state;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Process-local {@link GroupStore}.
 *
 * <p>All operations synchronise on one monitor, which makes {@link #move} atomic with
 * respect to every other read and write.  Suitable for a single-node deployment and for
 * tests; multi-node deployments need a shared implementation behind the same interface.</p>
 */
@Slf4j
public class InMemoryGroupStore implements GroupStore {

    private final Map<String, Set<String>> groups = new HashMap<>();

    @Override
    public synchronized CompletableFuture<Void> add(String group, Collection<String> values) {
        groups.computeIfAbsent(group, g -> new LinkedHashSet<>()).addAll(values);
        log.debug("Added {} to group '{}'", values, group);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public synchronized CompletableFuture<Boolean> isMember(String group, String value) {
        Set<String> members = groups.get(group);
        return CompletableFuture.completedFuture(members != null && members.contains(value));
    }

    @Override
    public synchronized CompletableFuture<Void> move(String fromGroup, String toGroup,
                                                     Collection<String> values) {
        Set<String> source = groups.get(fromGroup);
        if (source == null) {
            return CompletableFuture.completedFuture(null);
        }
        Set<String> target = groups.computeIfAbsent(toGroup, g -> new LinkedHashSet<>());
        for (String value : values) {
            if (source.remove(value)) {
                target.add(value);
            }
        }
        log.debug("Moved {} from '{}' to '{}'", values, fromGroup, toGroup);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public synchronized CompletableFuture<Set<String>> members(String group) {
        Set<String> members = groups.get(group);
        if (members == null) {
            return CompletableFuture.completedFuture(Collections.emptySet());
        }
        return CompletableFuture.completedFuture(Collections.unmodifiableSet(new LinkedHashSet<>(members)));
    }
}
