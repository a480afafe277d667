package com.wildtrack.staging;

import com.wildtrack.errors.Failures;
import com.wildtrack.state.GroupStore;
import com.wildtrack.storage.FileStorage;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Tracks every staged payload file across the {@code pending}, {@code in_progress} and
 * {@code processed} groups of its integration.
 *
 * <p>The {@link GroupStore} is the single source of truth for a file's state; this class
 * holds no state of its own beyond the per-file sequencer that keeps concurrent
 * transitions of the same file from interleaving.</p>
 *
 * <h3>Transitions</h3>
 * <ul>
 *   <li>Tracked file → atomic {@code move} into the target group, storage metadata updated.</li>
 *   <li>Untracked file → registered as pending, whatever the requested target.</li>
 *   <li>Group store failure → {@link TransitionResult.Outcome#FAILED}, never an exception.</li>
 * </ul>
 *
 * <p>Storage metadata is informational: a metadata update that fails is logged and does not
 * change the outcome of a transition.</p>
 */
@Slf4j
public class StagingFileStateMachine {

    static final String STATUS_METADATA_KEY = "status";
    static final String SET_STATUS_ERROR_MESSAGE = "Error setting file status";

    private final GroupStore groupStore;
    private final FileStorage fileStorage;
    private final String groupPrefix;
    private final KeyedSequencer sequencer = new KeyedSequencer();

    public StagingFileStateMachine(GroupStore groupStore, FileStorage fileStorage, String groupPrefix) {
        this.groupStore = groupStore;
        this.fileStorage = fileStorage;
        this.groupPrefix = groupPrefix;
    }

    public StagingGroups groups(String integrationId) {
        return new StagingGroups(integrationId, groupPrefix);
    }

    // ── Registration and lookup ──────────────────────────────────────────

    /**
     * Adds a newly staged file to the pending group.  Must be called once per file.
     */
    public CompletableFuture<Void> register(String integrationId, String filename) {
        log.info("Registering '{}' as pending for integration {}", filename, integrationId);
        return groupStore.add(groups(integrationId).pending(), List.of(filename));
    }

    /**
     * Finds the group holding the file, checking pending, in-progress and processed in that
     * order and stopping at the first hit.
     */
    public CompletableFuture<Optional<FileStatus>> locate(String integrationId, String filename) {
        return locateFrom(groups(integrationId), filename, 0);
    }

    public CompletableFuture<FileStatusResult> getStatus(String integrationId, String filename) {
        return locate(integrationId, filename)
                .thenApply(found -> found.map(FileStatusResult::of).orElseGet(FileStatusResult::notFound));
    }

    /** Files currently waiting in the pending group, oldest registration first. */
    public CompletableFuture<Set<String>> pendingFiles(String integrationId) {
        return groupStore.members(groups(integrationId).pending());
    }

    // ── Transitions ──────────────────────────────────────────────────────

    /**
     * Moves the file into {@code target}.  The returned future never completes
     * exceptionally; store failures surface as {@link TransitionResult.Outcome#FAILED}.
     */
    public CompletableFuture<TransitionResult> transition(String integrationId, String filename,
                                                          FileStatus target) {
        String key = integrationId + "/" + filename;
        return sequencer.submit(key, () -> doTransition(integrationId, filename, target))
                .exceptionally(error -> {
                    Throwable cause = Failures.unwrap(error);
                    log.error("Failed to move '{}' to '{}' for integration {}: {}",
                            filename, target.getValue(), integrationId, cause.getMessage(), cause);
                    return TransitionResult.failed(filename, cause);
                });
    }

    /**
     * Action-level status change: runs {@link #transition} and renders the outcome as the
     * response returned to the caller.
     */
    public CompletableFuture<FileStatusResult> setStatus(String integrationId, String filename,
                                                         FileStatus target) {
        return transition(integrationId, filename, target).thenApply(result -> {
            switch (result.getOutcome()) {
                case MOVED:
                    return new FileStatusResult(target.getValue(),
                            "File status for '" + filename + "' in integration '" + integrationId
                                    + "' set to '" + target.getValue() + "'.");
                case DEFAULTED_TO_PENDING:
                    return new FileStatusResult(FileStatusResult.NOT_FOUND,
                            "File '" + filename + "' not found in any group. Moving file to PENDING status.");
                default:
                    return new FileStatusResult(FileStatus.PENDING.getValue(), SET_STATUS_ERROR_MESSAGE);
            }
        });
    }

    // ──────────────────────── internals ──────────────────────────────────

    private CompletableFuture<TransitionResult> doTransition(String integrationId, String filename,
                                                             FileStatus target) {
        StagingGroups groups = groups(integrationId);
        return locateFrom(groups, filename, 0).thenCompose(found -> {
            if (found.isEmpty()) {
                log.warn("File '{}' not found in any group of integration {}, moving it to pending",
                        filename, integrationId);
                return groupStore.add(groups.pending(), List.of(filename))
                        .thenCompose(ignored -> updateStatusMetadata(integrationId, filename, FileStatus.PENDING))
                        .thenApply(ignored -> TransitionResult.defaultedToPending(filename));
            }

            FileStatus current = found.get();
            return groupStore.move(groups.groupFor(current), groups.groupFor(target), List.of(filename))
                    .thenCompose(ignored -> updateStatusMetadata(integrationId, filename, target))
                    .thenApply(ignored -> {
                        log.info("File '{}' of integration {} moved {} → {}",
                                filename, integrationId, current.getValue(), target.getValue());
                        return TransitionResult.moved(filename, current, target);
                    });
        });
    }

    private CompletableFuture<Optional<FileStatus>> locateFrom(StagingGroups groups, String filename, int index) {
        FileStatus[] order = FileStatus.values();
        if (index >= order.length) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        FileStatus candidate = order[index];
        return groupStore.isMember(groups.groupFor(candidate), filename).thenCompose(member ->
                Boolean.TRUE.equals(member)
                        ? CompletableFuture.completedFuture(Optional.of(candidate))
                        : locateFrom(groups, filename, index + 1));
    }

    private CompletableFuture<Void> updateStatusMetadata(String integrationId, String filename, FileStatus status) {
        CompletableFuture<Void> update;
        try {
            update = fileStorage.updateMetadata(integrationId, filename,
                    Map.of(STATUS_METADATA_KEY, status.getValue()));
        } catch (RuntimeException e) {
            update = CompletableFuture.failedFuture(e);
        }
        return update.exceptionally(error -> {
            log.warn("Could not update storage metadata of '{}' to '{}': {}",
                    filename, status.getValue(), Failures.describe(error));
            return null;
        });
    }
}
