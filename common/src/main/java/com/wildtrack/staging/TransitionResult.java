package com.wildtrack.staging;

import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of a single state transition request.
 *
 * <ul>
 *   <li>{@link Outcome#MOVED}: the file was tracked and now sits in the requested state.</li>
 *   <li>{@link Outcome#DEFAULTED_TO_PENDING}: the file was not tracked anywhere; it was
 *       registered as pending and the requested state was <em>not</em> applied.</li>
 *   <li>{@link Outcome#FAILED}: the group store raised; no state change is guaranteed and
 *       the file should be treated as pending.</li>
 * </ul>
 */
@Getter
@ToString
public final class TransitionResult {

    public enum Outcome {
        MOVED,
        DEFAULTED_TO_PENDING,
        FAILED
    }

    private final String filename;
    private final Outcome outcome;
    /** State the file was found in; {@code null} unless {@link Outcome#MOVED}. */
    private final FileStatus previousStatus;
    /** State the file occupies afterwards (best effort for {@link Outcome#FAILED}). */
    private final FileStatus status;
    private final Throwable error;

    private TransitionResult(String filename, Outcome outcome, FileStatus previousStatus,
                             FileStatus status, Throwable error) {
        this.filename = filename;
        this.outcome = outcome;
        this.previousStatus = previousStatus;
        this.status = status;
        this.error = error;
    }

    public static TransitionResult moved(String filename, FileStatus from, FileStatus to) {
        return new TransitionResult(filename, Outcome.MOVED, from, to, null);
    }

    public static TransitionResult defaultedToPending(String filename) {
        return new TransitionResult(filename, Outcome.DEFAULTED_TO_PENDING, null, FileStatus.PENDING, null);
    }

    public static TransitionResult failed(String filename, Throwable error) {
        return new TransitionResult(filename, Outcome.FAILED, null, FileStatus.PENDING, error);
    }

    public boolean isMoved() {
        return outcome == Outcome.MOVED;
    }

    public boolean isFailed() {
        return outcome == Outcome.FAILED;
    }
}
