package com.wildtrack.ats;

import com.wildtrack.dispatch.ObservationSender;
import com.wildtrack.model.TransformedObservation;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Sender that keeps every batch it is handed, or fails each one when {@link #failWith} is set.
 */
public final class RecordingSender implements ObservationSender {

    public final List<List<TransformedObservation>> batches = new ArrayList<>();
    public volatile RuntimeException failWith;

    @Override
    public synchronized CompletableFuture<Void> send(String integrationId, List<TransformedObservation> batch) {
        if (failWith != null) {
            return CompletableFuture.failedFuture(failWith);
        }
        batches.add(List.copyOf(batch));
        return CompletableFuture.completedFuture(null);
    }

    public synchronized List<TransformedObservation> sent() {
        List<TransformedObservation> all = new ArrayList<>();
        batches.forEach(all::addAll);
        return all;
    }
}
