package com.wildtrack.dispatch;

import com.wildtrack.model.TransformedObservation;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Delivers one batch of observations to the downstream ingestion service.
 *
 * <p>Retrying is the caller's job; implementations report transport failures as
 * {@link com.wildtrack.errors.TransientTransportException} so the retry policy can
 * recognise them.</p>
 */
public interface ObservationSender extends AutoCloseable {

    CompletableFuture<Void> send(String integrationId, List<TransformedObservation> batch);

    /**
     * Releases resources held by this sender.
     */
    @Override
    default void close() {
        // nothing to release by default
    }
}
