package com.wildtrack.dispatch;

import com.wildtrack.errors.Failures;
import com.wildtrack.model.TransformedObservation;
import com.wildtrack.retry.RetryExecutor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Splits observations into fixed-size batches and delivers them one after another.
 *
 * <p>Each batch is retried under the shared {@link RetryExecutor}.  A batch that exhausts
 * its attempts aborts every later batch; batches already delivered are not rolled back,
 * which makes delivery at-least-once when the file is processed again.</p>
 */
@Slf4j
public class BatchDispatcher {

    private final ObservationSender sender;
    private final RetryExecutor retryExecutor;

    public BatchDispatcher(ObservationSender sender, RetryExecutor retryExecutor) {
        this.sender = sender;
        this.retryExecutor = retryExecutor;
    }

    /**
     * Sends the observations of one device in batches of {@code batchSize}.
     *
     * @return future with the number of observations delivered
     */
    public CompletableFuture<Integer> dispatch(String integrationId, String deviceId,
                                               List<TransformedObservation> observations, int batchSize) {
        List<List<TransformedObservation>> batches = partition(observations, batchSize);
        CompletableFuture<Integer> chain = CompletableFuture.completedFuture(0);
        for (int i = 0; i < batches.size(); i++) {
            int index = i;
            List<TransformedObservation> batch = batches.get(i);
            chain = chain.thenCompose(sent -> sendBatch(integrationId, deviceId, index, batch)
                    .thenApply(ignored -> sent + batch.size()));
        }
        return chain;
    }

    private CompletableFuture<Void> sendBatch(String integrationId, String deviceId, int index,
                                              List<TransformedObservation> batch) {
        log.info("Sending observations batch #{}: {} observations. Device: {}", index, batch.size(), deviceId);
        return retryExecutor.execute("Batch #" + index + " of device " + deviceId,
                        () -> sender.send(integrationId, batch))
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        log.atError()
                                .addKeyValue("needs_attention", true)
                                .addKeyValue("integration_id", integrationId)
                                .addKeyValue("action_id", "process_observations")
                                .log("Sensors API returned error for integration_id: {}. Exception: {}",
                                        integrationId, Failures.describe(error));
                    }
                });
    }

    /**
     * Cuts {@code items} into consecutive sub-lists of at most {@code size} elements.
     */
    public static <T> List<List<T>> partition(List<T> items, int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Batch size must be >= 1, got " + size);
        }
        List<List<T>> batches = new ArrayList<>();
        for (int from = 0; from < items.size(); from += size) {
            batches.add(List.copyOf(items.subList(from, Math.min(from + size, items.size()))));
        }
        return batches;
    }
}
