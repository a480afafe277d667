package com.wildtrack.ats.pipeline;

import com.wildtrack.ats.client.AtsClient;
import com.wildtrack.ats.config.AtsActions;
import com.wildtrack.ats.config.AtsAuthConfig;
import com.wildtrack.ats.config.AtsPullConfig;
import com.wildtrack.ats.model.VendorLocationRecord;
import com.wildtrack.ats.model.VendorTransmissionRecord;
import com.wildtrack.ats.parser.AtsResponseParser;
import com.wildtrack.ats.parser.ParseContext;
import com.wildtrack.ats.time.TimeCorrectionEngine;
import com.wildtrack.ats.transform.ObservationTransformer;
import com.wildtrack.config.PipelineComponents;
import com.wildtrack.dispatch.BatchDispatcher;
import com.wildtrack.errors.Failures;
import com.wildtrack.errors.StateTransitionException;
import com.wildtrack.errors.TransientTransportException;
import com.wildtrack.errors.WildtrackException;
import com.wildtrack.integration.ConfigurationResolver;
import com.wildtrack.model.Integration;
import com.wildtrack.model.TransformedObservation;
import com.wildtrack.retry.RetryExecutor;
import com.wildtrack.staging.FileStatus;
import com.wildtrack.staging.StagingFileStateMachine;
import com.wildtrack.staging.TransitionResult;
import com.wildtrack.storage.BlobNotFoundException;
import com.wildtrack.storage.FileStorage;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * Moves ATS telemetry from the vendor to the downstream sensors API in two steps.
 *
 * <h3>Pull</h3>
 * <p>Fetches the transmissions and data-points payloads, checks that both parse, stores them
 * as blobs sharing one timestamp prefix and registers the data-points blob as pending.</p>
 *
 * <h3>Process</h3>
 * <p>Moves a staged data-points file to in-progress, reads it back with its companion
 * transmissions file, corrects timestamps with the per-device GMT offsets, and dispatches
 * each device's observations in batches.  A file whose processing fails goes back to
 * pending; a file that is fully dispatched ends in processed.</p>
 *
 * <p>Only network calls are retried: vendor fetches here, observation batches in the
 * {@link BatchDispatcher}.  Parsing and configuration failures are final.</p>
 */
@Slf4j
public class AtsIngestionPipeline {

    static final String INTEGRATION_ID_METADATA_KEY = "integration_id";
    static final String USERNAME_METADATA_KEY = "ats_username";
    static final String STATUS_METADATA_KEY = "status";

    private final ConfigurationResolver configurationResolver;
    private final FileStorage fileStorage;
    private final StagingFileStateMachine stateMachine;
    private final RetryExecutor retryExecutor;
    private final BatchDispatcher batchDispatcher;
    private final AtsClient client;
    private final AtsResponseParser parser;
    private final TimeCorrectionEngine timeCorrection;
    private final ObservationTransformer transformer;
    private final AtsFileNames fileNames;
    private final Path tempDir;

    public AtsIngestionPipeline(PipelineComponents components, AtsClient client, AtsResponseParser parser,
                                TimeCorrectionEngine timeCorrection, AtsFileNames fileNames) {
        this.configurationResolver = components.getConfigurationResolver();
        this.fileStorage = components.getFileStorage();
        this.stateMachine = components.getStateMachine();
        this.retryExecutor = components.getRetryExecutor();
        this.batchDispatcher = components.getBatchDispatcher();
        this.client = client;
        this.parser = parser;
        this.timeCorrection = timeCorrection;
        this.transformer = new ObservationTransformer(timeCorrection);
        this.fileNames = fileNames;
        this.tempDir = Path.of(components.getConfig().getStorage().getTempDir());
    }

    /**
     * Pipeline with the default ATS collaborators and a system UTC clock.
     */
    public static AtsIngestionPipeline create(PipelineComponents components) {
        Duration vendorTimeout = Duration.ofMillis(components.getConfig().getVendor().getTimeoutMs());
        return new AtsIngestionPipeline(components, new AtsClient(vendorTimeout), new AtsResponseParser(),
                new TimeCorrectionEngine(), new AtsFileNames(Clock.systemUTC()));
    }

    // ── Pull ─────────────────────────────────────────────────────────────

    /**
     * Fetches both vendor payloads and stages them.  Fails with
     * {@link com.wildtrack.errors.ConfigurationNotFoundException} when the integration lacks
     * its {@code auth} or {@code pull_observations} settings, with
     * {@link com.wildtrack.ats.parser.MalformedResponseException} when a payload cannot be
     * read, and with {@link TransientTransportException} once the fetch retries are spent.
     */
    public CompletableFuture<PullResult> pull(Integration integration) {
        String integrationId = integration.getId();
        AtsAuthConfig auth;
        AtsPullConfig pullConfig;
        try {
            auth = configurationResolver.resolve(integration, AtsActions.AUTH, AtsAuthConfig.class);
            pullConfig = configurationResolver.resolve(integration, AtsActions.PULL_OBSERVATIONS, AtsPullConfig.class);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        log.info("Executing pull_observations for integration {} with settings {}", integrationId, pullConfig);

        String prefix = fileNames.newPrefix();
        String transmissionsFile = AtsFileNames.transmissionsFile(prefix, integrationId);
        String dataPointsFile = AtsFileNames.dataPointsFile(prefix, integrationId);

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(INTEGRATION_ID_METADATA_KEY, integrationId);
        metadata.put(USERNAME_METADATA_KEY, Objects.toString(auth.getUsername(), ""));

        String transmissionsEndpoint = pullConfig.getTransmissionsEndpoint();
        String dataEndpoint = pullConfig.getDataEndpoint();

        return fetch("transmissions", transmissionsEndpoint, auth, integrationId)
                .thenCompose(xml -> {
                    parser.parseTransmissions(xml,
                            new ParseContext(integrationId, transmissionsEndpoint, auth.getUsername()));
                    return stage(integrationId, transmissionsFile, xml, metadata);
                })
                .thenCompose(ignored -> fetch("data points", dataEndpoint, auth, integrationId))
                .thenCompose(xml -> {
                    Map<String, List<VendorLocationRecord>> perDevice = parser.parseLocations(xml,
                            new ParseContext(integrationId, dataEndpoint, auth.getUsername()));
                    int extracted = perDevice.values().stream().mapToInt(List::size).sum();

                    Map<String, String> dataMetadata = new LinkedHashMap<>(metadata);
                    dataMetadata.put(STATUS_METADATA_KEY, FileStatus.PENDING.getValue());
                    return stage(integrationId, dataPointsFile, xml, dataMetadata)
                            .thenCompose(v -> stateMachine.register(integrationId, dataPointsFile))
                            .thenApply(v -> new PullResult(extracted, dataPointsFile));
                })
                .whenComplete((result, error) -> {
                    if (error == null) {
                        log.info("-- Observations pulled with success for integration ID: {}. --", integrationId);
                        return;
                    }
                    Throwable cause = Failures.unwrap(error);
                    if (cause instanceof TransientTransportException) {
                        log.atError()
                                .setCause(cause)
                                .addKeyValue("attention_needed", true)
                                .addKeyValue("integration_id", integrationId)
                                .log("Error fetching data points/transmissions from ATS. Integration ID: {} Exception: {}",
                                        integrationId, cause.getMessage());
                    }
                });
    }

    private CompletableFuture<String> fetch(String kind, String endpoint, AtsAuthConfig auth, String integrationId) {
        return retryExecutor.execute("Fetch " + kind + " for integration " + integrationId,
                () -> client.fetch(endpoint, auth, integrationId));
    }

    /**
     * Writes the payload to the scratch directory and uploads it; the scratch copy is removed
     * afterwards whatever the upload outcome.
     */
    private CompletableFuture<Void> stage(String integrationId, String blobName, String content,
                                          Map<String, String> metadata) {
        Path localFile = tempDir.resolve(blobName);
        try {
            Files.createDirectories(tempDir);
            Files.writeString(localFile, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(
                    new WildtrackException("Could not write payload to " + localFile, e));
        }
        return fileStorage.upload(integrationId, localFile, blobName, metadata)
                .whenComplete((ignored, error) -> deleteScratchFile(localFile));
    }

    private static void deleteScratchFile(Path localFile) {
        try {
            Files.deleteIfExists(localFile);
        } catch (IOException e) {
            log.warn("Could not delete scratch file {}: {}", localFile, e.getMessage());
        }
    }

    // ── Process ──────────────────────────────────────────────────────────

    /**
     * Processes one staged data-points file.  A name with no staged blob fails with
     * {@link BlobNotFoundException} before any group membership is touched.
     *
     * @return future with the number of observations dispatched; fails with
     *         {@link StateTransitionException} when the file cannot be moved between states
     */
    public CompletableFuture<Integer> process(Integration integration, String filename, int batchSize) {
        String integrationId = integration.getId();
        log.info("Processing file '{}' for integration {}", filename, integrationId);
        return fileStorage.exists(integrationId, filename)
                .thenCompose(exists -> {
                    if (!Boolean.TRUE.equals(exists)) {
                        log.warn("File '{}' is not staged for integration {}, leaving its status untouched",
                                filename, integrationId);
                        throw new BlobNotFoundException(integrationId, filename);
                    }
                    return enterInProgress(integrationId, filename);
                })
                .thenCompose(ignored -> processStaged(integration, filename, batchSize)
                        .handle((count, error) -> error == null
                                ? complete(integrationId, filename, count)
                                : revertToPending(integrationId, filename, error))
                        .thenCompose(Function.identity()));
    }

    /**
     * Processes every pending file of the integration, one after another.  A file that fails
     * is recorded in the result and the run moves on to the next one.
     */
    public CompletableFuture<PendingRunResult> processPending(Integration integration, int batchSize) {
        String integrationId = integration.getId();
        return stateMachine.pendingFiles(integrationId).thenCompose(pending -> {
            if (pending.isEmpty()) {
                log.info("No pending files for integration {}", integrationId);
                return CompletableFuture.completedFuture(PendingRunResult.empty());
            }
            log.info("{} pending file(s) to process for integration {}", pending.size(), integrationId);
            CompletableFuture<PendingRunResult> chain = CompletableFuture.completedFuture(PendingRunResult.empty());
            for (String filename : new ArrayList<>(pending)) {
                chain = chain.thenCompose(run -> process(integration, filename, batchSize)
                        .handle((processed, error) -> {
                            if (error == null) {
                                return run.plus(processed);
                            }
                            String reason = Failures.describe(Failures.rootCause(error));
                            log.atError()
                                    .setCause(Failures.unwrap(error))
                                    .addKeyValue("attention_needed", true)
                                    .addKeyValue("integration_id", integrationId)
                                    .log("Processing of pending file '{}' failed, continuing with the next: {}",
                                            filename, reason);
                            return run.withFailure(filename, reason);
                        }));
            }
            return chain;
        });
    }

    /**
     * Runs {@link #process} again for a file whatever its current state.  Never fails: a failed
     * run is reported in the result, and the file is left pending.
     */
    public CompletableFuture<ReprocessResult> reprocess(Integration integration, String filename, int batchSize) {
        log.info("Reprocessing file '{}' for integration {}", filename, integration.getId());
        CompletableFuture<Integer> run;
        try {
            run = process(integration, filename, batchSize);
        } catch (RuntimeException e) {
            run = CompletableFuture.failedFuture(e);
        }
        return run.handle((count, error) -> {
            if (error == null) {
                return ReprocessResult.processed(count);
            }
            Throwable root = Failures.rootCause(error);
            log.atError()
                    .setCause(Failures.unwrap(error))
                    .addKeyValue("integration_id", integration.getId())
                    .addKeyValue("action_id", AtsActions.REPROCESS_FILE)
                    .log("Reprocess for file '{}' failed: {}", filename, Failures.describe(root));
            return ReprocessResult.failed(filename, Failures.describe(root));
        });
    }

    // ──────────────────────── internals ──────────────────────────────────

    private CompletableFuture<Void> enterInProgress(String integrationId, String filename) {
        return stateMachine.transition(integrationId, filename, FileStatus.IN_PROGRESS)
                .thenCompose(result -> {
                    // an untracked file has just been registered as pending; claim it now
                    if (result.getOutcome() == TransitionResult.Outcome.DEFAULTED_TO_PENDING) {
                        return stateMachine.transition(integrationId, filename, FileStatus.IN_PROGRESS);
                    }
                    return CompletableFuture.completedFuture(result);
                })
                .thenAccept(result -> {
                    if (!result.isMoved()) {
                        throw new StateTransitionException("Could not move file '" + filename + "' to "
                                + FileStatus.IN_PROGRESS.getValue(), result.getError());
                    }
                });
    }

    private CompletableFuture<Integer> complete(String integrationId, String filename, int count) {
        return stateMachine.transition(integrationId, filename, FileStatus.PROCESSED).thenApply(result -> {
            if (!result.isMoved()) {
                throw new StateTransitionException("Could not move file '" + filename + "' to "
                        + FileStatus.PROCESSED.getValue(), result.getError());
            }
            log.info("-- File '{}' processed: {} observations sent for integration {} --",
                    filename, count, integrationId);
            return count;
        });
    }

    private CompletableFuture<Integer> revertToPending(String integrationId, String filename, Throwable error) {
        Throwable cause = Failures.unwrap(error);
        log.warn("Processing of '{}' failed, moving it back to pending: {}", filename, Failures.describe(cause));
        return stateMachine.transition(integrationId, filename, FileStatus.PENDING)
                .thenCompose(result -> CompletableFuture.<Integer>failedFuture(cause));
    }

    private CompletableFuture<Integer> processStaged(Integration integration, String filename, int batchSize) {
        String integrationId = integration.getId();
        return fileStorage.getMetadata(integrationId, filename).thenCompose(metadata -> {
            String username = metadata.get(USERNAME_METADATA_KEY);
            String transmissionsFile = AtsFileNames.transmissionsFileFor(filename);
            return downloadTransmissions(integrationId, transmissionsFile)
                    .thenCombine(fileStorage.download(integrationId, filename), (transmissionsXml, dataXml) -> {
                        List<VendorTransmissionRecord> transmissions = transmissionsXml == null
                                ? List.of()
                                : parser.parseTransmissions(transmissionsXml,
                                        new ParseContext(integrationId, transmissionsFile, username));
                        Map<String, List<VendorLocationRecord>> perDevice = parser.parseLocations(dataXml,
                                new ParseContext(integrationId, filename, username));
                        return transformAll(integrationId, perDevice, transmissions);
                    })
                    .thenCompose(perDevice -> dispatchAll(integrationId, perDevice, batchSize));
        });
    }

    /**
     * Downloads the companion transmissions file, or {@code null} when the pull that staged
     * the data points did not leave one.
     */
    private CompletableFuture<String> downloadTransmissions(String integrationId, String transmissionsFile) {
        return fileStorage.download(integrationId, transmissionsFile).handle((xml, error) -> {
            if (error == null) {
                return xml;
            }
            Throwable cause = Failures.unwrap(error);
            if (cause instanceof BlobNotFoundException) {
                log.warn("Transmissions file '{}' not found for integration {}, GMT offsets default to 0",
                        transmissionsFile, integrationId);
                return null;
            }
            throw new CompletionException(cause);
        });
    }

    private Map<String, List<TransformedObservation>> transformAll(String integrationId,
                                                                  Map<String, List<VendorLocationRecord>> perDevice,
                                                                  List<VendorTransmissionRecord> transmissions) {
        Map<String, Integer> offsets = timeCorrection.deriveOffsets(transmissions, integrationId);
        Map<String, List<TransformedObservation>> observations = new LinkedHashMap<>();
        perDevice.forEach((deviceId, records) -> observations.put(deviceId,
                transformer.transform(deviceId, records, offsets.getOrDefault(deviceId, 0), integrationId)));
        return observations;
    }

    private CompletableFuture<Integer> dispatchAll(String integrationId,
                                                   Map<String, List<TransformedObservation>> perDevice,
                                                   int batchSize) {
        CompletableFuture<Integer> chain = CompletableFuture.completedFuture(0);
        for (Map.Entry<String, List<TransformedObservation>> device : perDevice.entrySet()) {
            if (device.getValue().isEmpty()) {
                continue;
            }
            chain = chain.thenCompose(total -> batchDispatcher.dispatch(integrationId, device.getKey(),
                            device.getValue(), batchSize)
                    .thenApply(sent -> total + sent));
        }
        return chain;
    }
}
