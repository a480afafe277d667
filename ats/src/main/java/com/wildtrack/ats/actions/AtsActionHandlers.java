package com.wildtrack.ats.actions;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wildtrack.activity.ActivityLogger;
import com.wildtrack.ats.config.AtsActions;
import com.wildtrack.ats.config.FileRequest;
import com.wildtrack.ats.config.ProcessObservationsConfig;
import com.wildtrack.ats.config.SetFileStatusRequest;
import com.wildtrack.ats.pipeline.AtsIngestionPipeline;
import com.wildtrack.ats.pipeline.PendingRunResult;
import com.wildtrack.config.PipelineConfig;
import com.wildtrack.integration.ConfigurationResolver;
import com.wildtrack.model.Integration;
import com.wildtrack.staging.FileStatusResult;
import com.wildtrack.staging.StagingFileStateMachine;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The ATS actions as invoked by the job runner or an external dispatcher.  Every action runs
 * through the {@link ActivityLogger} and answers with a JSON-ready map.
 *
 * <ul>
 *   <li>{@code pull_observations} → {@code {observations_extracted, file_name}}</li>
 *   <li>{@code process_observations} → {@code {observations_processed[, failed_files]}}</li>
 *   <li>{@code get_file_status} → {@code {file_status}}</li>
 *   <li>{@code set_file_status} → {@code {file_status, message}}</li>
 *   <li>{@code reprocess_file} → {@code {observations_processed[, message]}}</li>
 * </ul>
 */
@Slf4j
public class AtsActionHandlers {

    private final AtsIngestionPipeline pipeline;
    private final StagingFileStateMachine stateMachine;
    private final ConfigurationResolver configurationResolver;
    private final ActivityLogger activityLogger;
    private final int defaultBatchSize;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public AtsActionHandlers(AtsIngestionPipeline pipeline, StagingFileStateMachine stateMachine,
                             ConfigurationResolver configurationResolver, ActivityLogger activityLogger,
                             PipelineConfig config) {
        this.pipeline = pipeline;
        this.stateMachine = stateMachine;
        this.configurationResolver = configurationResolver;
        this.activityLogger = activityLogger;
        this.defaultBatchSize = config.getDefaultBatchSize();
    }

    /**
     * Runs an action by id with free-form parameters, as received from an action request.
     *
     * @throws IllegalArgumentException (as the future's failure) for an unknown action id
     */
    public CompletableFuture<Map<String, Object>> execute(Integration integration, String actionId,
                                                          Map<String, Object> params) {
        switch (actionId) {
            case AtsActions.PULL_OBSERVATIONS:
                return pullObservations(integration);
            case AtsActions.PROCESS_OBSERVATIONS:
                return processObservations(integration);
            case AtsActions.GET_FILE_STATUS:
                return withParams(params, FileRequest.class, request -> getFileStatus(integration, request));
            case AtsActions.SET_FILE_STATUS:
                return withParams(params, SetFileStatusRequest.class, request -> setFileStatus(integration, request));
            case AtsActions.REPROCESS_FILE:
                return withParams(params, FileRequest.class, request -> reprocessFile(integration, request));
            default:
                return CompletableFuture.failedFuture(new IllegalArgumentException("Unknown action: " + actionId));
        }
    }

    // ── Actions ──────────────────────────────────────────────────────────

    public CompletableFuture<Map<String, Object>> pullObservations(Integration integration) {
        return run(integration, AtsActions.PULL_OBSERVATIONS,
                () -> pipeline.pull(integration).thenApply(result -> result.toResponse()));
    }

    public CompletableFuture<Map<String, Object>> processObservations(Integration integration) {
        return run(integration, AtsActions.PROCESS_OBSERVATIONS,
                () -> pipeline.processPending(integration, batchSize(integration, null))
                        .thenApply(PendingRunResult::toResponse));
    }

    public CompletableFuture<Map<String, Object>> getFileStatus(Integration integration, FileRequest request) {
        return run(integration, AtsActions.GET_FILE_STATUS,
                () -> stateMachine.getStatus(integration.getId(), request.getFilename())
                        .thenApply(FileStatusResult::toResponse));
    }

    public CompletableFuture<Map<String, Object>> setFileStatus(Integration integration, SetFileStatusRequest request) {
        return run(integration, AtsActions.SET_FILE_STATUS,
                () -> stateMachine.setStatus(integration.getId(), request.getFilename(), request.getStatus())
                        .thenApply(FileStatusResult::toResponse));
    }

    public CompletableFuture<Map<String, Object>> reprocessFile(Integration integration, FileRequest request) {
        return run(integration, AtsActions.REPROCESS_FILE,
                () -> pipeline.reprocess(integration, request.getFilename(),
                                batchSize(integration, request.getObservationsPerRequest()))
                        .thenApply(result -> result.toResponse()));
    }

    // ──────────────────────── internals ──────────────────────────────────

    private CompletableFuture<Map<String, Object>> run(Integration integration, String actionId,
                                                       Supplier<CompletableFuture<Map<String, Object>>> action) {
        return activityLogger.run(integration, actionId, action);
    }

    private <T> CompletableFuture<Map<String, Object>> withParams(
            Map<String, Object> params, Class<T> type, Function<T, CompletableFuture<Map<String, Object>>> action) {
        T request;
        try {
            request = objectMapper.convertValue(params == null ? Map.of() : params, type);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        return action.apply(request);
    }

    /**
     * Batch size for a run: the explicit request value, else the integration's
     * {@code process_observations} setting, else the configured default.
     */
    private int batchSize(Integration integration, Integer requested) {
        if (requested != null && requested > 0) {
            return requested;
        }
        if (integration.findConfiguration(AtsActions.PROCESS_OBSERVATIONS).isPresent()) {
            return configurationResolver.resolve(integration, AtsActions.PROCESS_OBSERVATIONS,
                    ProcessObservationsConfig.class).getObservationsPerRequest();
        }
        return defaultBatchSize;
    }
}
