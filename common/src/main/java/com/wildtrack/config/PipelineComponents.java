package com.wildtrack.config;

import com.wildtrack.activity.ActivityLogger;
import com.wildtrack.dispatch.BatchDispatcher;
import com.wildtrack.dispatch.ObservationSender;
import com.wildtrack.integration.ConfigurationResolver;
import com.wildtrack.retry.RetryExecutor;
import com.wildtrack.staging.StagingFileStateMachine;
import com.wildtrack.state.GroupStore;
import com.wildtrack.storage.FileStorage;
import lombok.Builder;
import lombok.Value;

/**
 * The injected collaborator handles one pipeline run works with.
 *
 * <p>Nothing here is process-global: two integrations can run with two different component
 * sets, and tests substitute fakes through the builder.</p>
 */
@Value
@Builder
public class PipelineComponents {

    PipelineConfig config;
    GroupStore groupStore;
    FileStorage fileStorage;
    RetryExecutor retryExecutor;
    ObservationSender observationSender;
    BatchDispatcher batchDispatcher;
    StagingFileStateMachine stateMachine;
    ConfigurationResolver configurationResolver;
    ActivityLogger activityLogger;

    /**
     * Builds the default component set described by {@code config}.
     */
    public static PipelineComponents create(PipelineConfig config) {
        WildtrackPipelineAutoConfiguration factory = new WildtrackPipelineAutoConfiguration();
        GroupStore groupStore = factory.groupStore();
        FileStorage fileStorage = factory.fileStorage(config);
        RetryExecutor retryExecutor = factory.retryExecutor(config);
        ObservationSender sender = factory.observationSender(config);
        return PipelineComponents.builder()
                .config(config)
                .groupStore(groupStore)
                .fileStorage(fileStorage)
                .retryExecutor(retryExecutor)
                .observationSender(sender)
                .batchDispatcher(factory.batchDispatcher(sender, retryExecutor))
                .stateMachine(factory.stagingFileStateMachine(groupStore, fileStorage, config))
                .configurationResolver(factory.configurationResolver())
                .activityLogger(factory.activityLogger())
                .build();
    }
}
