package com.wildtrack.ats;

import com.wildtrack.WildtrackJobBase;
import com.wildtrack.ats.actions.AtsActionHandlers;
import com.wildtrack.ats.pipeline.AtsIngestionPipeline;
import com.wildtrack.config.PipelineComponents;
import com.wildtrack.config.PipelineConfig;
import com.wildtrack.model.Integration;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

/**
 * Standalone entry point: one pull followed by one processing pass for every configured
 * integration.
 *
 * <p>Usage: {@code java -jar wildtrack-ats.jar [path/to/pipeline-config.yaml]}</p>
 */
@Slf4j
public class AtsJob extends WildtrackJobBase {

    public static void main(String[] args) throws Exception {
        int failures = new AtsJob().run(args);
        if (failures > 0) {
            System.exit(1);
        }
    }

    @Override
    protected String getDefaultConfigResource() {
        return "pipeline-config.yaml";
    }

    @Override
    protected String getJobName(PipelineConfig config) {
        return "ATS ingestion (" + config.getDispatchMode() + " dispatch)";
    }

    @Override
    protected CompletableFuture<?> runIntegration(PipelineComponents components, Integration integration) {
        AtsActionHandlers handlers = handlers(components);
        return handlers.pullObservations(integration)
                .thenCompose(pulled -> {
                    log.info("Pulled for integration {}: {}", integration.getId(), pulled);
                    return handlers.processObservations(integration);
                })
                .thenAccept(processed -> log.info("Processed for integration {}: {}", integration.getId(), processed));
    }

    static AtsActionHandlers handlers(PipelineComponents components) {
        return new AtsActionHandlers(AtsIngestionPipeline.create(components), components.getStateMachine(),
                components.getConfigurationResolver(), components.getActivityLogger(), components.getConfig());
    }
}
