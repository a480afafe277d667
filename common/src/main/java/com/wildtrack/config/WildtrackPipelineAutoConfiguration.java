package com.wildtrack.config;

import com.wildtrack.activity.ActivityLogger;
import com.wildtrack.activity.Slf4jActivityLogger;
import com.wildtrack.dispatch.BatchDispatcher;
import com.wildtrack.dispatch.KafkaObservationSender;
import com.wildtrack.dispatch.ObservationSender;
import com.wildtrack.dispatch.SensorsApiObservationSender;
import com.wildtrack.integration.ConfigurationResolver;
import com.wildtrack.integration.DefaultConfigurationResolver;
import com.wildtrack.retry.RetryExecutor;
import com.wildtrack.retry.RetryPolicy;
import com.wildtrack.staging.StagingFileStateMachine;
import com.wildtrack.state.GroupStore;
import com.wildtrack.state.InMemoryGroupStore;
import com.wildtrack.storage.FileStorage;
import com.wildtrack.storage.LocalFileStorage;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Spring configuration that wires the pipeline collaborators.
 *
 * <p>Discovered via component-scanning from a host {@code @SpringBootApplication} that scans
 * {@code com.wildtrack.*}.  The bean methods are plain factories, so
 * {@link PipelineComponents#create(PipelineConfig)} reuses them outside a Spring context.</p>
 */
@Configuration
@EnableConfigurationProperties(PipelineConfig.class)
public class WildtrackPipelineAutoConfiguration {

    @Bean
    public GroupStore groupStore() {
        return new InMemoryGroupStore();
    }

    @Bean
    public FileStorage fileStorage(PipelineConfig config) {
        return new LocalFileStorage(Path.of(config.getStorage().getRootDir()));
    }

    @Bean
    public RetryExecutor retryExecutor(PipelineConfig config) {
        return new RetryExecutor(RetryPolicy.fromConfig(config.getRetry()));
    }

    @Bean(destroyMethod = "close")
    public ObservationSender observationSender(PipelineConfig config) {
        PipelineConfig.DispatchSection dispatch = config.getDispatch();
        switch (config.getDispatchMode()) {
            case KAFKA:
                return KafkaObservationSender.create(dispatch.getKafkaBootstrapServers(), dispatch.getKafkaTopic());
            case HTTP:
            default:
                return new SensorsApiObservationSender(dispatch.getSensorsApiUrl(), dispatch.getApiKey(),
                        Duration.ofMillis(dispatch.getTimeoutMs()));
        }
    }

    @Bean
    public BatchDispatcher batchDispatcher(ObservationSender observationSender, RetryExecutor retryExecutor) {
        return new BatchDispatcher(observationSender, retryExecutor);
    }

    @Bean
    public StagingFileStateMachine stagingFileStateMachine(GroupStore groupStore, FileStorage fileStorage,
                                                           PipelineConfig config) {
        return new StagingFileStateMachine(groupStore, fileStorage, config.getStaging().getGroupPrefix());
    }

    @Bean
    public ConfigurationResolver configurationResolver() {
        return new DefaultConfigurationResolver();
    }

    @Bean
    public ActivityLogger activityLogger() {
        return new Slf4jActivityLogger();
    }
}
