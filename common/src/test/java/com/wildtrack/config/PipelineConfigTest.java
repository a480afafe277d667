package com.wildtrack.config;

import com.wildtrack.dispatch.SensorsApiObservationSender;
import com.wildtrack.model.Integration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PipelineConfigTest {

    @TempDir
    Path tmp;

    @Test
    void loadsYamlFromClasspath() throws IOException {
        PipelineConfig config = PipelineConfig.loadFromClasspath("test-pipeline-config.yaml");

        assertEquals(5, config.getRetry().getMaxAttempts());
        assertEquals(0, config.getRetry().getDelayMs());
        assertEquals(DispatchMode.KAFKA, config.getDispatchMode());
        assertEquals(50, config.getDefaultBatchSize());
        assertEquals("ats-observations", config.getDispatch().getKafkaTopic());

        Integration integration = config.getIntegrations().get(0);
        assertEquals("779ff3ab-5589-4f4c-9e0a-ae8d6c9edff0", integration.getId());
        assertEquals("collar-user", integration.findConfiguration("auth").orElseThrow().getData().get("username"));
        assertTrue(integration.findConfiguration("process_observations").isEmpty());
    }

    @Test
    void unsetSectionsKeepDefaults() throws IOException {
        PipelineConfig config = PipelineConfig.loadFromClasspath("test-pipeline-config.yaml");

        assertEquals(120_000, config.getVendor().getTimeoutMs());
        assertEquals(30_000, config.getDispatch().getTimeoutMs());
    }

    @Test
    void loadsYamlFromDisk() throws IOException {
        Path file = tmp.resolve("config.yaml");
        Files.writeString(file, "dispatch:\n  sensorsApiUrl: http://localhost:9/obs\n");

        PipelineConfig config = PipelineConfig.load(file.toString());

        assertEquals(DispatchMode.HTTP, config.getDispatchMode());
        assertEquals(200, config.getDefaultBatchSize());
        assertEquals(3, config.getRetry().getMaxAttempts());
        assertTrue(config.getIntegrations().isEmpty());
    }

    @Test
    void missingResourceFails() {
        assertThrows(IOException.class, () -> PipelineConfig.loadFromClasspath("nope.yaml"));
    }

    @Test
    void componentsFollowDispatchMode() {
        PipelineConfig config = new PipelineConfig();
        config.getDispatch().setSensorsApiUrl("http://localhost:9/obs");
        config.getStorage().setRootDir(tmp.toString());

        PipelineComponents components = PipelineComponents.create(config);

        assertInstanceOf(SensorsApiObservationSender.class, components.getObservationSender());
        assertEquals(3, components.getRetryExecutor().getPolicy().getMaxAttempts());
        assertEquals("id:ats_pending_files", components.getStateMachine().groups("id").pending());
    }
}
