package com.wildtrack.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.wildtrack.model.Integration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level pipeline configuration.
 *
 * <p>When running inside a Spring Boot application the properties are bound automatically
 * from {@code application.yaml} under the {@code wildtrack.*} prefix.  The static
 * {@link #load(String)} and {@link #loadFromClasspath(String)} helpers are kept for
 * standalone / test usage outside the Spring context.</p>
 */
@Data
@ConfigurationProperties(prefix = "wildtrack")
public class PipelineConfig {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private RetrySection retry = new RetrySection();
    private VendorSection vendor = new VendorSection();
    private DispatchSection dispatch = new DispatchSection();
    private StorageSection storage = new StorageSection();
    private StagingSection staging = new StagingSection();

    /** Integrations run by the standalone job, one pull/process cycle each. */
    private List<Integration> integrations = new ArrayList<>();

    // ── Loading ──────────────────────────────────────────────────────────

    /**
     * Loads configuration from a YAML file on disk.
     */
    public static PipelineConfig load(String path) throws IOException {
        return YAML_MAPPER.readValue(new File(path), PipelineConfig.class);
    }

    /**
     * Loads configuration from a classpath resource.
     */
    public static PipelineConfig loadFromClasspath(String resource) throws IOException {
        try (InputStream is = PipelineConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Resource not found on classpath: " + resource);
            }
            return YAML_MAPPER.readValue(is, PipelineConfig.class);
        }
    }

    // ── Convenience accessors ────────────────────────────────────────────

    public DispatchMode getDispatchMode() {
        return dispatch.getMode();
    }

    public int getDefaultBatchSize() {
        return dispatch.getBatchSize();
    }

    // ── Nested section POJOs ─────────────────────────────────────────────

    @Data
    public static class RetrySection {
        /** Total attempts, including the first one. */
        private int maxAttempts = 3;
        /** Fixed delay between attempts (no exponential growth). */
        private long delayMs = 10_000;
    }

    @Data
    public static class VendorSection {
        /** Upper bound for a single vendor request, independent of the retry policy. */
        private long timeoutMs = 120_000;
    }

    @Data
    public static class DispatchSection {
        private DispatchMode mode = DispatchMode.HTTP;
        /** Observations per batch when the action configuration does not say otherwise. */
        private int batchSize = 200;
        private String sensorsApiUrl;
        private String apiKey;
        private long timeoutMs = 30_000;
        private String kafkaBootstrapServers;
        private String kafkaTopic = "observations";
    }

    @Data
    public static class StorageSection {
        /** Root directory of the local blob store, one sub-directory per integration. */
        private String rootDir = System.getProperty("java.io.tmpdir") + "/wildtrack/blobs";
        /** Scratch directory for payloads written before upload. */
        private String tempDir = System.getProperty("java.io.tmpdir");
    }

    @Data
    public static class StagingSection {
        /** Prefix of the staging group names, e.g. {@code ats_pending_files}. */
        private String groupPrefix = "ats";
    }
}
