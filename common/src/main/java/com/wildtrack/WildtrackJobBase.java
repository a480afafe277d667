package com.wildtrack;

import com.wildtrack.config.PipelineComponents;
import com.wildtrack.config.PipelineConfig;
import com.wildtrack.errors.Failures;
import com.wildtrack.model.Integration;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Abstract base for vendor-specific ingestion jobs.
 *
 * <p>Subclasses provide the default config resource, a display name and the work done for
 * one integration.  The base loads the YAML configuration, builds the collaborators and runs
 * every configured integration in turn.</p>
 *
 * <p>Usage in a vendor module:
 * <pre>
 *   public class AtsJob extends WildtrackJobBase {
 *       protected String getDefaultConfigResource() { return "pipeline-config.yaml"; }
 *       protected String getJobName(PipelineConfig c) { return "ATS ingestion"; }
 *       protected CompletableFuture&lt;?&gt; runIntegration(PipelineComponents c, Integration i) { ... }
 *       public static void main(String[] args) throws Exception { new AtsJob().run(args); }
 *   }
 * </pre>
 */
@Slf4j
public abstract class WildtrackJobBase {

    /**
     * Classpath resource loaded when no command-line config path is supplied.
     */
    protected abstract String getDefaultConfigResource();

    /**
     * Name shown in the job's log lines.
     */
    protected abstract String getJobName(PipelineConfig config);

    /**
     * Runs one ingestion cycle for the integration.
     */
    protected abstract CompletableFuture<?> runIntegration(PipelineComponents components, Integration integration);

    /**
     * Runs the job end-to-end.
     *
     * @param args optional single argument: path to a YAML config file
     * @return number of integrations whose cycle failed
     */
    public int run(String[] args) throws Exception {
        // ── Load configuration ───────────────────────────────────────────
        PipelineConfig config;
        if (args.length > 0) {
            log.info("Loading configuration from file: {}", args[0]);
            config = PipelineConfig.load(args[0]);
        } else {
            String resource = getDefaultConfigResource();
            log.info("Loading configuration from classpath: {}", resource);
            config = PipelineConfig.loadFromClasspath(resource);
        }

        log.info("Starting {}", getJobName(config));
        log.info("Integrations configured: {}", config.getIntegrations().size());

        // ── Build collaborators and run ──────────────────────────────────
        PipelineComponents components = PipelineComponents.create(config);
        int failures = 0;
        try {
            for (Integration integration : config.getIntegrations()) {
                try {
                    runIntegration(components, integration).join();
                } catch (CompletionException e) {
                    failures++;
                    log.error("Integration {} failed: {}", integration.getId(), Failures.describe(e));
                }
            }
        } finally {
            components.getObservationSender().close();
        }
        log.info("{} finished, {} integration(s) failed", getJobName(config), failures);
        return failures;
    }
}
