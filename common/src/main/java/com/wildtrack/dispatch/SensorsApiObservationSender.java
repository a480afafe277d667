package com.wildtrack.dispatch;

import com.wildtrack.errors.TransientTransportException;
import com.wildtrack.model.TransformedObservation;
import com.wildtrack.serde.ObservationSerializer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Sends observation batches to the sensors ingestion API as a JSON array in one POST.
 *
 * <p>Configuration:
 * <ul>
 *   <li>{@code apiUrl} – endpoint receiving the batch</li>
 *   <li>{@code apiKey} – optional, sent in the {@code apikey} header</li>
 *   <li>{@code timeout} – per-request timeout; expiry is reported as a transient failure</li>
 * </ul>
 */
@Slf4j
public class SensorsApiObservationSender implements ObservationSender {

    private final URI apiUrl;
    private final String apiKey;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObservationSerializer serializer = new ObservationSerializer();

    public SensorsApiObservationSender(String apiUrl, String apiKey, Duration timeout) {
        this(apiUrl, apiKey, timeout, HttpClient.newBuilder().connectTimeout(timeout).build());
    }

    public SensorsApiObservationSender(String apiUrl, String apiKey, Duration timeout, HttpClient httpClient) {
        if (apiUrl == null || apiUrl.isBlank()) {
            throw new IllegalArgumentException("sensorsApiUrl must be configured for HTTP dispatch");
        }
        this.apiUrl = URI.create(apiUrl);
        this.apiKey = apiKey;
        this.timeout = timeout;
        this.httpClient = httpClient;
        log.info("Initialised SensorsApiObservationSender → {}", apiUrl);
    }

    @Override
    public CompletableFuture<Void> send(String integrationId, List<TransformedObservation> batch) {
        HttpRequest request;
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(apiUrl)
                    .header("Content-Type", "application/json")
                    .header("X-Integration-Id", integrationId)
                    .timeout(timeout)
                    .POST(HttpRequest.BodyPublishers.ofByteArray(serializer.serializeBatch(batch)));
            if (apiKey != null && !apiKey.isBlank()) {
                builder.header("apikey", apiKey);
            }
            request = builder.build();
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, throwable) -> {
                    if (throwable != null) {
                        throw new TransientTransportException("Sensors API call failed for integration "
                                + integrationId + ": " + throwable.getMessage(), unwrapIo(throwable));
                    }
                    if (response.statusCode() < 200 || response.statusCode() >= 300) {
                        throw new TransientTransportException("Sensors API returned status="
                                + response.statusCode() + " body=" + response.body(), response.statusCode());
                    }
                    log.debug("Sensors API accepted {} observations for integration {}", batch.size(), integrationId);
                    return null;
                });
    }

    private static Throwable unwrapIo(Throwable throwable) {
        Throwable cause = throwable.getCause();
        return cause instanceof IOException ? cause : throwable;
    }
}
