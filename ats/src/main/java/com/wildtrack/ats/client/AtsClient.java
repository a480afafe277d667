package com.wildtrack.ats.client;

import com.wildtrack.ats.config.AtsAuthConfig;
import com.wildtrack.errors.TransientTransportException;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Fetches raw XML from the ATS web-service endpoints with HTTP Basic authentication.
 *
 * <p>Every failure of the exchange itself (I/O error, timeout, non-2xx status) completes the
 * future with a {@link TransientTransportException}, so the caller can retry it.  The body is
 * decoded with the charset named in the response Content-Type (UTF-8 when absent) and returned
 * untouched; validation belongs to the parser.</p>
 */
@Slf4j
public class AtsClient {

    private final HttpClient httpClient;
    private final Duration timeout;

    public AtsClient(Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), timeout);
    }

    public AtsClient(HttpClient httpClient, Duration timeout) {
        this.httpClient = httpClient;
        this.timeout = timeout;
    }

    public CompletableFuture<String> fetch(String endpoint, AtsAuthConfig auth, String integrationId) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(endpoint))
                    .header("Authorization", basicAuth(auth))
                    .header("Accept", "application/xml, text/xml")
                    .timeout(timeout)
                    .GET()
                    .build();
        } catch (IllegalArgumentException | NullPointerException e) {
            return CompletableFuture.failedFuture(e);
        }

        log.info("-- Getting ATS response for integration ID: {} Endpoint: {} --", integrationId, endpoint);
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, throwable) -> {
                    if (throwable != null) {
                        Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                                ? throwable.getCause()
                                : throwable;
                        throw new TransientTransportException("Request to " + endpoint + " failed: "
                                + cause.getMessage(), cause);
                    }
                    if (response.statusCode() < 200 || response.statusCode() >= 300) {
                        throw new TransientTransportException("ATS endpoint " + endpoint + " returned status="
                                + response.statusCode(), response.statusCode());
                    }
                    log.debug("Received {} chars from {}", response.body().length(), endpoint);
                    return response.body();
                });
    }

    static String basicAuth(AtsAuthConfig auth) {
        String username = auth.getUsername() == null ? "" : auth.getUsername();
        String password = auth.getPassword() == null ? "" : auth.getPassword();
        String token = Base64.getEncoder()
                .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
        return "Basic " + token;
    }
}
