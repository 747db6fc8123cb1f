package io.downloader4j.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.downloader4j.core.CallbackDeliveryException;
import io.downloader4j.core.CallbackInfo;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Posts {@link CallbackInfo} payloads as JSON.
 *
 * <p>Every exchange, from connecting until the response body is consumed, is capped by a fixed
 * timeout so a slow endpoint cannot hold a worker for longer than that.
 */
public class CallbackClient {

    private final HttpClient client;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public CallbackClient(Duration timeout, ObjectMapper objectMapper) {
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * @throws CallbackDeliveryException on transport failure or any status outside 200-299
     */
    public void post(String callbackUrl, CallbackInfo info) throws CallbackDeliveryException {
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(info);
        } catch (JsonProcessingException e) {
            throw new CallbackDeliveryException("Could not encode callback payload: " + e.getOriginalMessage(), e);
        }

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(callbackUrl))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new CallbackDeliveryException("Invalid callback URL: " + callbackUrl, e);
        }

        // the request timeout only covers the headers, so the cap is put on the whole exchange
        CompletableFuture<HttpResponse<Void>> exchange =
                client.sendAsync(request, HttpResponse.BodyHandlers.discarding());
        HttpResponse<Void> response;
        try {
            response = exchange.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            exchange.cancel(true);
            throw new CallbackDeliveryException("Callback timed out after " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof HttpTimeoutException) {
                throw new CallbackDeliveryException("Callback timed out after " + timeout.toMillis() + "ms", cause);
            }
            throw new CallbackDeliveryException("Callback request failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            exchange.cancel(true);
            Thread.currentThread().interrupt();
            throw new CallbackDeliveryException("Callback request interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new CallbackDeliveryException("Received Status: " + status);
        }
    }
}
