package com.presentos.core.forward;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.presentos.core.config.RouterProperties;
import com.presentos.core.logging.MdcContext;
import com.presentos.core.metrics.RouterMetrics;
import com.presentos.core.model.DownstreamResponse;
import com.presentos.core.model.HandlerKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * POSTs a JSON payload to one of the downstream handler services.
 *
 * <p>Never throws. Missing configuration, connection failures and timeouts are
 * reported as status 500 with the error text as body. No retries.
 */
@Service
public class DownstreamForwarder {

    private static final Logger log = LoggerFactory.getLogger(DownstreamForwarder.class);

    static final int FAILURE_STATUS = 500;

    private final RouterProperties.Handlers handlers;
    private final RouterMetrics metrics;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public DownstreamForwarder(RouterProperties properties, RouterMetrics metrics) {
        this.handlers = properties.getHandlers();
        this.metrics = metrics;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
        this.objectMapper = new ObjectMapper();
    }

    public DownstreamResponse forward(HandlerKind kind, JsonNode payload) {
        RouterProperties.Handler handler = handlers.forKind(kind);
        if (!handler.isConfigured()) {
            log.warn("No URL configured for {} handler", kind);
            return new DownstreamResponse(kind, FAILURE_STATUS, kind + " handler URL not configured");
        }

        MdcContext.setHandler(kind.name());
        long start = System.currentTimeMillis();
        try {
            var request = HttpRequest.newBuilder()
                    .uri(URI.create(handler.getUrl()))
                    .timeout(Duration.ofSeconds(handler.getTimeoutSeconds()))
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload)))
                    .build();

            // request timeout only covers the headers; bound the whole exchange
            CompletableFuture<HttpResponse<String>> pending =
                    httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
            HttpResponse<String> response;
            try {
                response = pending.get(handler.getTimeoutSeconds(), TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                pending.cancel(true);
                return failure(kind, start, kind + " handler timed out after " + handler.getTimeoutSeconds() + "s");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                return failure(kind, start, cause.getClass().getSimpleName() + ": " + cause.getMessage());
            }
            long elapsed = System.currentTimeMillis() - start;
            log.info("{} handler responded HTTP {} in {}ms", kind, response.statusCode(), elapsed);
            metrics.recordForward(kind.name(), response.statusCode(), elapsed);
            return new DownstreamResponse(kind, response.statusCode(), response.body());
        } catch (JsonProcessingException e) {
            return failure(kind, start, "Could not serialize payload: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            return failure(kind, start, e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(kind, start, "Interrupted while calling " + kind + " handler");
        } finally {
            MdcContext.clearHandler();
        }
    }

    private DownstreamResponse failure(HandlerKind kind, long start, String error) {
        long elapsed = System.currentTimeMillis() - start;
        log.warn("{} handler call failed after {}ms: {}", kind, elapsed, error);
        metrics.recordForward(kind.name(), FAILURE_STATUS, elapsed);
        return new DownstreamResponse(kind, FAILURE_STATUS, error);
    }
}
