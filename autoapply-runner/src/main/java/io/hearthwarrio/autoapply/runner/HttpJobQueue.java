package io.hearthwarrio.autoapply.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hearthwarrio.autoapply.core.session.JobQueue;
import io.hearthwarrio.autoapply.core.session.JobQueueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * REST client for the job queue service.
 * <ul>
 *   <li>{@code GET /next-job} answers {@code {"url": "..."}}, an empty body or 204 when nothing is queued</li>
 *   <li>{@code POST /job/update} takes {@code {"url": "...", "status": "success"|"failed"}}</li>
 * </ul>
 */
public final class HttpJobQueue implements JobQueue {

    private static final Logger log = LoggerFactory.getLogger(HttpJobQueue.class);

    static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final URI baseUri;
    private final HttpClient client;
    private final ObjectMapper mapper;

    public HttpJobQueue(URI baseUri) {
        this(baseUri, HttpClient.newBuilder().connectTimeout(REQUEST_TIMEOUT).build(), new ObjectMapper());
    }

    HttpJobQueue(URI baseUri, HttpClient client, ObjectMapper mapper) {
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public Optional<String> nextJob() {
        HttpRequest request = HttpRequest.newBuilder(endpoint("/next-job"))
                .timeout(REQUEST_TIMEOUT)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response = send(request);
        if (response.statusCode() == 204 || response.body() == null || response.body().isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode url = mapper.readTree(response.body()).path("url");
            if (!url.isTextual() || url.asText().isBlank()) {
                return Optional.empty();
            }
            return Optional.of(url.asText());
        } catch (IOException e) {
            throw new JobQueueException("Malformed next-job response: " + response.body(), e);
        }
    }

    @Override
    public void reportResult(String url, boolean success) {
        Objects.requireNonNull(url, "url must not be null");
        String status = success ? "success" : "failed";
        ObjectNode payload = mapper.createObjectNode()
                .put("url", url)
                .put("status", status);

        HttpRequest request = HttpRequest.newBuilder(endpoint("/job/update"))
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload.toString()))
                .build();
        send(request);
        log.debug("Marked job {} as {}", url, status);
    }

    private HttpResponse<String> send(HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new JobQueueException("Job queue unreachable: " + request.uri(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobQueueException("Interrupted while calling " + request.uri(), e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new JobQueueException("Job queue answered " + response.statusCode() + " for " + request.uri());
        }
        return response;
    }

    private URI endpoint(String path) {
        String base = baseUri.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + path);
    }
}
