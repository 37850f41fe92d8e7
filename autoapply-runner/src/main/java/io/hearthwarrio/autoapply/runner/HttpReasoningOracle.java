package io.hearthwarrio.autoapply.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hearthwarrio.autoapply.core.session.OracleException;
import io.hearthwarrio.autoapply.core.session.ReasoningOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * REST client for the reasoning service: {@code POST /resolve}, reply {@code {"answer": "..."}}.
 * <p>
 * The service owns prompt templates and retrieval over the profile; this client only ships the question.
 */
public final class HttpReasoningOracle implements ReasoningOracle {

    private static final Logger log = LoggerFactory.getLogger(HttpReasoningOracle.class);

    static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);

    private final URI endpoint;
    private final HttpClient client;
    private final ObjectMapper mapper;

    public HttpReasoningOracle(URI baseUri) {
        this(baseUri, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), new ObjectMapper());
    }

    HttpReasoningOracle(URI baseUri, HttpClient client, ObjectMapper mapper) {
        Objects.requireNonNull(baseUri, "baseUri must not be null");
        String base = baseUri.toString();
        this.endpoint = URI.create((base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + "/resolve");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public String resolve(String prompt) {
        Objects.requireNonNull(prompt, "prompt must not be null");
        return post(mapper.createObjectNode().put("prompt", prompt));
    }

    @Override
    public String resolve(String question, List<String> options, boolean multiSelect, int topK) {
        Objects.requireNonNull(options, "options must not be null");
        ObjectNode payload = mapper.createObjectNode();
        if (question == null) {
            payload.putNull("question");
        } else {
            payload.put("question", question);
        }
        ArrayNode array = payload.putArray("options");
        for (String option : options) {
            array.add(option);
        }
        payload.put("multiSelect", multiSelect);
        payload.put("topK", topK);
        return post(payload);
    }

    private String post(ObjectNode payload) {
        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload.toString()))
                .build();

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new OracleException("Oracle unreachable: " + endpoint, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleException("Interrupted while calling " + endpoint, e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new OracleException("Oracle answered " + response.statusCode());
        }

        JsonNode answer;
        try {
            answer = mapper.readTree(response.body()).get("answer");
        } catch (IOException e) {
            throw new OracleException("Malformed oracle response: " + response.body(), e);
        }
        if (answer == null || !answer.isTextual()) {
            throw new OracleException("Oracle response has no answer: " + response.body());
        }
        log.debug("Oracle answered '{}'", answer.asText());
        return answer.asText();
    }
}
