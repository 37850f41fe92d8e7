package io.hearthwarrio.autoapply.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import io.hearthwarrio.autoapply.core.session.OracleException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class HttpReasoningOracleTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private HttpServer server;
    private HttpReasoningOracle oracle;
    private volatile String lastRequest;
    private volatile int status = 200;
    private volatile String reply = "{\"answer\": \"Yes\"}";

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/resolve", exchange -> {
            lastRequest = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            byte[] body = reply.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
            exchange.close();
        });
        server.start();
        oracle = new HttpReasoningOracle(URI.create("http://127.0.0.1:" + server.getAddress().getPort()));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void promptIsPostedAndAnswerReturned() throws IOException {
        assertEquals("Yes", oracle.resolve("Are you legally authorized to work in the US?"));

        assertEquals("Are you legally authorized to work in the US?", mapper.readTree(lastRequest).get("prompt").asText());
    }

    @Test
    void optionQuestionCarriesOptionsAndFlags() throws IOException {
        reply = "{\"answer\": \"Full time employment\"}";

        String answer = oracle.resolve("Which employment types are you open to?",
                List.of("Full-time employment", "Internship"), true, 15);

        assertEquals("Full time employment", answer);
        JsonNode sent = mapper.readTree(lastRequest);
        assertEquals(2, sent.get("options").size());
        assertEquals("Internship", sent.get("options").get(1).asText());
        assertTrue(sent.get("multiSelect").asBoolean());
        assertEquals(15, sent.get("topK").asInt());
    }

    @Test
    void missingQuestionIsSentAsNull() throws IOException {
        oracle.resolve(null, List.of("Yes", "No"), false, 15);

        assertTrue(mapper.readTree(lastRequest).get("question").isNull());
    }

    @Test
    void errorStatusIsRejected() {
        status = 500;

        OracleException e = assertThrows(OracleException.class, () -> oracle.resolve("anything"));
        assertTrue(e.getMessage().contains("500"));
    }

    @Test
    void replyWithoutAnswerIsRejected() {
        reply = "{\"text\": \"Yes\"}";

        assertThrows(OracleException.class, () -> oracle.resolve("anything"));
    }

    @Test
    void malformedReplyIsRejected() {
        reply = "<html>gateway timeout</html>";

        assertThrows(OracleException.class, () -> oracle.resolve("anything"));
    }
}
