package com.aegis.provider;

import com.aegis.config.JacksonConfiguration;
import com.aegis.config.WebClientConfiguration;
import com.aegis.model.BackendConfig;
import com.aegis.model.BackendKind;
import com.aegis.model.ErrorKind;
import com.aegis.model.TaskRequest;
import com.aegis.model.TaskResult;
import com.aegis.model.TaskType;
import com.aegis.service.canonicalization.RequestFingerprinter;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Adapter calls against a local server that answers after two seconds.
 */
class BackendTimeoutTest {

    private static final String COMPLETION = """
            {"choices": [{"index": 0, "message": {"role": "assistant", "content": "Rotate the exposed key."}}]}
            """;

    private DisposableServer server;
    private OpenAIBackendAdapter adapter;

    @BeforeEach
    void setUp() {
        server = HttpServer.create()
                .host("localhost")
                .port(0)
                .route(routes -> routes.post("/v1/chat/completions", (request, response) ->
                        request.receive().then()
                                .then(Mono.delay(Duration.ofSeconds(2)))
                                .then(response.header("Content-Type", "application/json")
                                        .sendString(Mono.just(COMPLETION))
                                        .then())))
                .bindNow();
        adapter = new OpenAIBackendAdapter(
                new WebClientConfiguration().webClient(),
                JacksonConfiguration.createObjectMapper(),
                new RequestFingerprinter(false));
    }

    @AfterEach
    void tearDown() {
        server.disposeNow();
    }

    @Test
    void testLongerConfiguredTimeoutIsHonoured() {
        TaskResult result = adapter.process(request(5));

        assertTrue(result.isSuccess(), () -> "unexpected failure: " + result.getErrorMessage());
        assertEquals("Rotate the exposed key.", result.getResult().get("content").asText());
        assertTrue(result.getProcessingTimeMs() >= 1500);
    }

    @Test
    void testShorterConfiguredTimeoutCutsCallOff() {
        long start = System.nanoTime();
        TaskResult result = adapter.process(request(1));
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.TRANSPORT, result.getErrorKind());
        assertEquals("OpenAI API request timed out after 1s", result.getErrorMessage());
        assertTrue(elapsedMs < 2000, "call took " + elapsedMs + "ms");
    }

    private TaskRequest request(int timeoutSeconds) {
        BackendConfig config = BackendConfig.defaults(BackendKind.OPENAI, "sk-test-1234567890").toBuilder()
                .endpoint("http://localhost:" + server.port() + "/v1/chat/completions")
                .timeoutSeconds(timeoutSeconds)
                .build();
        return TaskRequest.builder()
                .taskType(TaskType.VULNERABILITY_ANALYSIS)
                .payload(JsonNodeFactory.instance.objectNode().put("secret_scan", "aws-key"))
                .config(config)
                .build();
    }
}
