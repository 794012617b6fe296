package com.aegis.controller;

import com.aegis.model.BackendConfig;
import com.aegis.model.BackendKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TaskController.
 */
class TaskControllerTest {

    private static final String TASK = """
            {"task_type": "vulnerability-analysis", "backend": "openai",
             "payload": {"cve": "CVE-2021-44228", "product": "log4j"}, "context": "internet facing"}
            """;

    private ControllerFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new ControllerFixture();
        fixture.registry.register(BackendConfig.defaults(BackendKind.OPENAI, "sk-test-1234567890"));
    }

    @AfterEach
    void tearDown() {
        fixture.shutdown();
    }

    @Test
    void testSubmitTask() {
        fixture.client.post().uri("/v1/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(TASK)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.cached").isEqualTo(false)
                .jsonPath("$.result.backend").isEqualTo("openai")
                .jsonPath("$.confidence_score").isEqualTo(0.8)
                .jsonPath("$.error_message").doesNotExist();
    }

    @Test
    void testRepeatedTaskServedFromCache() {
        for (int i = 0; i < 2; i++) {
            fixture.client.post().uri("/v1/tasks")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(TASK)
                    .exchange()
                    .expectStatus().isOk();
        }

        fixture.client.post().uri("/v1/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(TASK)
                .exchange()
                .expectBody()
                .jsonPath("$.cached").isEqualTo(true);
        assertEquals(1, fixture.backendCalls.get());
    }

    @Test
    void testFailedResultStillOk() {
        fixture.backendUp.set(false);

        fixture.client.post().uri("/v1/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(TASK)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.error_kind").isEqualTo("TRANSPORT")
                .jsonPath("$.error_message").isEqualTo("Could not connect to OpenAI API")
                .jsonPath("$.result").doesNotExist();
    }

    @Test
    void testUnregisteredBackendIsFailedResult() {
        fixture.client.post().uri("/v1/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(TASK.replace("\"openai\"", "\"anthropic\""))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.error_kind").isEqualTo("VALIDATION");
    }

    @Test
    void testUnknownNamesRejected() {
        fixture.client.post().uri("/v1/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(TASK.replace("vulnerability-analysis", "port-scanning"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Unknown task type: port-scanning");

        fixture.client.post().uri("/v1/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(TASK.replace("\"openai\"", "\"gemini\""))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Unknown backend: gemini");
    }
}
