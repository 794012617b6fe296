package com.aegis.controller;

import com.aegis.model.BackendKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BackendController.
 */
class BackendControllerTest {

    private ControllerFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new ControllerFixture();
    }

    @AfterEach
    void tearDown() {
        fixture.shutdown();
    }

    @Test
    void testRegisterListAndRemove() {
        fixture.client.put().uri("/v1/backends/anthropic")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"api_key\": \"sk-ant-REDACTED\", \"timeout_seconds\": 45}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.backend").isEqualTo("anthropic")
                .jsonPath("$.model").isEqualTo("claude-3-sonnet-20240229")
                .jsonPath("$.api_key").isEqualTo("sk-...7777")
                .jsonPath("$.timeout_seconds").isEqualTo(45)
                .jsonPath("$.available").isEqualTo(true);

        fixture.client.get().uri("/v1/backends")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].backend").isEqualTo("anthropic");

        fixture.client.delete().uri("/v1/backends/anthropic")
                .exchange()
                .expectStatus().isNoContent();
        fixture.client.delete().uri("/v1/backends/anthropic")
                .exchange()
                .expectStatus().isNotFound();
        assertTrue(fixture.registry.find(BackendKind.ANTHROPIC).isEmpty());
    }

    @Test
    void testInvalidRegistrationReportsViolations() {
        fixture.client.put().uri("/v1/backends/openai")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"api_key\": \"wrong\", \"endpoint\": \"http://api.example.com\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Invalid configuration for openai")
                .jsonPath("$.violations.length()").isEqualTo(2);

        assertTrue(fixture.registry.configs().isEmpty());
    }

    @Test
    void testUnknownBackend() {
        fixture.client.put().uri("/v1/backends/gemini")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"api_key\": \"x\"}")
                .exchange()
                .expectStatus().isBadRequest();
    }
}
