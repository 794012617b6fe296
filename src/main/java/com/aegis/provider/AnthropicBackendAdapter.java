package com.aegis.provider;

import com.aegis.model.BackendConfig;
import com.aegis.model.BackendKind;
import com.aegis.model.ErrorKind;
import com.aegis.model.TaskRequest;
import com.aegis.model.TaskResult;
import com.aegis.service.canonicalization.RequestFingerprinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.List;

/**
 * Anthropic (Claude) Messages API adapter.
 */
@Slf4j
@Component
public class AnthropicBackendAdapter extends AbstractBackendAdapter {

    private static final String ANTHROPIC_VERSION = "2023-06-01";

    public AnthropicBackendAdapter(
            WebClient webClient,
            ObjectMapper objectMapper,
            RequestFingerprinter fingerprinter) {
        super(webClient, objectMapper, fingerprinter);
    }

    @Override
    public BackendKind getKind() {
        return BackendKind.ANTHROPIC;
    }

    /**
     * The system instruction travels in its own field; the conversation holds only the user turn.
     */
    @Override
    protected ObjectNode buildRequestBody(TaskRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", request.getConfig().getModel());
        body.put("system", systemInstruction(request));

        ArrayNode messages = body.putArray("messages");
        ObjectNode userMessage = messages.addObject();
        userMessage.put("role", "user");
        userMessage.putArray("content")
                .addObject()
                .put("type", "text")
                .put("text", userContent(request));

        body.put("max_tokens", MAX_TOKENS);
        body.put("temperature", TEMPERATURE);
        return body;
    }

    @Override
    protected void applyHeaders(HttpHeaders headers, BackendConfig config) {
        headers.set("x-api-key", config.getApiKey());
        headers.set("anthropic-version", ANTHROPIC_VERSION);
    }

    @Override
    protected TaskResult parseSuccess(JsonNode body, BackendConfig config) {
        List<String> texts = new ArrayList<>();
        JsonNode content = body.path("content");
        if (content.isArray()) {
            for (JsonNode block : content) {
                if ("text".equals(block.path("type").asText()) && block.hasNonNull("text")) {
                    texts.add(block.get("text").asText());
                }
            }
        }

        if (texts.isEmpty()) {
            return TaskResult.failure(ErrorKind.BACKEND, errorPrefix() + "Response contains no text content");
        }

        ObjectNode result = resultNode(String.join("\n", texts), config);
        JsonNode usage = body.path("usage");
        if (usage.has("input_tokens") || usage.has("output_tokens")) {
            result.put("tokens_used", usage.path("input_tokens").asLong() + usage.path("output_tokens").asLong());
        }

        String stopReason = body.path("stop_reason").asText(null);
        return TaskResult.success(result, confidenceFor(stopReason));
    }

    /**
     * A response cut off by the token limit is trusted less than a natural end of turn.
     */
    static double confidenceFor(String stopReason) {
        if (stopReason == null) {
            return 0.6;
        }
        return switch (stopReason) {
            case "end_turn" -> 0.9;
            case "stop_sequence" -> 0.85;
            case "max_tokens" -> 0.7;
            default -> 0.6;
        };
    }
}
