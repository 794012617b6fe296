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
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * OpenAI chat-completions adapter.
 * Also the base for OpenAI-compatible self-hosted backends.
 */
@Slf4j
@Component
public class OpenAIBackendAdapter extends AbstractBackendAdapter {

    private final BackendKind kind;

    @Autowired
    public OpenAIBackendAdapter(
            WebClient webClient,
            ObjectMapper objectMapper,
            RequestFingerprinter fingerprinter) {
        this(BackendKind.OPENAI, webClient, objectMapper, fingerprinter);
    }

    protected OpenAIBackendAdapter(
            BackendKind kind,
            WebClient webClient,
            ObjectMapper objectMapper,
            RequestFingerprinter fingerprinter) {
        super(webClient, objectMapper, fingerprinter);
        this.kind = kind;
    }

    @Override
    public BackendKind getKind() {
        return kind;
    }

    @Override
    protected ObjectNode buildRequestBody(TaskRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", request.getConfig().getModel());

        ArrayNode messages = body.putArray("messages");
        messages.addObject()
                .put("role", "system")
                .put("content", systemInstruction(request));
        messages.addObject()
                .put("role", "user")
                .put("content", userContent(request));

        body.put("temperature", TEMPERATURE);
        body.put("max_tokens", MAX_TOKENS);
        return body;
    }

    @Override
    protected void applyHeaders(HttpHeaders headers, BackendConfig config) {
        headers.setBearerAuth(config.getApiKey());
    }

    @Override
    protected TaskResult parseSuccess(JsonNode body, BackendConfig config) {
        JsonNode choices = body.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            return TaskResult.failure(ErrorKind.BACKEND, errorPrefix() + "Response contained no choices");
        }

        JsonNode content = choices.get(0).path("message").path("content");
        if (!content.isTextual()) {
            return TaskResult.failure(ErrorKind.BACKEND, errorPrefix() + "Response contained no message content");
        }

        ObjectNode result = resultNode(content.asText(), config);
        JsonNode totalTokens = body.path("usage").path("total_tokens");
        if (totalTokens.isIntegralNumber()) {
            result.put("tokens_used", totalTokens.asLong());
        }

        return TaskResult.success(result, TaskResult.DEFAULT_CONFIDENCE);
    }
}
