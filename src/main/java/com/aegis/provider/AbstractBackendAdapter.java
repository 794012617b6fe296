package com.aegis.provider;

import com.aegis.model.BackendConfig;
import com.aegis.model.ErrorKind;
import com.aegis.model.TaskRequest;
import com.aegis.model.TaskResult;
import com.aegis.service.canonicalization.RequestFingerprinter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.reactive.ClientHttpRequest;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.netty.http.client.HttpClientRequest;

import javax.net.ssl.SSLException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Abstract base class for backend adapters: one blocking POST per task and a
 * shared classification of transport and HTTP failures.
 */
@Slf4j
public abstract class AbstractBackendAdapter implements BackendAdapter {

    protected static final double TEMPERATURE = 0.3;
    protected static final int MAX_TOKENS = 2000;

    protected final WebClient webClient;
    protected final ObjectMapper objectMapper;
    protected final RequestFingerprinter fingerprinter;

    protected AbstractBackendAdapter(
            WebClient webClient,
            ObjectMapper objectMapper,
            RequestFingerprinter fingerprinter) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.fingerprinter = fingerprinter;
    }

    /**
     * Provider-specific JSON body.
     */
    protected abstract ObjectNode buildRequestBody(TaskRequest request);

    /**
     * Provider-specific authentication and version headers.
     */
    protected abstract void applyHeaders(HttpHeaders headers, BackendConfig config);

    /**
     * Translate a parsed 2xx/3xx envelope into a result.
     */
    protected abstract TaskResult parseSuccess(JsonNode body, BackendConfig config);

    @Override
    public TaskResult process(TaskRequest request) {
        BackendConfig config = request.getConfig();
        if (config == null) {
            return TaskResult.failure(ErrorKind.VALIDATION, "Invalid request or missing configuration");
        }
        if (config.getKind() != getKind()) {
            return TaskResult.failure(ErrorKind.CONFIGURATION,
                    getName() + " adapter cannot serve a " + config.getKind() + " configuration");
        }

        String body;
        try {
            body = objectMapper.writeValueAsString(buildRequestBody(request));
        } catch (JsonProcessingException e) {
            return TaskResult.failure(ErrorKind.VALIDATION, "Could not serialize request payload: " + e.getOriginalMessage());
        }

        log.debug("Forwarding {} request to {}: model={}", request.getTaskType(), getName(), config.getModel());

        Duration timeout = Duration.ofSeconds(config.getTimeoutSeconds());
        long start = System.nanoTime();
        ResponseEntity<String> response;
        try {
            response = webClient.post()
                    .uri(config.getEndpoint())
                    .headers(headers -> applyHeaders(headers, config))
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .httpRequest(httpRequest -> applyResponseTimeout(httpRequest, timeout))
                    .bodyValue(body)
                    .exchangeToMono(clientResponse -> clientResponse.toEntity(String.class))
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            TaskResult failure = classifyTransportError(e, config);
            log.warn("Transport failure calling {}: {}", getName(), failure.getErrorMessage());
            return failure;
        }
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        if (response == null) {
            return TaskResult.failure(ErrorKind.BACKEND, errorPrefix() + "No response received");
        }

        int status = response.getStatusCode().value();
        if (status >= 400) {
            TaskResult failure = classifyHttpError(status, response.getBody());
            log.warn("{} answered HTTP {}: {}", getName(), status, failure.getErrorMessage());
            return failure;
        }

        TaskResult result = parseBody(response.getBody(), config);
        if (result.isSuccess()) {
            log.info("{} request completed successfully in {}ms", getName(), elapsedMs);
        }
        return result.withProcessingTime(elapsedMs);
    }

    /**
     * Reactor Netty's response timeout for this one request. Other connectors
     * rely on the overall {@code timeout} operator alone.
     */
    private static void applyResponseTimeout(ClientHttpRequest httpRequest, Duration timeout) {
        Object nativeRequest = httpRequest.getNativeRequest();
        if (nativeRequest instanceof HttpClientRequest reactorRequest) {
            reactorRequest.responseTimeout(timeout);
        }
    }

    private TaskResult parseBody(String raw, BackendConfig config) {
        if (raw == null || raw.isBlank()) {
            return TaskResult.failure(ErrorKind.BACKEND, errorPrefix() + "Empty response body");
        }

        JsonNode body;
        try {
            body = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return TaskResult.failure(ErrorKind.BACKEND, errorPrefix() + "JSON parse error: " + e.getOriginalMessage());
        }

        // Some providers report errors inside a 200 envelope
        String embeddedError = errorDetail(body);
        if (embeddedError != null) {
            return TaskResult.failure(ErrorKind.BACKEND, errorPrefix() + embeddedError);
        }

        return parseSuccess(body, config);
    }

    /**
     * Dedicated messages for 401, 429 and 5xx, with the provider's own detail appended when present.
     */
    protected TaskResult classifyHttpError(int status, String raw) {
        String message = switch (status) {
            case 401 -> "Unauthorized - invalid credential";
            case 403 -> "Forbidden - credential lacks access";
            case 429 -> "Rate limit exceeded by backend";
            case 500 -> "Internal server error";
            case 502, 503, 504 -> "Service unavailable (HTTP " + status + ")";
            default -> status >= 500
                    ? "Backend unavailable (HTTP " + status + ")"
                    : "HTTP " + status + " error";
        };

        String detail = null;
        if (raw != null && !raw.isBlank()) {
            try {
                detail = errorDetail(objectMapper.readTree(raw));
            } catch (JsonProcessingException e) {
                log.debug("{} error body is not JSON", getName());
            }
        }

        return TaskResult.failure(ErrorKind.BACKEND,
                errorPrefix() + message + (detail == null ? "" : " (" + detail + ")"));
    }

    protected TaskResult classifyTransportError(Throwable error, BackendConfig config) {
        Throwable cause = Exceptions.unwrap(error);
        while (cause != null) {
            if (cause instanceof TimeoutException
                    || cause instanceof io.netty.handler.timeout.TimeoutException) {
                return TaskResult.failure(ErrorKind.TRANSPORT,
                        getKind().getDisplayName() + " API request timed out after " + config.getTimeoutSeconds() + "s");
            }
            if (cause instanceof ConnectException || cause instanceof UnknownHostException) {
                return TaskResult.failure(ErrorKind.TRANSPORT,
                        "Could not connect to " + getKind().getDisplayName() + " API");
            }
            if (cause instanceof SSLException) {
                return TaskResult.failure(ErrorKind.TRANSPORT,
                        "SSL connection error to " + getKind().getDisplayName() + " API");
            }
            if (cause.getCause() == cause) {
                break;
            }
            cause = cause.getCause();
        }
        return TaskResult.failure(ErrorKind.TRANSPORT, "Transport error: " + error.getMessage());
    }

    /**
     * {@code error.message} (or a plain string {@code error}) from a provider body, else null.
     */
    protected String errorDetail(JsonNode body) {
        if (body == null || !body.has("error")) {
            return null;
        }
        JsonNode error = body.get("error");
        if (error.isTextual()) {
            return error.asText();
        }
        if (error.hasNonNull("message")) {
            return error.get("message").asText();
        }
        return error.isNull() ? null : error.toString();
    }

    /**
     * User message: canonical payload JSON, followed by the context when present.
     */
    protected String userContent(TaskRequest request) {
        String payload = fingerprinter.canonicalize(request.getPayload());
        if (request.getContext() == null || request.getContext().isBlank()) {
            return payload;
        }
        return payload + "\n\nContext: " + request.getContext();
    }

    protected String systemInstruction(TaskRequest request) {
        return TaskPrompts.systemInstruction(request.getTaskType());
    }

    protected String errorPrefix() {
        return getKind().getDisplayName() + " API: ";
    }

    protected ObjectNode resultNode(String content, BackendConfig config) {
        ObjectNode result = objectMapper.createObjectNode();
        result.put("content", content);
        result.put("backend", getName());
        result.put("model", config.getModel());
        return result;
    }
}
