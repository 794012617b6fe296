package com.aegis.provider;

import com.aegis.model.BackendConfig;
import com.aegis.model.BackendKind;
import com.aegis.service.canonicalization.RequestFingerprinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Model server on this host (llama.cpp, vLLM, Ollama's OpenAI endpoint).
 * The credential is only forwarded when it looks like a real token.
 */
@Component
public class LocalBackendAdapter extends OpenAIBackendAdapter {

    private static final String NO_AUTH = "none";

    public LocalBackendAdapter(
            WebClient webClient,
            ObjectMapper objectMapper,
            RequestFingerprinter fingerprinter) {
        super(BackendKind.LOCAL, webClient, objectMapper, fingerprinter);
    }

    @Override
    protected void applyHeaders(HttpHeaders headers, BackendConfig config) {
        if (!NO_AUTH.equalsIgnoreCase(config.getApiKey())) {
            super.applyHeaders(headers, config);
        }
    }
}
