package com.aegis.provider;

import com.aegis.model.BackendKind;
import com.aegis.service.canonicalization.RequestFingerprinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Operator-provided OpenAI-compatible endpoint.
 */
@Component
public class CustomBackendAdapter extends OpenAIBackendAdapter {

    public CustomBackendAdapter(
            WebClient webClient,
            ObjectMapper objectMapper,
            RequestFingerprinter fingerprinter) {
        super(BackendKind.CUSTOM, webClient, objectMapper, fingerprinter);
    }
}
