package com.aegis.service.canonicalization;

import com.aegis.config.AegisProperties;
import com.aegis.model.TaskRequest;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Canonical serialization of task payloads and the cache fingerprint derived from it.
 *
 * Steps:
 * 1. Sort object keys recursively
 * 2. Serialize compactly, numbers and strings unchanged
 * 3. SHA-256 over task type, canonical payload and context
 *
 * Two payloads differing only in field order produce the same fingerprint.
 */
@Slf4j
@Service
public class RequestFingerprinter {

    private static final char SEPARATOR = '\u001f';

    private final boolean includeBackend;

    @Autowired
    public RequestFingerprinter(AegisProperties properties) {
        this(properties.getCache().isKeyIncludesBackend());
    }

    public RequestFingerprinter(boolean includeBackend) {
        this.includeBackend = includeBackend;
    }

    /**
     * Generate the cache key for a request.
     *
     * @param request task request
     * @return SHA-256 hash (64 hex chars)
     */
    public String fingerprint(TaskRequest request) {
        StringBuilder material = new StringBuilder();
        material.append(request.getTaskType() == null ? "" : request.getTaskType().name());
        material.append(SEPARATOR).append(canonicalize(request.getPayload()));
        material.append(SEPARATOR).append(request.getContext() == null ? "" : request.getContext());

        if (includeBackend && request.getConfig() != null && request.getConfig().getKind() != null) {
            material.append(SEPARATOR).append(request.getConfig().getKind().getId());
        }

        String key = DigestUtils.sha256Hex(material.toString());
        log.trace("Fingerprint for {} request: {}", request.getTaskType(), key);
        return key;
    }

    /**
     * Canonical JSON for a payload tree; "null" for a missing payload.
     */
    public String canonicalize(JsonNode node) {
        StringBuilder sb = new StringBuilder();
        serializeNode(node, sb);
        return sb.toString();
    }

    private void serializeNode(JsonNode node, StringBuilder sb) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            sb.append("null");
        } else if (node.isObject()) {
            sb.append("{");
            List<String> fieldNames = new ArrayList<>();
            node.fieldNames().forEachRemaining(fieldNames::add);
            Collections.sort(fieldNames);

            boolean first = true;
            for (String fieldName : fieldNames) {
                if (!first) {
                    sb.append(",");
                }
                first = false;

                sb.append("\"").append(escapeJson(fieldName)).append("\":");
                serializeNode(node.get(fieldName), sb);
            }
            sb.append("}");
        } else if (node.isArray()) {
            sb.append("[");
            boolean first = true;
            for (JsonNode element : node) {
                if (!first) {
                    sb.append(",");
                }
                first = false;
                serializeNode(element, sb);
            }
            sb.append("]");
        } else if (node.isTextual()) {
            sb.append("\"").append(escapeJson(node.asText())).append("\"");
        } else if (node.isBinary()) {
            sb.append("\"").append(escapeJson(node.asText())).append("\"");
        } else {
            // numbers and booleans
            sb.append(node.asText());
        }
    }

    private String escapeJson(String text) {
        StringBuilder escaped = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> escaped.append("\\\\");
                case '"' -> escaped.append("\\\"");
                case '\n' -> escaped.append("\\n");
                case '\r' -> escaped.append("\\r");
                case '\t' -> escaped.append("\\t");
                default -> {
                    if (c < 0x20) {
                        escaped.append(String.format("\\u%04x", (int) c));
                    } else {
                        escaped.append(c);
                    }
                }
            }
        }
        return escaped.toString();
    }
}
