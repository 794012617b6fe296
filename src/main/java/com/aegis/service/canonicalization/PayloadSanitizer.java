package com.aegis.service.canonicalization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks personal data and secrets in outbound payloads before they leave the process.
 *
 * Replaces:
 * - Secret tokens (sk-..., Bearer ...) → {SECRET}
 * - Emails → {EMAIL}
 * - Credit card numbers → {CARD}
 * - US SSNs → {SSN}
 * - IPv4 addresses → {IP}
 *
 * CVE, CWE and version identifiers are left untouched.
 */
@Slf4j
@Service
public class PayloadSanitizer {

    // Ordered by specificity
    private static final List<MaskPattern> PATTERNS = Arrays.asList(
            new MaskPattern(
                    "SECRET",
                    Pattern.compile("\\b(?:sk-[A-Za-z0-9_-]{8,}|Bearer\\s+[A-Za-z0-9._~+/=-]{8,})"),
                    "{SECRET}"
            ),
            new MaskPattern(
                    "EMAIL",
                    Pattern.compile("[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}"),
                    "{EMAIL}"
            ),
            new MaskPattern(
                    "CARD",
                    Pattern.compile("\\b\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}\\b"),
                    "{CARD}"
            ),
            new MaskPattern(
                    "SSN",
                    Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b"),
                    "{SSN}"
            ),
            new MaskPattern(
                    "IP",
                    Pattern.compile("\\b(?:(?:25[0-5]|2[0-4]\\d|1?\\d?\\d)\\.){3}(?:25[0-5]|2[0-4]\\d|1?\\d?\\d)\\b"),
                    "{IP}"
            )
    );

    /**
     * Sanitized deep copy of a payload tree. Field names are kept; only text values are masked.
     */
    public JsonNode sanitize(JsonNode payload) {
        if (payload == null) {
            return null;
        }
        return sanitizeNode(payload);
    }

    /**
     * Mask sensitive content in free text.
     */
    public String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        String masked = text;
        List<String> matched = new ArrayList<>();
        for (MaskPattern pattern : PATTERNS) {
            Matcher matcher = pattern.regex.matcher(masked);
            if (matcher.find()) {
                matched.add(pattern.name);
                masked = matcher.replaceAll(Matcher.quoteReplacement(pattern.replacement));
            }
        }

        if (!matched.isEmpty()) {
            log.debug("Masked {} in outbound text", matched);
        }
        return masked;
    }

    /**
     * Whether the text contains anything {@link #sanitize(String)} would mask.
     */
    public boolean containsSensitiveData(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        return PATTERNS.stream().anyMatch(pattern -> pattern.regex.matcher(text).find());
    }

    private JsonNode sanitizeNode(JsonNode node) {
        if (node.isTextual()) {
            return JsonNodeFactory.instance.textNode(sanitize(node.asText()));
        }
        if (node.isObject()) {
            ObjectNode copy = JsonNodeFactory.instance.objectNode();
            node.fields().forEachRemaining(field -> copy.set(field.getKey(), sanitizeNode(field.getValue())));
            return copy;
        }
        if (node.isArray()) {
            ArrayNode copy = JsonNodeFactory.instance.arrayNode();
            node.forEach(element -> copy.add(sanitizeNode(element)));
            return copy;
        }
        return node.deepCopy();
    }

    private record MaskPattern(String name, Pattern regex, String replacement) {
    }
}
