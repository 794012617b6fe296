package com.aegis.service.canonicalization;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;

/**
 * Size and nesting limits a task payload must respect before it is dispatched.
 */
public final class PayloadLimits {

    private PayloadLimits() {
    }

    /**
     * @return a description of the first limit exceeded, or empty when the payload fits.
     *         A limit of zero or less is not enforced.
     */
    public static Optional<String> check(JsonNode payload, String context, int maxBytes, int maxDepth) {
        if (maxBytes > 0) {
            long bytes = sizeInBytes(payload, context);
            if (bytes > maxBytes) {
                return Optional.of("Payload is " + bytes + " bytes, limit is " + maxBytes);
            }
        }
        if (maxDepth > 0) {
            int depth = depth(payload);
            if (depth > maxDepth) {
                return Optional.of("Payload nesting depth " + depth + " exceeds limit of " + maxDepth);
            }
        }
        return Optional.empty();
    }

    public static long sizeInBytes(JsonNode payload, String context) {
        long bytes = payload == null ? 0 : payload.toString().getBytes(StandardCharsets.UTF_8).length;
        if (context != null) {
            bytes += context.getBytes(StandardCharsets.UTF_8).length;
        }
        return bytes;
    }

    /**
     * Container nesting levels: a scalar is 0, {@code {"a":1}} is 1, {@code {"a":[1]}} is 2.
     */
    public static int depth(JsonNode root) {
        if (root == null || !root.isContainerNode()) {
            return 0;
        }
        int max = 0;
        Deque<Map.Entry<JsonNode, Integer>> pending = new ArrayDeque<>();
        pending.push(Map.entry(root, 1));
        while (!pending.isEmpty()) {
            Map.Entry<JsonNode, Integer> next = pending.pop();
            int level = next.getValue();
            max = Math.max(max, level);
            for (JsonNode child : next.getKey()) {
                if (child.isContainerNode()) {
                    pending.push(Map.entry(child, level + 1));
                }
            }
        }
        return max;
    }
}
