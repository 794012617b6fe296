package com.aegis.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

/**
 * A unit of work: what to analyze, with which backend.
 */
@Value
@Builder(toBuilder = true)
public class TaskRequest {

    TaskType taskType;

    /**
     * Opaque structured input, e.g. {"cve": "CVE-2021-44228"}.
     */
    JsonNode payload;

    /**
     * Optional free-text context appended to the prompt and included in the cache key.
     */
    String context;

    BackendConfig config;

    /**
     * Copy whose payload tree is detached from this request's.
     */
    public TaskRequest copy() {
        return toBuilder()
                .payload(payload == null ? null : payload.deepCopy())
                .build();
    }
}
