package com.aegis.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /v1/tasks}. The backend is named by id and resolved
 * against the registered configurations.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskSubmission {

    @JsonProperty("task_type")
    private String taskType;

    private String backend;

    private JsonNode payload;

    private String context;
}
