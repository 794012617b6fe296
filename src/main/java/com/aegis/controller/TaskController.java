package com.aegis.controller;

import com.aegis.model.BackendKind;
import com.aegis.model.TaskRequest;
import com.aegis.model.TaskType;
import com.aegis.model.dto.TaskSubmission;
import com.aegis.service.BackendRegistry;
import com.aegis.service.TaskDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

/**
 * Task submission endpoint.
 * Dispatch always runs on the worker pool so event-loop threads never block on a backend.
 */
@Slf4j
@RestController
@RequestMapping("/v1")
public class TaskController {

    private final TaskDispatcher dispatcher;
    private final BackendRegistry registry;

    public TaskController(TaskDispatcher dispatcher, BackendRegistry registry) {
        this.dispatcher = dispatcher;
        this.registry = registry;
    }

    /**
     * Run a task. Failed results are returned with HTTP 200; only unknown
     * task type or backend names are rejected with 400.
     */
    @PostMapping(value = "/tasks", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Object>> submitTask(@RequestBody TaskSubmission submission) {
        Optional<TaskType> taskType = TaskType.fromId(submission.getTaskType());
        if (taskType.isEmpty()) {
            return Mono.just(badRequest("Unknown task type: " + submission.getTaskType(),
                    Arrays.stream(TaskType.values()).map(TaskType::getId).toList()));
        }
        Optional<BackendKind> backend = BackendKind.fromId(submission.getBackend());
        if (backend.isEmpty()) {
            return Mono.just(badRequest("Unknown backend: " + submission.getBackend(),
                    Arrays.stream(BackendKind.values()).map(BackendKind::getId).toList()));
        }

        log.info("Received {} task for backend {}", taskType.get().getId(), backend.get().getId());

        TaskRequest request = TaskRequest.builder()
                .taskType(taskType.get())
                .payload(submission.getPayload())
                .context(submission.getContext())
                .config(registry.find(backend.get()).orElse(null))
                .build();

        return Mono.fromFuture(dispatcher.processAsync(request))
                .map(result -> ResponseEntity.ok().body((Object) result));
    }

    private static ResponseEntity<Object> badRequest(String message, Object accepted) {
        return ResponseEntity.badRequest().body(Map.of(
                "error", message,
                "accepted", accepted
        ));
    }
}
