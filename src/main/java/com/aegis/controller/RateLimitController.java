package com.aegis.controller;

import com.aegis.model.BackendKind;
import com.aegis.service.AdmissionController;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Admission windows per backend.
 */
@Slf4j
@RestController
@RequestMapping("/v1/rate-limits")
public class RateLimitController {

    private final AdmissionController admissionController;

    public RateLimitController(AdmissionController admissionController) {
        this.admissionController = admissionController;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> getRemaining() {
        Map<String, Integer> remaining = new TreeMap<>();
        admissionController.remainingByBackend().forEach((kind, slots) -> remaining.put(kind.getId(), slots));

        return ResponseEntity.ok(Map.of(
                "enabled", admissionController.isEnabled(),
                "requests_per_minute", admissionController.getRequestsPerMinute(),
                "remaining", remaining
        ));
    }

    @PostMapping("/{id}/reset")
    public ResponseEntity<Map<String, Object>> reset(@PathVariable String id) {
        Optional<BackendKind> kind = BackendKind.fromId(id);
        if (kind.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown backend: " + id));
        }
        admissionController.reset(kind.get());

        return ResponseEntity.ok(Map.of(
                "backend", kind.get().getId(),
                "remaining", admissionController.remaining(kind.get())
        ));
    }
}
