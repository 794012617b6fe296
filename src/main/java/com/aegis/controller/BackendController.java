package com.aegis.controller;

import com.aegis.model.BackendConfig;
import com.aegis.model.BackendKind;
import com.aegis.model.dto.BackendRegistration;
import com.aegis.model.dto.BackendSummary;
import com.aegis.service.BackendRegistry;
import com.aegis.service.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Backend registration management.
 */
@Slf4j
@RestController
@RequestMapping("/v1/backends")
public class BackendController {

    private final BackendRegistry registry;

    public BackendController(BackendRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public ResponseEntity<List<BackendSummary>> listBackends() {
        List<BackendSummary> backends = registry.configs().values().stream()
                .map(config -> BackendSummary.of(config, registry.isAvailable(config.getKind())))
                .toList();
        return ResponseEntity.ok(backends);
    }

    /**
     * Register or replace a backend configuration.
     */
    @PutMapping("/{id}")
    public ResponseEntity<Object> registerBackend(
            @PathVariable String id,
            @RequestBody BackendRegistration registration) {
        Optional<BackendKind> kind = BackendKind.fromId(id);
        if (kind.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown backend: " + id));
        }

        log.info("Registration requested for backend {}", kind.get().getId());
        BackendConfig config = registry.toBackendConfig(kind.get(), registration.toProviderConfig());
        try {
            registry.register(config);
        } catch (ConfigurationException e) {
            log.warn("Rejected registration for {}: {}", kind.get().getId(), e.getMessage());
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Invalid configuration for " + kind.get().getId(),
                    "violations", e.getViolations()
            ));
        }
        return ResponseEntity.ok(BackendSummary.of(config, registry.isAvailable(config.getKind())));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> unregisterBackend(@PathVariable String id) {
        Optional<BackendKind> kind = BackendKind.fromId(id);
        if (kind.isEmpty() || !registry.unregister(kind.get())) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }
}
