package com.aegis.controller;

import com.aegis.model.BackendKind;
import com.aegis.model.HealthStatus;
import com.aegis.model.dto.HealthCheck;
import com.aegis.model.dto.HealthReport;
import com.aegis.service.HealthService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;
import java.util.Optional;

/**
 * Backend health probes. Probes dispatch real requests, so they run off the event loop.
 */
@RestController
@RequestMapping("/v1/health")
public class HealthController {

    private final HealthService healthService;

    public HealthController(HealthService healthService) {
        this.healthService = healthService;
    }

    @GetMapping
    public Mono<ResponseEntity<HealthReport>> checkAll() {
        return Mono.fromCallable(healthService::checkAll)
                .subscribeOn(Schedulers.boundedElastic())
                .map(report -> ResponseEntity
                        .status(report.getStatus() == HealthStatus.UNHEALTHY ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK)
                        .body(report));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<Object>> checkBackend(@PathVariable String id) {
        Optional<BackendKind> kind = BackendKind.fromId(id);
        if (kind.isEmpty()) {
            return Mono.just(ResponseEntity.badRequest().body(Map.of("error", "Unknown backend: " + id)));
        }
        return Mono.fromCallable(() -> healthService.checkBackend(kind.get()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(check -> ResponseEntity.status(statusFor(check)).body((Object) check));
    }

    private static HttpStatus statusFor(HealthCheck check) {
        return switch (check.getStatus()) {
            case HEALTHY, DEGRADED -> HttpStatus.OK;
            case UNKNOWN -> HttpStatus.NOT_FOUND;
            case UNHEALTHY -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }
}
