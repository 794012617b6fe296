package com.aegis.service;

import com.aegis.model.BackendConfig;
import com.aegis.model.BackendKind;
import com.aegis.model.HealthStatus;
import com.aegis.model.TaskRequest;
import com.aegis.model.TaskResult;
import com.aegis.model.TaskType;
import com.aegis.model.dto.HealthCheck;
import com.aegis.model.dto.HealthReport;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Probes backends by dispatching a minimal vulnerability-analysis task.
 */
@Slf4j
@Service
public class HealthService {

    private final BackendRegistry registry;
    private final TaskDispatcher dispatcher;
    private final Clock clock;

    @Autowired
    public HealthService(BackendRegistry registry, TaskDispatcher dispatcher) {
        this(registry, dispatcher, Clock.systemUTC());
    }

    public HealthService(BackendRegistry registry, TaskDispatcher dispatcher, Clock clock) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    public HealthCheck checkBackend(BackendKind kind) {
        Optional<BackendConfig> config = registry.find(kind);
        if (config.isEmpty()) {
            return HealthCheck.builder()
                    .backend(kind.getId())
                    .status(HealthStatus.UNKNOWN)
                    .message("Backend not registered")
                    .checkedAt(clock.instant())
                    .build();
        }

        long start = System.nanoTime();
        TaskResult result = dispatcher.processSync(probe(config.get()));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        HealthStatus status = result.isSuccess() ? HealthStatus.HEALTHY : HealthStatus.UNHEALTHY;
        if (status == HealthStatus.UNHEALTHY) {
            log.warn("Health check failed for {}: {}", kind.getId(), result.getErrorMessage());
        } else {
            log.debug("Health check passed for {} in {}ms", kind.getId(), elapsedMs);
        }

        return HealthCheck.builder()
                .backend(kind.getId())
                .status(status)
                .message(result.isSuccess() ? "OK" : result.getErrorMessage())
                .responseTimeMs(elapsedMs)
                .checkedAt(clock.instant())
                .build();
    }

    /**
     * Probe every registered backend. Overall HEALTHY if all pass, DEGRADED if
     * some do, UNHEALTHY if none do or nothing is registered.
     */
    public HealthReport checkAll() {
        List<HealthCheck> checks = new ArrayList<>();
        for (BackendKind kind : registry.configs().keySet()) {
            checks.add(checkBackend(kind));
        }

        int healthy = (int) checks.stream().filter(c -> c.getStatus() == HealthStatus.HEALTHY).count();
        HealthStatus overall;
        if (checks.isEmpty() || healthy == 0) {
            overall = HealthStatus.UNHEALTHY;
        } else if (healthy == checks.size()) {
            overall = HealthStatus.HEALTHY;
        } else {
            overall = HealthStatus.DEGRADED;
        }

        return HealthReport.builder()
                .status(overall)
                .healthyBackends(healthy)
                .totalBackends(checks.size())
                .backends(checks)
                .checkedAt(clock.instant())
                .build();
    }

    static TaskRequest probe(BackendConfig config) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("health_check", true);
        return TaskRequest.builder()
                .taskType(TaskType.VULNERABILITY_ANALYSIS)
                .payload(payload)
                .config(config)
                .build();
    }
}
