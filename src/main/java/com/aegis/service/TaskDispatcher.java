package com.aegis.service;

import com.aegis.config.AegisProperties;
import com.aegis.model.BackendConfig;
import com.aegis.model.BackendKind;
import com.aegis.model.ErrorKind;
import com.aegis.model.TaskRequest;
import com.aegis.model.TaskResult;
import com.aegis.provider.BackendAdapter;
import com.aegis.service.canonicalization.PayloadLimits;
import com.aegis.service.canonicalization.PayloadSanitizer;
import com.aegis.service.canonicalization.RequestFingerprinter;
import com.aegis.service.metrics.DispatchMetrics;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Routes task requests to backends.
 *
 * Per request: validation, admission, cache lookup, then (on a miss) the
 * adapter call followed by metrics and cache write. Failures of any kind come
 * back as failed {@link TaskResult}s; nothing here throws for a backend or
 * network fault.
 */
@Slf4j
@Service
public class TaskDispatcher {

    private static final Logger AUDIT = LoggerFactory.getLogger("com.aegis.audit");

    static final String QUEUE_FULL = "dispatcher queue full";
    static final String SHUT_DOWN = "dispatcher is shut down";

    private final AegisProperties properties;
    private final BackendRegistry registry;
    private final ResponseCache cache;
    private final AdmissionController admissionController;
    private final RequestFingerprinter fingerprinter;
    private final PayloadSanitizer sanitizer;
    private final DispatchMetrics metrics;
    private final BackendConfigValidator validator;
    private final ThreadPoolTaskExecutor executor;

    private volatile boolean shutdown;

    public TaskDispatcher(
            AegisProperties properties,
            BackendRegistry registry,
            ResponseCache cache,
            AdmissionController admissionController,
            RequestFingerprinter fingerprinter,
            PayloadSanitizer sanitizer,
            DispatchMetrics metrics,
            BackendConfigValidator validator) {
        this.properties = properties;
        this.registry = registry;
        this.cache = cache;
        this.admissionController = admissionController;
        this.fingerprinter = fingerprinter;
        this.sanitizer = sanitizer;
        this.metrics = metrics;
        this.validator = validator;
        this.executor = createExecutor(properties.getService());

        log.info("Task dispatcher started: threads={}, queueCapacity={}, sanitize={}, audit={}",
                properties.getService().getThreadPoolSize(),
                properties.getService().getQueueCapacity(),
                properties.getSecurity().isSanitizeData(),
                properties.getSecurity().isAuditEnabled());
    }

    private static ThreadPoolTaskExecutor createExecutor(AegisProperties.ServiceConfig service) {
        if (service.getThreadPoolSize() <= 0) {
            throw new IllegalArgumentException("thread-pool-size must be positive: " + service.getThreadPoolSize());
        }
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(service.getThreadPoolSize());
        executor.setMaxPoolSize(service.getThreadPoolSize());
        executor.setQueueCapacity(service.getQueueCapacity());
        executor.setThreadNamePrefix("aegis-dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) service.getShutdownGracePeriod().toSeconds());
        executor.initialize();
        return executor;
    }

    /**
     * Process a request on the calling thread.
     */
    public TaskResult processSync(TaskRequest request) {
        TaskRequest task = request == null ? null : request.copy();

        Optional<TaskResult> rejection = validate(task);
        if (rejection.isPresent()) {
            TaskResult failure = rejection.get();
            log.warn("Rejected task: {}", failure.getErrorMessage());
            metrics.recordRejected(kindOf(task), failure.getErrorKind());
            return failure;
        }

        BackendConfig config = task.getConfig();
        BackendKind kind = config.getKind();
        boolean countCacheHits = properties.getRateLimiting().isCountCacheHits();

        if (countCacheHits && !admissionController.check(kind)) {
            return rateLimited(kind);
        }

        String key = fingerprinter.fingerprint(task);
        Optional<TaskResult> cached = cache.get(key);
        if (cached.isPresent()) {
            log.debug("Serving {} for {} from cache", task.getTaskType().getId(), kind.getId());
            metrics.recordCacheHit(kind, task.getTaskType());
            return cached.get();
        }
        metrics.recordCacheMiss(kind);

        if (!countCacheHits && !admissionController.check(kind)) {
            return rateLimited(kind);
        }

        // validate() guarantees the adapter is present
        BackendAdapter adapter = registry.adapterFor(kind).orElseThrow();
        TaskRequest outbound = properties.getSecurity().isSanitizeData()
                ? task.toBuilder().payload(sanitizer.sanitize(task.getPayload())).build()
                : task;

        audit("request sent: task={} backend={} model={}", task.getTaskType().getId(), kind.getId(), config.getModel());
        long start = System.nanoTime();
        TaskResult result = invoke(adapter, outbound);
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        result = result.withProcessingTime(durationMs);

        metrics.recordResponse(kind, task.getTaskType(), result, durationMs);
        audit("response received: task={} backend={} success={} error_kind={} time_ms={}",
                task.getTaskType().getId(), kind.getId(), result.isSuccess(), result.getErrorKind(), durationMs);

        if (result.isSuccess()) {
            cache.set(key, result);
            log.info("Completed {} via {} in {}ms", task.getTaskType().getId(), kind.getId(), durationMs);
        } else {
            log.warn("{} via {} failed ({}): {}", task.getTaskType().getId(), kind.getId(),
                    result.getErrorKind(), result.getErrorMessage());
        }
        return result;
    }

    /**
     * Process a request on the worker pool. The returned future always
     * completes normally; a saturated pool yields a failed result.
     */
    public CompletableFuture<TaskResult> processAsync(TaskRequest request) {
        return submit(request, null);
    }

    /**
     * Process a request on the worker pool and hand the result to
     * {@code callback} on the worker thread.
     */
    public CompletableFuture<TaskResult> processAsync(TaskRequest request, Consumer<TaskResult> callback) {
        return submit(request, callback);
    }

    private CompletableFuture<TaskResult> submit(TaskRequest request, Consumer<TaskResult> callback) {
        // the caller may mutate its payload after submission
        TaskRequest task = request == null ? null : request.copy();
        if (shutdown) {
            return rejectedSubmission(task, SHUT_DOWN, callback);
        }
        try {
            return CompletableFuture.supplyAsync(() -> {
                TaskResult result = processSync(task);
                deliver(callback, result);
                return result;
            }, executor);
        } catch (RejectedExecutionException e) {
            // shutdown() may have started after the flag check above
            if (shutdown) {
                return rejectedSubmission(task, SHUT_DOWN, callback);
            }
            log.warn("Dispatcher queue full ({} queued), rejecting task", executor.getQueueSize());
            return rejectedSubmission(task, QUEUE_FULL, callback);
        }
    }

    private CompletableFuture<TaskResult> rejectedSubmission(TaskRequest task, String message, Consumer<TaskResult> callback) {
        TaskResult failure = TaskResult.failure(ErrorKind.VALIDATION, message);
        metrics.recordRejected(kindOf(task), ErrorKind.VALIDATION);
        deliver(callback, failure);
        return CompletableFuture.completedFuture(failure);
    }

    private static void deliver(Consumer<TaskResult> callback, TaskResult result) {
        if (callback == null) {
            return;
        }
        try {
            callback.accept(result);
        } catch (RuntimeException e) {
            log.error("Task callback threw", e);
        }
    }

    /**
     * Stop accepting work and wait for in-flight tasks up to the grace period.
     */
    @PreDestroy
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        log.info("Shutting down task dispatcher ({} active)", executor.getActiveCount());
        executor.shutdown();
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public int getActiveCount() {
        return executor.getActiveCount();
    }

    /**
     * Tasks accepted but not yet picked up by a worker.
     */
    public int getQueueSize() {
        return executor.getQueueSize();
    }

    private Optional<TaskResult> validate(TaskRequest task) {
        if (!properties.getService().isEnabled()) {
            return Optional.of(TaskResult.failure(ErrorKind.VALIDATION, "AI service is disabled"));
        }
        if (task == null || task.getConfig() == null || task.getConfig().getKind() == null) {
            return Optional.of(TaskResult.failure(ErrorKind.VALIDATION, "Invalid request or missing configuration"));
        }
        if (task.getTaskType() == null) {
            return Optional.of(TaskResult.failure(ErrorKind.VALIDATION, "Task type is required"));
        }
        if (!properties.getFeatures().isEnabled(task.getTaskType())) {
            return Optional.of(TaskResult.failure(ErrorKind.VALIDATION,
                    "Task type " + task.getTaskType().getId() + " is disabled"));
        }
        AegisProperties.SecurityConfig security = properties.getSecurity();
        Optional<String> oversize = PayloadLimits.check(task.getPayload(), task.getContext(),
                security.getMaxPayloadBytes(), security.getMaxPayloadDepth());
        if (oversize.isPresent()) {
            return Optional.of(TaskResult.failure(ErrorKind.VALIDATION, oversize.get()));
        }

        BackendConfig config = task.getConfig();
        String backend = config.getKind().getId();
        if (!config.isEnabled()) {
            return Optional.of(TaskResult.failure(ErrorKind.CONFIGURATION, "Backend " + backend + " is disabled"));
        }
        List<String> violations = validator.violations(config);
        if (!violations.isEmpty()) {
            return Optional.of(TaskResult.failure(ErrorKind.CONFIGURATION,
                    "Invalid configuration for " + backend + ": " + String.join("; ", violations)));
        }
        if (registry.adapterFor(config.getKind()).isEmpty()) {
            return Optional.of(TaskResult.failure(ErrorKind.CONFIGURATION, "No adapter registered for " + backend));
        }
        return Optional.empty();
    }

    private TaskResult rateLimited(BackendKind kind) {
        metrics.recordRateLimited(kind);
        return TaskResult.failure(ErrorKind.RATE_LIMITED, "rate limit exceeded for " + kind.getId());
    }

    private TaskResult invoke(BackendAdapter adapter, TaskRequest request) {
        try {
            TaskResult result = adapter.process(request);
            if (result == null) {
                return TaskResult.failure(ErrorKind.BACKEND, adapter.getName() + " adapter returned no result");
            }
            return result;
        } catch (RuntimeException e) {
            log.error("Unexpected error from {} adapter", adapter.getName(), e);
            return TaskResult.failure(ErrorKind.BACKEND,
                    "Unexpected error from " + adapter.getName() + " adapter: " + e.getMessage());
        }
    }

    private void audit(String format, Object... args) {
        if (properties.getSecurity().isAuditEnabled()) {
            AUDIT.info(format, args);
        }
    }

    private static BackendKind kindOf(TaskRequest task) {
        return task == null || task.getConfig() == null ? null : task.getConfig().getKind();
    }
}
