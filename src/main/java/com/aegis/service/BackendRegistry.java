package com.aegis.service;

import com.aegis.config.AegisProperties;
import com.aegis.model.BackendConfig;
import com.aegis.model.BackendKind;
import com.aegis.provider.BackendAdapter;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registered backend configurations and the adapter lookup table.
 */
@Slf4j
@Service
public class BackendRegistry {

    private final AegisProperties properties;
    private final BackendConfigValidator validator;
    private final AdmissionController admissionController;
    private final Map<BackendKind, BackendAdapter> adapters;
    private final Map<BackendKind, BackendConfig> configs = new ConcurrentHashMap<>();

    public BackendRegistry(
            AegisProperties properties,
            BackendConfigValidator validator,
            AdmissionController admissionController,
            List<BackendAdapter> adapters) {
        this.properties = properties;
        this.validator = validator;
        this.admissionController = admissionController;

        Map<BackendKind, BackendAdapter> table = new EnumMap<>(BackendKind.class);
        for (BackendAdapter adapter : adapters) {
            BackendAdapter previous = table.put(adapter.getKind(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Two adapters registered for " + adapter.getKind()
                        + ": " + previous.getClass().getSimpleName() + ", " + adapter.getClass().getSimpleName());
            }
        }
        this.adapters = Collections.unmodifiableMap(table);

        log.info("Initialized BackendRegistry with {} adapters: {}",
                table.size(),
                table.values().stream().map(BackendAdapter::getName).toList());
    }

    /**
     * Register every configured, enabled provider that has a credential.
     * An invalid entry is logged and skipped so the others still start.
     */
    @PostConstruct
    public void registerConfiguredProviders() {
        properties.getProviders().forEach((id, provider) -> {
            Optional<BackendKind> kind = BackendKind.fromId(id);
            if (kind.isEmpty()) {
                log.warn("Ignoring configuration for unknown backend '{}'", id);
                return;
            }
            if (!provider.isEnabled()) {
                log.info("Backend {} is disabled by configuration", id);
                return;
            }
            if (provider.getApiKey() == null || provider.getApiKey().isBlank()) {
                log.debug("No credential configured for {}, not registering", id);
                return;
            }
            try {
                register(toBackendConfig(kind.get(), provider));
            } catch (ConfigurationException e) {
                log.error("Skipping backend {}: {}", id, e.getMessage());
            }
        });

        log.info("Registered backends: {}", configs.keySet().stream().map(BackendKind::getId).sorted().toList());
    }

    /**
     * Validate and store a configuration, replacing any previous one for the same kind.
     *
     * @throws ConfigurationException if the configuration fails validation
     */
    public void register(BackendConfig config) {
        validator.validate(config);
        configs.put(config.getKind(), config);
        admissionController.track(config.getKind());
        log.info("Registered backend {}", config);
    }

    /**
     * @return true if a configuration was removed
     */
    public boolean unregister(BackendKind kind) {
        BackendConfig removed = configs.remove(kind);
        if (removed != null) {
            log.info("Unregistered backend {}", kind.getId());
        }
        return removed != null;
    }

    public Optional<BackendConfig> find(BackendKind kind) {
        return Optional.ofNullable(configs.get(kind));
    }

    /**
     * Registered, enabled and served by an adapter.
     */
    public boolean isAvailable(BackendKind kind) {
        BackendConfig config = configs.get(kind);
        return config != null && config.isEnabled() && adapters.containsKey(kind);
    }

    /**
     * Registered configurations ordered by kind.
     */
    public Map<BackendKind, BackendConfig> configs() {
        return Collections.unmodifiableMap(new TreeMap<>(configs));
    }

    public Optional<BackendAdapter> adapterFor(BackendKind kind) {
        return Optional.ofNullable(adapters.get(kind));
    }

    /**
     * Build a config from a properties entry, falling back to the kind's defaults.
     */
    public BackendConfig toBackendConfig(BackendKind kind, AegisProperties.ProviderConfig provider) {
        return BackendConfig.builder()
                .kind(kind)
                .apiKey(provider.getApiKey())
                .endpoint(isBlank(provider.getEndpoint()) ? kind.getDefaultEndpoint() : provider.getEndpoint())
                .model(isBlank(provider.getModel()) ? kind.getDefaultModel() : provider.getModel())
                .timeoutSeconds(provider.getTimeout() != null
                        ? provider.getTimeout()
                        : properties.getService().getDefaultTimeout())
                .enabled(provider.isEnabled())
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
