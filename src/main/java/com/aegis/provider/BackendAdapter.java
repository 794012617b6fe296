package com.aegis.provider;

import com.aegis.model.BackendKind;
import com.aegis.model.TaskRequest;
import com.aegis.model.TaskResult;

/**
 * Interface for AI backend adapters.
 * Implementations handle provider-specific authentication, request/response mapping,
 * and API communication. One implementation per {@link BackendKind}.
 */
public interface BackendAdapter {

    /**
     * Backend this adapter talks to; also its key in the adapter lookup table.
     *
     * @return backend kind
     */
    BackendKind getKind();

    /**
     * Send the task to the backend and translate the answer.
     * Blocks for at most the request's configured timeout and never throws
     * for transport or HTTP failures: those come back as failed results.
     *
     * @param request task request carrying a validated config for {@link #getKind()}
     * @return task result
     */
    TaskResult process(TaskRequest request);

    /**
     * Get adapter name (e.g., "openai", "anthropic").
     *
     * @return adapter name
     */
    default String getName() {
        return getKind().getId();
    }
}
