package com.aegis.model;

/**
 * Classification of a failed {@link TaskResult}.
 */
public enum ErrorKind {

    /** Invalid or missing backend configuration. */
    CONFIGURATION,

    /** Admission denied by the local rate limiter. */
    RATE_LIMITED,

    /** Timeout, refused connection, TLS or other I/O failure. */
    TRANSPORT,

    /** The backend answered with an error status or an unusable body. */
    BACKEND,

    /** Malformed request: missing config, unknown or disabled task type. */
    VALIDATION
}
