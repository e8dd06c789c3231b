package me.golemcore.browser.domain.exception;

/**
 * Classification of every failure the orchestration layer reports to callers.
 */
public enum ErrorKind {
    CONFLICT,
    NOT_FOUND,
    INVALID_PARAMETERS,
    DOMAIN_NOT_ALLOWED,
    PROVISIONING_ERROR,
    UPSTREAM_FAILURE,
    TIMEOUT,
    UNKNOWN_OPERATION;

    /**
     * Whether a caller may reasonably retry the same request later.
     */
    public boolean isRetryable() {
        return this == NOT_FOUND || this == TIMEOUT || this == UPSTREAM_FAILURE;
    }
}
