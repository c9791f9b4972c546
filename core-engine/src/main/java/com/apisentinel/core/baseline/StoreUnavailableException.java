package com.apisentinel.core.baseline;

/**
 * Raised when a baseline or alert backend cannot serve a request.
 *
 * <p>
 * The pipeline treats it as transient: the affected window is analysed
 * fail-open (no alert) and the engine reports degraded mode until the next
 * successful operation.
 * </p>
 *
 * @since 1.0.0
 */
public class StoreUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
