package com.apisentinel.core.sink;

/**
 * Raised by an {@link AlertSink} when a delivery attempt fails.
 *
 * @since 1.0.0
 */
public class SinkDeliveryException extends Exception {

    private static final long serialVersionUID = 1L;

    /** Whether another attempt could succeed. */
    private final boolean retryable;

    public SinkDeliveryException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public SinkDeliveryException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
