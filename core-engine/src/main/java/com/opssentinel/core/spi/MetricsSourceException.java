package com.opssentinel.core.spi;

/**
 * Thrown when a {@link MetricsSource} cannot deliver a snapshot. The
 * monitoring engine skips the poll cycle and retries on the next one.
 *
 * @since 1.0.0
 */
public class MetricsSourceException extends Exception {

    private static final long serialVersionUID = 1L;

    public MetricsSourceException(String message) {
        super(message);
    }

    public MetricsSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
