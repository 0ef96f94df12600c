package com.example.objectcompressor.scope;

import com.example.objectcompressor.exception.CompressionException;
import lombok.Getter;

@Getter
public class ScopeCancelledException extends CompressionException {

    private final CancellationCause cancellationCause;

    public ScopeCancelledException(String scopeName, CancellationCause cancellationCause) {
        super("scope '%s' cancelled: %s".formatted(scopeName, cancellationCause));
        this.cancellationCause = cancellationCause;
    }

    /**
     * Walks the cause chain of {@code failure} looking for a cancellation triggered by shutdown.
     * Suppressed exceptions are not inspected.
     */
    public static boolean isShutdown(Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof ScopeCancelledException cancelled) {
                return cancelled.getCancellationCause() == CancellationCause.SHUTDOWN;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
