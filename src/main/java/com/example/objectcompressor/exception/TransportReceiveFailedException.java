package com.example.objectcompressor.exception;

/**
 * The notification receive loop stopped abnormally. Fatal for the whole process.
 */
public class TransportReceiveFailedException extends CompressionException {

    public TransportReceiveFailedException(String message) {
        super(message);
    }

    public TransportReceiveFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
