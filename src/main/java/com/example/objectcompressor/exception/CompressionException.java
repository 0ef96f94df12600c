package com.example.objectcompressor.exception;

/**
 * Base type for every failure raised while moving an object through the compressor.
 */
public class CompressionException extends RuntimeException {

    public CompressionException(String message) {
        super(message);
    }

    public CompressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
