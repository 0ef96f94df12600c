package com.example.objectcompressor.exception;

public class DeletionFailedException extends CompressionException {

    public DeletionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
