package com.example.objectcompressor.exception;

public class SourceUnavailableException extends CompressionException {

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
