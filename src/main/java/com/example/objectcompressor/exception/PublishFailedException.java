package com.example.objectcompressor.exception;

public class PublishFailedException extends CompressionException {

    public PublishFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
