package com.example.objectcompressor.exception;

public class MetadataException extends CompressionException {

    public MetadataException(String message, Throwable cause) {
        super(message, cause);
    }
}
