package com.example.objectcompressor.exception;

public class TransferFailedException extends CompressionException {

    public TransferFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
