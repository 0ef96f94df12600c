package com.example.objectcompressor.exception;

public class ObjectNotFoundException extends CompressionException {

    public ObjectNotFoundException(String bucket, String objectName) {
        super("object '%s/%s' does not exist".formatted(bucket, objectName));
    }

    public ObjectNotFoundException(String bucket, String objectName, Throwable cause) {
        super("object '%s/%s' does not exist".formatted(bucket, objectName), cause);
    }
}
