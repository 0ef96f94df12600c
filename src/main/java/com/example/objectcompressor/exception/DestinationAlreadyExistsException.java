package com.example.objectcompressor.exception;

import lombok.Getter;

/**
 * Raised when the destination object is already present. Nothing is written in that case.
 * <p>
 * {@code priorRun} is true when the existing object carries the marker this service writes for
 * the same source, i.e. the collision is a redelivery of a job that already completed its copy.
 */
@Getter
public class DestinationAlreadyExistsException extends CompressionException {

    private final boolean priorRun;

    public DestinationAlreadyExistsException(String bucket, String objectName, boolean priorRun) {
        super("destination object '%s/%s' exists already".formatted(bucket, objectName));
        this.priorRun = priorRun;
    }
}
