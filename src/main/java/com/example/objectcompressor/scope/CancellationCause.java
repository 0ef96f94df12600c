package com.example.objectcompressor.scope;

/**
 * Why an {@link ExecutionScope} stopped. Only {@link #SHUTDOWN} makes a job eligible for
 * redelivery.
 */
public enum CancellationCause {
    /** The process is draining or terminating. */
    SHUTDOWN,
    /** The scope outlived its deadline. */
    TIMEOUT,
    /** The work owning the scope finished and released it. */
    COMPLETED
}
