package com.example.objectcompressor.model;

import java.util.Map;

/**
 * One accepted notification turned into a unit of work.
 *
 * @param objectName         the object to compress
 * @param workerName         display name of the worker running the job, empty until dequeued
 * @param originalAttributes the notification's attributes, exactly as received
 * @param originalPayload    the notification's raw payload, exactly as received
 */
public record Job(
        String objectName,
        String workerName,
        Map<String, String> originalAttributes,
        byte[] originalPayload) {

    public Job {
        workerName = workerName == null ? "" : workerName;
        originalAttributes = originalAttributes == null ? Map.of() : Map.copyOf(originalAttributes);
        originalPayload = originalPayload == null ? new byte[0] : originalPayload.clone();
    }

    public static Job of(String objectName, Map<String, String> attributes, byte[] payload) {
        return new Job(objectName, "", attributes, payload);
    }

    public Job withWorkerName(String name) {
        return new Job(objectName, name, originalAttributes, originalPayload);
    }

    @Override
    public byte[] originalPayload() {
        return originalPayload.clone();
    }
}
