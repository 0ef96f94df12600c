package com.example.objectcompressor.model;

public record TransferResult(
        long bytesProcessed,
        long sourceSize,
        long destinationSize) {

    /**
     * Source size over destination size, or zero when the destination is empty.
     */
    public double compressionRatio() {
        if (destinationSize <= 0) {
            return 0;
        }
        return (double) sourceSize / (double) destinationSize;
    }
}
