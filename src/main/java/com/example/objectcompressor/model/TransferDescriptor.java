package com.example.objectcompressor.model;

import lombok.Builder;
import lombok.Value;

/**
 * Resolved source and destination of a single compression, owned by one pipeline invocation.
 */
@Value
@Builder
public class TransferDescriptor {

    ObjectLocation source;

    ObjectLocation destination;

    /**
     * -1 default, 0 no compression, 1 best speed through 9 best compression, -2 Huffman only.
     */
    int compressionLevel;

    public static TransferDescriptor of(String sourceBucket, String sourceObject,
                                        String destinationBucket, String destinationObject,
                                        int compressionLevel) {
        return TransferDescriptor.builder()
                .source(new ObjectLocation(sourceBucket, sourceObject))
                .destination(new ObjectLocation(destinationBucket, destinationObject))
                .compressionLevel(compressionLevel)
                .build();
    }
}
