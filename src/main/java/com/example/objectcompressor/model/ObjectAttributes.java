package com.example.objectcompressor.model;

import java.util.Map;

public record ObjectAttributes(
        long size,
        String contentType,
        Map<String, String> userMetadata) {

    public ObjectAttributes {
        userMetadata = userMetadata == null ? Map.of() : Map.copyOf(userMetadata);
    }
}
