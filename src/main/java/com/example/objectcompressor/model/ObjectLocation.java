package com.example.objectcompressor.model;

public record ObjectLocation(String bucket, String objectName) {

    @Override
    public String toString() {
        return bucket + "/" + objectName;
    }
}
