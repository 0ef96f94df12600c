package com.example.objectcompressor.model;

/**
 * Attribute keys and values of an object lifecycle notification.
 */
public final class NotificationAttributes {

    public static final String BUCKET_ID = "bucketId";
    public static final String OBJECT_ID = "objectId";
    public static final String EVENT_TYPE = "eventType";

    public static final String OBJECT_FINALIZE = "OBJECT_FINALIZE";
    public static final String OBJECT_DELETE = "OBJECT_DELETE";

    private NotificationAttributes() {
    }
}
