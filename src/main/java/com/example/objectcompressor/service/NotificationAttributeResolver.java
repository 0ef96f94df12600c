package com.example.objectcompressor.service;

import com.example.objectcompressor.model.NotificationAttributes;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Works out bucket, object and event type of a notification.
 * <p>
 * Notifications that carry them as attributes are taken as is. MinIO bucket notifications carry
 * no attributes, so for those the values are read from the S3 event record in the body.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationAttributeResolver {

    private static final String CREATED_PREFIX = "s3:ObjectCreated:";
    private static final String REMOVED_PREFIX = "s3:ObjectRemoved:";

    private final ObjectMapper objectMapper;

    public Map<String, String> resolve(Map<String, String> attributes, byte[] payload) {
        if (attributes.containsKey(NotificationAttributes.OBJECT_ID)
                || attributes.containsKey(NotificationAttributes.EVENT_TYPE)
                || payload == null || payload.length == 0) {
            return attributes;
        }

        JsonNode record;
        try {
            record = objectMapper.readTree(payload).path("Records").path(0);
        } catch (IOException e) {
            log.warn("notification body is not an S3 event record: {}", e.getMessage());
            return attributes;
        }
        if (record.isMissingNode()) {
            return attributes;
        }

        String objectKey;
        try {
            objectKey = URLDecoder.decode(record.path("s3").path("object").path("key").asText(""), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.warn("notification object key is not URL encoded: {}", e.getMessage());
            return attributes;
        }

        Map<String, String> resolved = new HashMap<>(attributes);
        resolved.put(NotificationAttributes.BUCKET_ID, record.path("s3").path("bucket").path("name").asText(""));
        resolved.put(NotificationAttributes.OBJECT_ID, objectKey);
        resolved.put(NotificationAttributes.EVENT_TYPE, eventType(record.path("eventName").asText("")));
        return resolved;
    }

    private static String eventType(String eventName) {
        if (eventName.startsWith(CREATED_PREFIX)) {
            return NotificationAttributes.OBJECT_FINALIZE;
        }
        if (eventName.startsWith(REMOVED_PREFIX)) {
            return NotificationAttributes.OBJECT_DELETE;
        }
        return eventName;
    }
}
