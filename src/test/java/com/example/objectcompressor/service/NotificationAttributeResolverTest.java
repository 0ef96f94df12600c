package com.example.objectcompressor.service;

import com.example.objectcompressor.model.NotificationAttributes;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NotificationAttributeResolverTest {

    private final NotificationAttributeResolver resolver = new NotificationAttributeResolver(new ObjectMapper());

    @Test
    void explicitAttributesAreKept() {
        Map<String, String> attributes = Map.of(NotificationAttributes.OBJECT_ID, "a.txt",
                NotificationAttributes.EVENT_TYPE, NotificationAttributes.OBJECT_FINALIZE);

        assertSame(attributes, resolver.resolve(attributes, "{\"Records\":[]}".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void removedEventMapsToDelete() {
        byte[] body = ("{\"Records\":[{\"eventName\":\"s3:ObjectRemoved:Delete\","
                + "\"s3\":{\"bucket\":{\"name\":\"b1\"},\"object\":{\"key\":\"a.txt\"}}}]}")
                .getBytes(StandardCharsets.UTF_8);

        Map<String, String> resolved = resolver.resolve(Map.of("origin", "minio"), body);

        assertEquals("b1", resolved.get(NotificationAttributes.BUCKET_ID));
        assertEquals("a.txt", resolved.get(NotificationAttributes.OBJECT_ID));
        assertEquals(NotificationAttributes.OBJECT_DELETE, resolved.get(NotificationAttributes.EVENT_TYPE));
        assertEquals("minio", resolved.get("origin"));
    }

    @Test
    void unparsableBodyLeavesAttributesUntouched() {
        Map<String, String> attributes = Map.of(NotificationAttributes.BUCKET_ID, "b1");

        assertEquals(attributes, resolver.resolve(attributes, "not json".getBytes(StandardCharsets.UTF_8)));
        assertEquals(attributes, resolver.resolve(attributes, "{}".getBytes(StandardCharsets.UTF_8)));
        assertEquals(attributes, resolver.resolve(attributes, new byte[0]));
    }

    @Test
    void malformedObjectKeyEscapeLeavesAttributesUntouched() {
        byte[] body = ("{\"Records\":[{\"eventName\":\"s3:ObjectCreated:Put\","
                + "\"s3\":{\"bucket\":{\"name\":\"b1\"},\"object\":{\"key\":\"bad%zzkey\"}}}]}")
                .getBytes(StandardCharsets.UTF_8);

        assertEquals(Map.of(), resolver.resolve(Map.of(), body));
    }
}
