package com.example.objectcompressor.transport;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

public interface MessagePublisher {

    /**
     * Publishes {@code payload} with {@code attributes} to {@code topic}.
     *
     * @return a future completed with the id the transport assigned to the message
     */
    CompletableFuture<String> publish(String topic, Map<String, String> attributes, byte[] payload);
}
