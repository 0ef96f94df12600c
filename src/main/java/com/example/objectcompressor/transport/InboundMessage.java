package com.example.objectcompressor.transport;

import java.util.Map;

/**
 * A delivered notification as seen by the dispatcher, independent of the transport.
 */
public interface InboundMessage {

    String id();

    Map<String, String> attributes();

    byte[] payload();

    void ack();

    void nack();
}
