package com.example.objectcompressor.transport;

import lombok.RequiredArgsConstructor;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes messages as Kafka records: attributes become headers, the payload the record value.
 */
@Component
@RequiredArgsConstructor
public class KafkaMessagePublisher implements MessagePublisher {

    private final KafkaTemplate<String, byte[]> kafkaTemplate;

    @Override
    public CompletableFuture<String> publish(String topic, Map<String, String> attributes, byte[] payload) {
        ProducerRecord<String, byte[]> record = new ProducerRecord<>(topic, payload);
        attributes.forEach((key, value) ->
                record.headers().add(new RecordHeader(key, value.getBytes(StandardCharsets.UTF_8))));
        return kafkaTemplate.send(record)
                .thenApply(result -> messageId(result.getRecordMetadata()));
    }

    static String messageId(RecordMetadata metadata) {
        return KafkaNotificationReceiver.messageId(metadata.topic(), metadata.partition(), metadata.offset());
    }
}
