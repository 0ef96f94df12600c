package com.example.objectcompressor.transport;

import com.example.objectcompressor.exception.TransportReceiveFailedException;
import com.example.objectcompressor.service.NotificationDispatcher;
import com.example.objectcompressor.worker.ShutdownCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.config.KafkaListenerEndpointRegistry;
import org.springframework.kafka.event.ConsumerStoppedEvent;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Receive loop for storage notifications. The listener container is started and stopped
 * explicitly; acknowledgment is manual so the dispatcher decides when each record is committed.
 */
@Component
@ConditionalOnProperty(prefix = "compressor", name = "subscription")
@RequiredArgsConstructor
@Slf4j
public class KafkaNotificationReceiver {

    public static final String LISTENER_ID = "storage-notifications";

    private static final Duration NACK_SLEEP = Duration.ofSeconds(1);

    private final NotificationDispatcher dispatcher;
    private final KafkaListenerEndpointRegistry registry;
    private final ShutdownCoordinator shutdownCoordinator;

    @KafkaListener(id = LISTENER_ID, topics = "${compressor.subscription}", autoStartup = "false")
    public void onNotification(ConsumerRecord<String, byte[]> record, Acknowledgment acknowledgment) {
        dispatcher.dispatch(new KafkaInboundMessage(record, acknowledgment));
    }

    public void start() {
        container().start();
    }

    /**
     * Stops receiving. Records of the current poll are still handed to the dispatcher.
     */
    public void stopAsync() {
        MessageListenerContainer container = container();
        if (container.isRunning()) {
            container.stop(() -> log.info("stopped receiving notifications"));
        }
    }

    @EventListener
    public void onConsumerStopped(ConsumerStoppedEvent event) {
        if (event.getReason() != ConsumerStoppedEvent.Reason.NORMAL) {
            shutdownCoordinator.fail(new TransportReceiveFailedException(
                    "notification consumer stopped: " + event.getReason()));
        }
    }

    private MessageListenerContainer container() {
        MessageListenerContainer container = registry.getListenerContainer(LISTENER_ID);
        if (container == null) {
            throw new IllegalStateException("no listener container registered as " + LISTENER_ID);
        }
        return container;
    }

    static String messageId(String topic, int partition, long offset) {
        return topic + "-" + partition + "@" + offset;
    }

    static Map<String, String> attributes(ConsumerRecord<?, ?> record) {
        Map<String, String> attributes = new HashMap<>();
        for (Header header : record.headers()) {
            byte[] value = header.value();
            attributes.put(header.key(), value == null ? "" : new String(value, StandardCharsets.UTF_8));
        }
        return attributes;
    }

    private record KafkaInboundMessage(ConsumerRecord<String, byte[]> record, Acknowledgment acknowledgment)
            implements InboundMessage {

        @Override
        public String id() {
            return messageId(record.topic(), record.partition(), record.offset());
        }

        @Override
        public Map<String, String> attributes() {
            return KafkaNotificationReceiver.attributes(record);
        }

        @Override
        public byte[] payload() {
            return record.value() == null ? new byte[0] : record.value();
        }

        @Override
        public void ack() {
            acknowledgment.acknowledge();
        }

        @Override
        public void nack() {
            acknowledgment.nack(NACK_SLEEP);
        }
    }
}
