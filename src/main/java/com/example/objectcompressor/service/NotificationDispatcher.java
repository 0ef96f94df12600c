package com.example.objectcompressor.service;

import com.example.objectcompressor.config.CompressorProperties;
import com.example.objectcompressor.model.Job;
import com.example.objectcompressor.model.NotificationAttributes;
import com.example.objectcompressor.scope.CancellationCause;
import com.example.objectcompressor.scope.ExecutionScope;
import com.example.objectcompressor.scope.ProcessScopes;
import com.example.objectcompressor.scope.ScopeCancelledException;
import com.example.objectcompressor.transport.InboundMessage;
import com.example.objectcompressor.worker.JobQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Filters storage notifications and turns the accepted ones into jobs.
 * <p>
 * Every message is acknowledged, accepted or not. Accepted messages are acknowledged before
 * their job is queued because compressing a large object can take longer than the transport's
 * longest acknowledgment deadline. From then on an interrupted job is only recovered through
 * {@link RedeliveryPublisher}.
 */
@Service
@ConditionalOnProperty(prefix = "compressor", name = "subscription")
@RequiredArgsConstructor
@Slf4j
public class NotificationDispatcher {

    static final String DISPATCHER_NAME = "[dispatcher]";

    private final CompressorProperties properties;
    private final NotificationAttributeResolver attributeResolver;
    private final JobQueue jobQueue;
    private final ProcessScopes scopes;
    private final RedeliveryPublisher redeliveryPublisher;

    public void dispatch(InboundMessage message) {
        Map<String, String> attributes = attributeResolver.resolve(message.attributes(), message.payload());

        String bucketId = attributes.getOrDefault(NotificationAttributes.BUCKET_ID, "");
        if (!bucketId.equals(properties.getSourceBucket())) {
            log.warn("ignoring event - received for bucket '{}' but expected to get it for bucket '{}'. "
                    + "Potentially storage notification misconfigured.", bucketId, properties.getSourceBucket());
            message.ack();
            return;
        }

        String objectId = attributes.getOrDefault(NotificationAttributes.OBJECT_ID, "");
        if (objectId.isEmpty()) {
            log.info("ignoring event for empty object: {}", attributes);
            message.ack();
            return;
        }

        if (objectId.contains(properties.getTempObjectMarker())) {
            log.info("ignoring event for temp object: '{}'", objectId);
            message.ack();
            return;
        }

        String eventType = attributes.getOrDefault(NotificationAttributes.EVENT_TYPE, "");
        if (!NotificationAttributes.OBJECT_FINALIZE.equals(eventType)) {
            log.info("ignoring event of type '{}' for objectId '{}'", eventType, objectId);
            message.ack();
            return;
        }

        message.ack();
        enqueue(Job.of(objectId, message.attributes(), message.payload()), message.id());
    }

    private void enqueue(Job job, String messageId) {
        ExecutionScope workers = scopes.getWorkers();
        try {
            if (jobQueue.put(job, workers)) {
                log.debug("queued '{}' from message {}", job.objectName(), messageId);
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            redeliveryPublisher.handleFailure(job.withWorkerName(DISPATCHER_NAME),
                    new ScopeCancelledException("dispatcher", CancellationCause.SHUTDOWN));
            return;
        }
        // workers are draining, nothing will pick the job up any more
        redeliveryPublisher.handleFailure(job.withWorkerName(DISPATCHER_NAME), workers.isCancelled()
                ? workers.cancellationException()
                : new ScopeCancelledException("job queue", CancellationCause.SHUTDOWN));
    }
}
