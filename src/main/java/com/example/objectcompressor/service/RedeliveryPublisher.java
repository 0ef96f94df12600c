package com.example.objectcompressor.service;

import com.example.objectcompressor.config.CompressorProperties;
import com.example.objectcompressor.exception.DestinationAlreadyExistsException;
import com.example.objectcompressor.exception.PublishFailedException;
import com.example.objectcompressor.model.Job;
import com.example.objectcompressor.scope.ExecutionScope;
import com.example.objectcompressor.scope.ProcessScopes;
import com.example.objectcompressor.scope.ScopeCancelledException;
import com.example.objectcompressor.transport.MessagePublisher;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Failure handler of the worker pool.
 * <p>
 * Every failure is logged. Jobs interrupted by a shutdown are republished to the recovery topic
 * with their original attributes and payload; any other failure (timeouts included) needs manual
 * reprocessing through direct mode.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RedeliveryPublisher {

    private final MessagePublisher messagePublisher;
    private final ProcessScopes scopes;
    private final CompressorProperties properties;
    private final ExecutorService publishers = Executors.newCachedThreadPool(daemonThreads());

    public void handleFailure(Job job, Throwable cause) {
        logFailure(job, cause);
        if (ScopeCancelledException.isShutdown(cause)) {
            republish(job);
        }
    }

    void republish(Job job) {
        String objectName = job.objectName();
        ExecutionScope root = scopes.getRoot();
        if (root.isCancelled()) {
            log.error("'{}' - cannot republish message, process is terminating. Reprocess the object manually.", objectName);
            return;
        }

        log.info("{} - '{}' context canceled. re-publishing message for reprocessing", job.workerName(), objectName);
        // the deadline covers the send call itself, which may block on broker metadata
        CompletableFuture<String> result = CompletableFuture
                .supplyAsync(() -> messagePublisher.publish(
                        properties.getRecoveryTopic(), job.originalAttributes(), job.originalPayload()), publishers)
                .thenCompose(Function.identity());
        try (ExecutionScope.Registration abandonOnTermination = root.onCancel(() -> result.cancel(true))) {
            String messageId = result.get(properties.getRepublishTimeout().toMillis(), TimeUnit.MILLISECONDS);
            log.info("'{}' - republished message with id '{}'", objectName, messageId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logPublishFailure(objectName, new PublishFailedException("interrupted while republishing", e));
        } catch (ExecutionException e) {
            logPublishFailure(objectName, new PublishFailedException("republishing failed", e.getCause()));
        } catch (TimeoutException | RuntimeException e) {
            result.cancel(true);
            logPublishFailure(objectName, new PublishFailedException("republishing failed", e));
        }
    }

    @PreDestroy
    public void shutdown() {
        publishers.shutdownNow();
    }

    private void logFailure(Job job, Throwable cause) {
        if (cause instanceof DestinationAlreadyExistsException exists && exists.isPriorRun()) {
            log.warn("{} - '{}' was already compressed by an earlier run, source left in place: {}",
                    job.workerName(), job.objectName(), cause.getMessage());
            return;
        }
        if (ScopeCancelledException.isShutdown(cause)) {
            log.warn("{} - '{}' interrupted by shutdown: {}", job.workerName(), job.objectName(), cause.getMessage());
            return;
        }
        log.error("{} - '{}' failed: {}", job.workerName(), job.objectName(), cause.getMessage(), cause);
    }

    private void logPublishFailure(String objectName, PublishFailedException failure) {
        log.error("'{}' - error republishing message on topic '{}', reprocess the object manually",
                objectName, properties.getRecoveryTopic(), failure);
    }

    private static CustomizableThreadFactory daemonThreads() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("republish-");
        threadFactory.setDaemon(true);
        return threadFactory;
    }
}
