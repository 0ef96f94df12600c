package com.example.objectcompressor.runner;

import com.example.objectcompressor.config.CompressorProperties;
import com.example.objectcompressor.exception.TransportReceiveFailedException;
import com.example.objectcompressor.scope.ProcessScopes;
import com.example.objectcompressor.transport.KafkaNotificationReceiver;
import com.example.objectcompressor.worker.JobQueue;
import com.example.objectcompressor.worker.ShutdownCoordinator;
import com.example.objectcompressor.worker.WorkerPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Runs the notification-driven mode until the shutdown coordinator cancels the root scope.
 */
@Component
@ConditionalOnProperty(prefix = "compressor", name = "subscription")
@RequiredArgsConstructor
@Slf4j
public class EventDrivenRunner implements ApplicationRunner {

    private static final Duration WORKER_STOP_TIMEOUT = Duration.ofSeconds(2);

    private final CompressorProperties properties;
    private final ProcessScopes scopes;
    private final WorkerPool workerPool;
    private final JobQueue jobQueue;
    private final KafkaNotificationReceiver receiver;
    private final ShutdownCoordinator shutdownCoordinator;

    @Override
    public void run(ApplicationArguments args) throws InterruptedException {
        shutdownCoordinator.installSignalHandlers();

        workerPool.start(properties.resolvedWorkers());

        log.info("topic used for republishing '{}'", properties.getRecoveryTopic());
        scopes.getWorkers().onCancel(receiver::stopAsync);

        log.info("subscribing to '{}'", properties.getSubscription());
        receiver.start();

        log.info("waiting for messages on '{}'", properties.getSubscription());
        scopes.getRoot().await();

        jobQueue.close();
        if (!workerPool.awaitTermination(WORKER_STOP_TIMEOUT)) {
            log.warn("workers still busy after {}s, abandoning them", WORKER_STOP_TIMEOUT.toSeconds());
        }

        Optional<Throwable> failure = shutdownCoordinator.getFailure();
        if (failure.isPresent()) {
            throw new TransportReceiveFailedException("notification receive loop failed", failure.get());
        }
    }
}
