package com.example.objectcompressor.worker;

import com.example.objectcompressor.config.CompressorProperties;
import com.example.objectcompressor.model.Job;
import com.example.objectcompressor.model.TransferDescriptor;
import com.example.objectcompressor.scope.ExecutionScope;
import com.example.objectcompressor.scope.ProcessScopes;
import com.example.objectcompressor.service.CompressionPipeline;
import com.example.objectcompressor.service.RedeliveryPublisher;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Fixed set of workers draining the {@link JobQueue}. Each worker runs one job at a time,
 * synchronously, under its own deadline-bound scope.
 * <p>
 * Once the worker scope is cancelled the workers keep taking queued jobs; their scopes are born
 * cancelled, so each of them goes straight to redelivery. Workers stop when the root scope is
 * cancelled or nothing is left to take.
 */
@Component
@ConditionalOnProperty(prefix = "compressor", name = "subscription")
@RequiredArgsConstructor
@Slf4j
public class WorkerPool {

    private static final Duration POLL_TIMEOUT = Duration.ofMillis(200);

    private final CompressionPipeline pipeline;
    private final RedeliveryPublisher failureHandler;
    private final JobQueue jobQueue;
    private final ProcessScopes scopes;
    private final CompressorProperties properties;

    private ExecutorService workers;

    public synchronized void start(int poolSize) {
        if (workers != null) {
            throw new IllegalStateException("worker pool already started");
        }
        int size = Math.max(1, poolSize);
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("compress-worker-");
        threadFactory.setDaemon(true);
        workers = Executors.newFixedThreadPool(size, threadFactory);
        for (int id = 1; id <= size; id++) {
            String workerName = "[worker-%d]".formatted(id);
            workers.submit(() -> workerLoop(workerName));
        }
        log.info("started {} workers, job queue capacity {}", size, jobQueue.capacity());
    }

    void workerLoop(String workerName) {
        ExecutionScope root = scopes.getRoot();
        ExecutionScope workerScope = scopes.getWorkers();
        while (!root.isCancelled()) {
            if ((workerScope.isCancelled() || jobQueue.isClosed()) && jobQueue.isEmpty()) {
                break;
            }
            Job job;
            try {
                job = jobQueue.poll(POLL_TIMEOUT);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (job != null) {
                execute(job.withWorkerName(workerName));
            }
        }
        log.debug("{} - stopped", workerName);
    }

    void execute(Job job) {
        String workerName = job.workerName();
        String objectName = job.objectName();
        TransferDescriptor descriptor = TransferDescriptor.of(
                properties.getSourceBucket(), objectName,
                properties.getDestinationBucket(), objectName,
                properties.getCompressionLevel());

        log.info("{} - '{}' compressing from bucket '{}' -> bucket '{}' / '{}'", workerName, objectName,
                properties.getSourceBucket(), properties.getDestinationBucket(), objectName);
        try (ExecutionScope jobScope = scopes.getWorkers().child(workerName + " " + objectName, properties.getJobTimeout())) {
            try {
                pipeline.transfer(workerName, descriptor, jobScope);
                pipeline.deleteSource(workerName, descriptor, jobScope);
                log.info("{} - finished job for {}", workerName, objectName);
            } catch (RuntimeException e) {
                failureHandler.handleFailure(job, e);
            }
        }
    }

    /**
     * @return true if every worker stopped within {@code timeout}
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        ExecutorService current;
        synchronized (this) {
            current = workers;
        }
        if (current == null) {
            return true;
        }
        current.shutdown();
        return current.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (workers != null) {
            workers.shutdownNow();
        }
    }
}
