package com.example.objectcompressor.runner;

import com.example.objectcompressor.config.CompressorProperties;
import com.example.objectcompressor.exception.TransportReceiveFailedException;
import com.example.objectcompressor.scope.CancellationCause;
import com.example.objectcompressor.scope.ProcessScopes;
import com.example.objectcompressor.transport.KafkaNotificationReceiver;
import com.example.objectcompressor.worker.JobQueue;
import com.example.objectcompressor.worker.ShutdownCoordinator;
import com.example.objectcompressor.worker.WorkerPool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EventDrivenRunnerTest {

    @Mock
    private WorkerPool workerPool;

    @Mock
    private KafkaNotificationReceiver receiver;

    @Mock
    private ShutdownCoordinator shutdownCoordinator;

    private ProcessScopes scopes;
    private JobQueue jobQueue;
    private EventDrivenRunner runner;

    @BeforeEach
    void setUp() {
        CompressorProperties properties = new CompressorProperties();
        properties.setSourceBucket("b1");
        properties.setDestinationBucket("b2");
        properties.setSubscription("notifications");
        properties.setRecoveryTopic("recovery");
        properties.setWorkers(3);
        scopes = new ProcessScopes();
        jobQueue = new JobQueue(3);
        runner = new EventDrivenRunner(properties, scopes, workerPool, jobQueue, receiver, shutdownCoordinator);
    }

    @AfterEach
    void tearDown() {
        scopes.release();
    }

    @Test
    void run_BlocksUntilRootScopeIsCancelled() throws Exception {
        when(workerPool.awaitTermination(any())).thenReturn(true);
        CompletableFuture<Void> running = CompletableFuture.runAsync(this::runUnchecked);

        verify(receiver, timeout(5000)).start();
        assertFalse(running.isDone());

        scopes.getWorkers().cancel(CancellationCause.SHUTDOWN);
        verify(receiver, timeout(5000)).stopAsync();
        assertFalse(running.isDone());

        scopes.getRoot().cancel(CancellationCause.SHUTDOWN);
        running.get(5, TimeUnit.SECONDS);

        InOrder inOrder = inOrder(shutdownCoordinator, workerPool, receiver);
        inOrder.verify(shutdownCoordinator).installSignalHandlers();
        inOrder.verify(workerPool).start(3);
        inOrder.verify(receiver).start();
        inOrder.verify(workerPool).awaitTermination(any(Duration.class));
        assertTrue(jobQueue.isClosed());
    }

    @Test
    void run_TransportFailureIsRethrown() throws InterruptedException {
        TransportReceiveFailedException failure = new TransportReceiveFailedException("consumer stopped: ERROR");
        when(shutdownCoordinator.getFailure()).thenReturn(Optional.of(failure));
        when(workerPool.awaitTermination(any())).thenReturn(true);
        scopes.getRoot().cancel(CancellationCause.SHUTDOWN);

        TransportReceiveFailedException e = assertThrows(TransportReceiveFailedException.class,
                () -> runner.run(new DefaultApplicationArguments()));

        assertSame(failure, e.getCause());
    }

    private void runUnchecked() {
        try {
            runner.run(new DefaultApplicationArguments());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException(e);
        }
    }
}
