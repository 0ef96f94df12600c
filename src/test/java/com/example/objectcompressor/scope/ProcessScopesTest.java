package com.example.objectcompressor.scope;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ProcessScopesTest {

    private ProcessScopes scopes;

    @BeforeEach
    void setUp() {
        scopes = new ProcessScopes();
    }

    @AfterEach
    void tearDown() {
        scopes.release();
    }

    @Test
    void finishedJobsLeaveNoPendingDeadlines() {
        for (int i = 0; i < 100; i++) {
            try (ExecutionScope job = scopes.getWorkers().child("job-" + i, Duration.ofMinutes(60))) {
                assertFalse(job.isCancelled());
            }
        }

        assertTrue(scopes.getTimer().getQueue().isEmpty());
    }

    @Test
    void releaseCancelsEverythingAsShutdown() {
        ExecutionScope job = scopes.getWorkers().child("job", Duration.ofMinutes(60));

        scopes.release();

        assertEquals(CancellationCause.SHUTDOWN, scopes.getRoot().cancellationCause().orElseThrow());
        assertEquals(CancellationCause.SHUTDOWN, job.cancellationCause().orElseThrow());
        assertTrue(scopes.getTimer().isShutdown());
    }
}
