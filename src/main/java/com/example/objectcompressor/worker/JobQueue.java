package com.example.objectcompressor.worker;

import com.example.objectcompressor.model.Job;
import com.example.objectcompressor.scope.ExecutionScope;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded FIFO hand-off between the dispatcher and the workers. The only state they share.
 * <p>
 * A full queue blocks the producer, which is what throttles the dispatcher under bursts.
 */
public class JobQueue {

    private static final long OFFER_TIMEOUT_MS = 100;

    private final BlockingQueue<Job> jobs;
    private final int capacity;
    private volatile boolean closed;

    public JobQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.jobs = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Blocks until the job is queued.
     *
     * @return false if the queue was closed or {@code scope} cancelled before space became free
     */
    public boolean put(Job job, ExecutionScope scope) throws InterruptedException {
        while (!closed && !scope.isCancelled()) {
            if (jobs.offer(job, OFFER_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return the next job, or null if none arrived within {@code timeout}
     */
    public Job poll(Duration timeout) throws InterruptedException {
        return jobs.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stops accepting jobs. Jobs already queued can still be polled.
     */
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean isEmpty() {
        return jobs.isEmpty();
    }

    public int size() {
        return jobs.size();
    }

    public int capacity() {
        return capacity;
    }
}
