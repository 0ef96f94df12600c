package com.example.objectcompressor.scope;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * A cancellable, optionally deadline-bearing unit of work.
 * <p>
 * Scopes form a tree: cancelling a scope cancels all of its descendants with the same cause, and
 * a child created under an already cancelled parent is born cancelled. The first cause recorded
 * wins, so a job that timed out stays a timeout even if a shutdown follows.
 * <p>
 * Scopes carry cancellation only, never domain data.
 */
@Slf4j
public final class ExecutionScope implements AutoCloseable {

    private final String name;
    private final ExecutionScope parent;
    private final ScheduledExecutorService timer;
    private final Set<ExecutionScope> children = ConcurrentHashMap.newKeySet();
    private final List<Runnable> cancelListeners = new CopyOnWriteArrayList<>();
    private final CountDownLatch cancelled = new CountDownLatch(1);

    private volatile CancellationCause cause;
    private volatile ScheduledFuture<?> deadline;

    private ExecutionScope(String name, ExecutionScope parent, ScheduledExecutorService timer) {
        this.name = name;
        this.parent = parent;
        this.timer = timer;
    }

    public static ExecutionScope root(String name, ScheduledExecutorService timer) {
        return new ExecutionScope(name, null, timer);
    }

    public ExecutionScope child(String childName) {
        ExecutionScope child = new ExecutionScope(childName, this, timer);
        children.add(child);
        CancellationCause parentCause = cause;
        if (parentCause != null) {
            child.cancel(parentCause);
        }
        return child;
    }

    public ExecutionScope child(String childName, Duration timeout) {
        ExecutionScope child = child(childName);
        if (!child.isCancelled()) {
            child.deadline = timer.schedule(() -> {
                if (child.cancel(CancellationCause.TIMEOUT)) {
                    log.warn("scope '{}' exceeded its timeout of {}", childName, timeout);
                }
            }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        return child;
    }

    /**
     * Cancels this scope and its descendants.
     *
     * @return false if the scope had already been cancelled
     */
    public boolean cancel(CancellationCause cancellationCause) {
        synchronized (this) {
            if (cause != null) {
                return false;
            }
            cause = cancellationCause;
        }
        cancelled.countDown();
        ScheduledFuture<?> pending = deadline;
        if (pending != null) {
            pending.cancel(false);
        }
        for (Runnable listener : cancelListeners) {
            // removal decides the race with onCancel, each listener runs once
            if (cancelListeners.remove(listener)) {
                runListener(listener);
            }
        }
        for (ExecutionScope child : children) {
            child.cancel(cancellationCause);
        }
        return true;
    }

    /**
     * Registers a callback run once on cancellation, immediately if the scope is already cancelled.
     * Closing the returned registration removes the callback.
     */
    public Registration onCancel(Runnable listener) {
        cancelListeners.add(listener);
        if (cause != null && cancelListeners.remove(listener)) {
            runListener(listener);
        }
        return () -> cancelListeners.remove(listener);
    }

    public boolean isCancelled() {
        return cause != null;
    }

    public Optional<CancellationCause> cancellationCause() {
        return Optional.ofNullable(cause);
    }

    public void throwIfCancelled() {
        CancellationCause current = cause;
        if (current != null) {
            throw new ScopeCancelledException(name, current);
        }
    }

    public ScopeCancelledException cancellationException() {
        return new ScopeCancelledException(name, cause == null ? CancellationCause.COMPLETED : cause);
    }

    public void await() throws InterruptedException {
        cancelled.await();
    }

    /**
     * @return true if the scope was cancelled within {@code timeout}
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return cancelled.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public String getName() {
        return name;
    }

    /**
     * Releases the scope: cancels it as {@link CancellationCause#COMPLETED} unless it already
     * carries a cause, and detaches it from its parent.
     */
    @Override
    public void close() {
        cancel(CancellationCause.COMPLETED);
        if (parent != null) {
            parent.children.remove(this);
        }
    }

    private void runListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("cancel listener of scope '{}' failed", name, e);
        }
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
