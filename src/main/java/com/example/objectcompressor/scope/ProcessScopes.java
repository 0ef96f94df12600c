package com.example.objectcompressor.scope;

import jakarta.annotation.PreDestroy;
import lombok.Getter;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * The two-level cancellation hierarchy shared by the dispatcher, the worker pool and the
 * shutdown coordinator.
 * <p>
 * The root scope outlives the worker scope: cancelling workers leaves the root alive so that
 * in-flight acknowledgements and republishing can still complete.
 */
@Component
@Getter
public class ProcessScopes {

    private final ScheduledThreadPoolExecutor timer;
    private final ExecutionScope root;
    private final ExecutionScope workers;

    public ProcessScopes() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("scope-timer-");
        threadFactory.setDaemon(true);
        this.timer = new ScheduledThreadPoolExecutor(1, threadFactory);
        // job deadlines are cancelled long before they fire
        this.timer.setRemoveOnCancelPolicy(true);
        this.root = ExecutionScope.root("root", timer);
        this.workers = root.child("workers");
    }

    @PreDestroy
    public void release() {
        root.cancel(CancellationCause.SHUTDOWN);
        timer.shutdownNow();
    }
}
