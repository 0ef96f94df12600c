package com.example.objectcompressor.worker;

import com.example.objectcompressor.config.CompressorProperties;
import com.example.objectcompressor.scope.CancellationCause;
import com.example.objectcompressor.scope.ProcessScopes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import sun.misc.Signal;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sequences shutdown of the event-driven mode.
 * <pre>
 * RUNNING --signal--> DRAINING --grace period or second signal--> TERMINATED
 * </pre>
 * Draining cancels the worker scope only, giving interrupted jobs time to be republished while
 * the root scope stays alive. Terminating cancels the root scope, which releases the main thread.
 */
@Component
@ConditionalOnProperty(prefix = "compressor", name = "subscription")
@Slf4j
public class ShutdownCoordinator {

    public enum State {
        RUNNING, DRAINING, TERMINATED
    }

    private static final List<String> HANDLED_SIGNALS = List.of("INT", "TERM");

    private final ProcessScopes scopes;
    private final Duration gracePeriod;
    private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);
    private final AtomicReference<Throwable> failure = new AtomicReference<>();

    private volatile ScheduledFuture<?> graceTimer;

    public ShutdownCoordinator(ProcessScopes scopes, CompressorProperties properties) {
        this.scopes = scopes;
        this.gracePeriod = properties.getDrainGracePeriod();
    }

    /**
     * Replaces the JVM's default INT and TERM handling with {@link #onSignal(String)}.
     */
    public void installSignalHandlers() {
        for (String name : HANDLED_SIGNALS) {
            try {
                Signal.handle(new Signal(name), signal -> onSignal(signal.getName()));
            } catch (IllegalArgumentException e) {
                log.warn("cannot handle SIG{}, falling back to the JVM default: {}", name, e.getMessage());
            }
        }
    }

    public void onSignal(String signalName) {
        log.info("received signal {}", signalName);
        if (state.compareAndSet(State.RUNNING, State.DRAINING)) {
            log.info("canceling all workers and waiting {}s before stopping - issue another signal to stop immediately",
                    gracePeriod.toSeconds());
            scopes.getWorkers().cancel(CancellationCause.SHUTDOWN);
            graceTimer = scopes.getTimer().schedule(this::terminate, gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
        } else if (state.get() == State.DRAINING) {
            log.warn("second signal while draining, stopping immediately");
            terminate();
        }
    }

    /**
     * Terminates straight away after an unrecoverable error; the failure is kept for the exit status.
     */
    public void fail(Throwable cause) {
        if (failure.compareAndSet(null, cause)) {
            log.error("fatal error, terminating: {}", cause.getMessage(), cause);
        }
        terminate();
    }

    void terminate() {
        State previous = state.getAndSet(State.TERMINATED);
        if (previous == State.TERMINATED) {
            return;
        }
        ScheduledFuture<?> timer = graceTimer;
        if (timer != null) {
            timer.cancel(false);
        }
        scopes.getWorkers().cancel(CancellationCause.SHUTDOWN);
        scopes.getRoot().cancel(CancellationCause.SHUTDOWN);
        log.info("stopped, was {}", previous);
    }

    public State getState() {
        return state.get();
    }

    public Optional<Throwable> getFailure() {
        return Optional.ofNullable(failure.get());
    }
}
