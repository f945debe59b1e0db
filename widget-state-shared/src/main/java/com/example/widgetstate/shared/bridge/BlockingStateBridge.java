package com.example.widgetstate.shared.bridge;

import com.example.widgetstate.shared.exception.BridgeDeadlockException;
import com.example.widgetstate.shared.exception.StateBackendException;
import com.example.widgetstate.shared.exception.StateOperationTimeoutException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Lets synchronous code run state operations. Operations are subscribed on one persistent bridge
 * thread and the caller waits for the result up to a timeout.
 * <p>
 * Waiting from a non-blocking Reactor thread (an event loop, a parallel worker, or the bridge
 * thread itself) would stall the scheduler the operation may need, so such calls are rejected
 * with {@link BridgeDeadlockException} instead of hanging.
 */
@Slf4j
public class BlockingStateBridge {

    static final String THREAD_NAME = "widget-state-bridge";

    private final Scheduler scheduler;
    @Getter
    private final Duration timeout;

    public BlockingStateBridge(Duration timeout) {
        this.timeout = timeout;
        this.scheduler = Schedulers.newSingle(THREAD_NAME, true);
    }

    /**
     * @return the value of {@code operation}, or {@code null} when it completes empty
     * @throws BridgeDeadlockException when called from a thread that must not block
     * @throws StateOperationTimeoutException when the operation outlives the bridge timeout
     */
    public <T> T block(String name, Mono<T> operation) {
        ensureCallerMayBlock(name);
        CompletableFuture<T> future = operation.subscribeOn(scheduler).toFuture();
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StateOperationTimeoutException(name, timeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new StateBackendException("State operation '" + name + "' failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new StateBackendException("Interrupted while waiting for state operation '" + name + "'", e);
        }
    }

    /**
     * Schedules the operation without waiting. Failures are logged.
     */
    public void fireAndForget(String name, Mono<?> operation) {
        operation.subscribeOn(scheduler)
                .subscribe(
                        value -> log.trace("Background state operation '{}' completed", name),
                        error -> log.warn("Background state operation '{}' failed: {}", name, error.getMessage(), error));
    }

    public boolean isDisposed() {
        return scheduler.isDisposed();
    }

    public void dispose() {
        scheduler.dispose();
    }

    private void ensureCallerMayBlock(String name) {
        Thread current = Thread.currentThread();
        if (current.getName().startsWith(THREAD_NAME)) {
            throw new BridgeDeadlockException("State operation '" + name
                    + "' was called from the bridge thread itself; compose the Mono instead of blocking on it");
        }
        if (Schedulers.isInNonBlockingThread()) {
            throw new BridgeDeadlockException("State operation '" + name + "' cannot block on non-blocking thread "
                    + current.getName() + "; use the reactive API instead");
        }
    }
}
