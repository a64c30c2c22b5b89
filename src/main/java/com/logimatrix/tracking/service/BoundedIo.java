package com.logimatrix.tracking.service;

import com.logimatrix.tracking.exception.DeadlineExceededException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs a blocking store or log call on the I/O pool and waits at most the given deadline.
 */
@Component
public class BoundedIo {

    private final Executor ioExecutor;

    public BoundedIo(@Qualifier("trackingIoExecutor") Executor ioExecutor) {
        this.ioExecutor = ioExecutor;
    }

    /**
     * The call is not interrupted when the deadline passes: a blocking client
     * keeps running and its side effects may still land afterwards. Callers
     * that must react to such a late completion use {@link #start} and
     * {@link #await} instead.
     *
     * @throws DeadlineExceededException if the call did not finish in time
     * @throws RuntimeException          the call's own failure, unwrapped
     */
    public <T> T call(String operation, Duration deadline, Supplier<T> task) {
        return await(operation, deadline, start(task));
    }

    public <T> CompletableFuture<T> start(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, ioExecutor);
    }

    /**
     * Waits for a started call. On a deadline the future is left running so the
     * caller can still observe its outcome.
     */
    public <T> T await(String operation, Duration deadline, CompletableFuture<T> future) {
        try {
            return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new DeadlineExceededException(operation, deadline);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeadlineExceededException(operation, deadline);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(operation + " failed", cause);
        }
    }

    /**
     * Starts a best-effort call without waiting for it.
     */
    public CompletableFuture<Void> runAsync(Runnable task) {
        return CompletableFuture.runAsync(task, ioExecutor);
    }

    public void run(String operation, Duration deadline, Runnable task) {
        call(operation, deadline, () -> {
            task.run();
            return null;
        });
    }
}
