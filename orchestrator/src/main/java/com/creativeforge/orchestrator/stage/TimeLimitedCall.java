package com.creativeforge.orchestrator.stage;

import com.creativeforge.orchestrator.ai.CapabilityException;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs an external call on a bounded pool and stops waiting after a deadline.
 *
 * The calling thread only blocks on the future. On timeout the call is
 * cancelled (interrupted) and TimeoutException is thrown to the caller.
 */
public final class TimeLimitedCall {

    private TimeLimitedCall() {}

    public static <T> T call(ExecutorService pool, Duration timeout, Supplier<T> task) throws TimeoutException {
        Future<T> future = pool.submit(task::get);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException("External call failed", cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw CapabilityException.transientFailure("Interrupted while waiting for external call", e);
        }
    }
}
