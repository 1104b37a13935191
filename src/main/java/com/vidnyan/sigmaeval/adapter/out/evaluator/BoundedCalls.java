package com.vidnyan.sigmaeval.adapter.out.evaluator;

import com.vidnyan.sigmaeval.application.port.out.CapabilityException;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs external capability calls with a deadline.
 * A call that does not finish in time is cancelled and reported as a {@link CapabilityException}.
 */
public final class BoundedCalls {

    private static final AtomicInteger COUNTER = new AtomicInteger();

    private static final ExecutorService CALLS = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "capability-call-" + COUNTER.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    private BoundedCalls() {
    }

    public static <T> T call(String capability, Duration timeout, Callable<T> call) {
        Future<T> future = CALLS.submit(call);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new CapabilityException(capability + " timed out after " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CapabilityException(capability + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CapabilityException capabilityException) {
                throw capabilityException;
            }
            throw new CapabilityException(capability + " failed: " + cause.getMessage(), cause);
        }
    }
}
