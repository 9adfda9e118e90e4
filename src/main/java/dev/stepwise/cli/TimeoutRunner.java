package dev.stepwise.cli;

import dev.stepwise.error.RunTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs a task on a worker thread and gives up after a time budget. The engine has no
 * cancellation of its own; a cancelled task is interrupted and its result discarded.
 */
public final class TimeoutRunner {

    private static final Logger LOG = LoggerFactory.getLogger(TimeoutRunner.class);

    public static final double DEFAULT_TIMEOUT_SECONDS = 3.0;
    public static final double MIN_TIMEOUT_SECONDS = 0.1;
    public static final double MAX_TIMEOUT_SECONDS = 30.0;

    private TimeoutRunner() {}

    /**
     * Normalize a user-supplied timeout: {@code null} means the default, zero or less means
     * no timeout (returned as {@code 0}).
     *
     * @throws IllegalArgumentException if the value is positive but outside the allowed range
     */
    public static double validateTimeout(Double seconds) {
        if (seconds == null) {
            return DEFAULT_TIMEOUT_SECONDS;
        }
        if (seconds <= 0) {
            return 0;
        }
        if (seconds < MIN_TIMEOUT_SECONDS) {
            throw new IllegalArgumentException(
                "Timeout too small (min: %ss, got: %ss)".formatted(MIN_TIMEOUT_SECONDS, seconds));
        }
        if (seconds > MAX_TIMEOUT_SECONDS) {
            throw new IllegalArgumentException(
                "Timeout too large (max: %ss, got: %ss)".formatted(MAX_TIMEOUT_SECONDS, seconds));
        }
        return seconds;
    }

    /**
     * Run {@code task}, waiting at most {@code seconds}. With {@code seconds == 0} the task runs
     * on the calling thread.
     *
     * @throws RunTimeoutException if the budget is exceeded
     */
    public static <T> T run(Supplier<T> task, double seconds) {
        if (seconds <= 0) {
            return task.get();
        }
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "stepwise-run");
            t.setDaemon(true);
            return t;
        });
        Future<T> future = executor.submit(task::get);
        try {
            return future.get((long) (seconds * 1000), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("Run cancelled after {}s", seconds);
            throw new RunTimeoutException(seconds);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Run failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new IllegalStateException("Interrupted while waiting for run", e);
        } finally {
            executor.shutdownNow();
        }
    }
}
