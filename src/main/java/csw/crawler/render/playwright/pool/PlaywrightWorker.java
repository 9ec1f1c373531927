package csw.crawler.render.playwright.pool;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Dedicated thread that owns one Playwright instance and everything created from it.
 * Playwright objects must be used from the thread that created them, so callers hand their work over
 * with {@link #submit(Callable)} and block until it has run here.
 */
@Slf4j
public class PlaywrightWorker extends Thread {
    private static final long POLL_INTERVAL_MS = 100;

    private final BlockingQueue<FutureTask<?>> taskQueue = new LinkedBlockingQueue<>();
    private final Duration commandTimeout;
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private volatile boolean running = true;
    private final AtomicReference<Runnable> finalTask = new AtomicReference<>();

    public PlaywrightWorker(String name, Duration commandTimeout) {
        super(name);
        this.commandTimeout = commandTimeout;
        setDaemon(true);
        start();
    }

    @Override
    public void run() {
        while (running) {
            try {
                FutureTask<?> task = taskQueue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (task != null) {
                    task.run();
                }
            } catch (InterruptedException e) {
                // a timed-out command was cancelled while running here
                log.debug("Worker {} interrupted by a cancelled command", getName());
            }
        }

        FutureTask<?> leftover;
        while ((leftover = taskQueue.poll()) != null) {
            leftover.cancel(false);
        }
        runFinalTask();
        log.debug("Worker {} stopped", getName());
    }

    /**
     * Runs the task on this worker and waits at most the command timeout for its result.
     * Exceptions thrown by the task are rethrown as-is.
     */
    public <T> T submit(Callable<T> task) throws Exception {
        return submit(task, commandTimeout, true);
    }

    /**
     * Runs the task on this worker and waits at most {@code timeout} for its result.
     *
     * @param interruptOnTimeout whether a task still running at the deadline is interrupted; when false it
     *                           keeps running here and its side effects stay visible to later tasks
     * @throws TimeoutException if the task did not finish in time
     */
    public <T> T submit(Callable<T> task, Duration timeout, boolean interruptOnTimeout) throws Exception {
        if (Thread.currentThread() == this) {
            return task.call();
        }
        if (!isRunning()) {
            throw new IllegalStateException("Worker " + getName() + " is not running");
        }

        FutureTask<T> future = new FutureTask<>(task);
        taskQueue.offer(future);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        } catch (TimeoutException e) {
            future.cancel(interruptOnTimeout);
            throw new TimeoutException("Worker " + getName() + " did not finish within " + timeout.toMillis() + "ms");
        }
    }

    public boolean isRunning() {
        return running && isAlive();
    }

    /**
     * Stops the thread and runs the final task (typically closing Playwright) as its last action, after any
     * task still in progress has returned. Waits up to the command timeout for that to happen. Safe to call
     * more than once; only the first final task runs.
     */
    public void shutdownWorker(Runnable finalTask) {
        if (!stopping.compareAndSet(false, true)) {
            return;
        }
        this.finalTask.set(finalTask);
        running = false;
        if (Thread.currentThread() == this || !isAlive()) {
            runFinalTask();
            return;
        }
        try {
            join(commandTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (isAlive()) {
            log.warn("Worker {} still busy after {}ms, it will clean up once its current task returns",
                    getName(), commandTimeout.toMillis());
        }
    }

    private void runFinalTask() {
        Runnable task = finalTask.getAndSet(null);
        if (task == null) {
            return;
        }
        if (Thread.currentThread() == this) {
            // a cancelled command may have left the flag set
            Thread.interrupted();
        }
        try {
            task.run();
        } catch (Exception e) {
            log.warn("Final task of worker {} failed", getName(), e);
        }
    }
}
