package com.walkierelay.server.lifecycle;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The single thread that owns relay state. Socket events, timers and snapshot reads all run
 * here one at a time, so the registry and directory need no locking.
 * <p>
 * A task that throws is logged and the loop carries on.
 */
@Component
public class EventLoop {
    private static final Logger log = LoggerFactory.getLogger(EventLoop.class);

    private final ScheduledExecutorService executor;
    private volatile Thread loopThread;

    public EventLoop() {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "signal-loop");
            t.setDaemon(true);
            loopThread = t;
            return t;
        });
    }

    public void execute(String label, Runnable task) {
        try {
            executor.execute(() -> runGuarded(label, task));
        } catch (RejectedExecutionException e) {
            log.warn("[WARN] event loop stopped, dropped {}", label);
        }
    }

    /**
     * Runs {@code task} on the loop and waits for its result. Runs inline when already on the loop.
     */
    public <T> T call(Callable<T> task, long timeoutMs) {
        if (inLoop()) {
            try {
                return task.call();
            } catch (Exception e) {
                throw new IllegalStateException("loop task failed", e);
            }
        }
        Future<T> future = executor.submit(task);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted waiting for event loop", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("loop task failed", e.getCause());
        } catch (TimeoutException e) {
            future.cancel(false);
            throw new IllegalStateException("event loop did not answer within " + timeoutMs + "ms", e);
        }
    }

    public ScheduledFuture<?> scheduleAtFixedRate(String label, Runnable task, long periodMs) {
        return executor.scheduleAtFixedRate(() -> runGuarded(label, task), periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    public boolean inLoop() {
        return Thread.currentThread() == loopThread;
    }

    // An escaped exception would cancel a periodic task for good.
    private void runGuarded(String label, Runnable task) {
        try {
            task.run();
        } catch (Throwable t) {
            log.error("[ERROR] {} failed", label, t);
        }
    }

    @PreDestroy
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
