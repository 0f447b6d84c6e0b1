package com.walkierelay.server.lifecycle;

import com.walkierelay.server.janitor.Janitor;
import com.walkierelay.server.media.MediaStore;
import com.walkierelay.server.model.OutboundEvent;
import com.walkierelay.server.model.Payloads;
import com.walkierelay.server.registry.ConnectionRegistry;
import com.walkierelay.server.ws.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * RUNNING -> DRAINING -> STOPPED.
 * <p>
 * Draining tells every connection {@code server-shutdown}, then closes them all, then
 * optionally purges stored media. If that has not finished when the deadline fires, the process
 * is terminated with status 1; a drain that completes exits with status 0 once the application
 * context has closed. Handler faults never move the state.
 * <p>
 * Runs in the highest lifecycle phase so it drains before the web server stops.
 */
@Component
public class LifecycleController implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(LifecycleController.class);

    static final String SHUTDOWN_MESSAGE = "Server is shutting down";

    private final ConnectionRegistry connections;
    private final Transport transport;
    private final Janitor janitor;
    private final MediaStore media;
    private final EventLoop loop;
    private final ProcessTerminator terminator;
    private final long deadlineMs;
    private final boolean purgeOnShutdown;

    private final AtomicReference<LifecycleState> state = new AtomicReference<>(LifecycleState.RUNNING);
    private final CompletableFuture<Void> stopped = new CompletableFuture<>();
    private volatile boolean started;
    private volatile ScheduledExecutorService deadlineTimer;

    public LifecycleController(ConnectionRegistry connections,
                               Transport transport,
                               Janitor janitor,
                               MediaStore media,
                               EventLoop loop,
                               ProcessTerminator terminator,
                               @Value("${walkie.shutdown.deadline-ms:10000}") long deadlineMs,
                               @Value("${walkie.media.purge-on-shutdown:true}") boolean purgeOnShutdown) {
        this.connections = connections;
        this.transport = transport;
        this.janitor = janitor;
        this.media = media;
        this.loop = loop;
        this.terminator = terminator;
        this.deadlineMs = deadlineMs;
        this.purgeOnShutdown = purgeOnShutdown;
    }

    @Override
    public void start() {
        janitor.start();
        if (!started) {
            // handlers run after every context has closed
            SpringApplication.getShutdownHandlers().add(this::exitAfterClose);
        }
        started = true;
        log.info("[BOOT] relay running");
    }

    @Override
    public void stop(Runnable callback) {
        shutdown().whenComplete((v, e) -> callback.run());
    }

    @Override
    public void stop() {
        try {
            shutdown().get(deadlineMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (TimeoutException | ExecutionException e) {
            log.error("[SHUTDOWN] drain did not complete: {}", e.toString());
        }
    }

    @Override
    public boolean isRunning() {
        return started && state.get() == LifecycleState.RUNNING;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    public LifecycleState getState() {
        return state.get();
    }

    public boolean isAcceptingConnections() {
        return state.get() == LifecycleState.RUNNING;
    }

    /**
     * Must run on the event loop. A connection that reaches the loop after draining began missed
     * the drain, so it gets its own shutdown notice and is closed instead of admitted.
     */
    public boolean admit(String connectionId) {
        if (isAcceptingConnections()) {
            return true;
        }
        log.info("[CONNECT] closing {} admitted while {}", connectionId, state.get());
        transport.send(connectionId, OutboundEvent.SERVER_SHUTDOWN.wireName(), Payloads.of("message", SHUTDOWN_MESSAGE));
        transport.close(connectionId);
        return false;
    }

    /** Reports status 0 for a completed drain. An unfinished one is left to the deadline. */
    public void exitAfterClose() {
        if (state.get() != LifecycleState.STOPPED) {
            return;
        }
        log.info("[SHUTDOWN] exiting with status 0");
        terminator.terminate(0);
    }

    /**
     * Starts draining. Later calls return the same completion.
     */
    public CompletableFuture<Void> shutdown() {
        if (!state.compareAndSet(LifecycleState.RUNNING, LifecycleState.DRAINING)) {
            return stopped;
        }
        log.info("[SHUTDOWN] shutting down gracefully, deadline {}ms", deadlineMs);
        armDeadline();
        loop.execute("shutdown-drain", this::drain);
        return stopped;
    }

    private void drain() {
        janitor.stop();
        List<String> ids = connections.connectionIds();
        for (String id : ids) {
            transport.send(id, OutboundEvent.SERVER_SHUTDOWN.wireName(), Payloads.of("message", SHUTDOWN_MESSAGE));
        }
        for (String id : ids) {
            transport.close(id);
        }
        log.info("[SHUTDOWN] notified and closed {} connections", ids.size());

        CompletableFuture<Integer> purge = purgeOnShutdown
                ? media.purgeAsync()
                : CompletableFuture.completedFuture(0);
        purge.whenComplete((deleted, error) -> {
            if (error != null) {
                log.warn("[SHUTDOWN] media purge failed", error);
            } else if (deleted > 0) {
                log.info("[SHUTDOWN] purged {} audio files", deleted);
            }
            finish();
        });
    }

    private void finish() {
        state.set(LifecycleState.STOPPED);
        ScheduledExecutorService timer = deadlineTimer;
        if (timer != null) timer.shutdownNow();
        log.info("[SHUTDOWN] server closed");
        stopped.complete(null);
    }

    private void armDeadline() {
        ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "shutdown-deadline");
            t.setDaemon(true);
            return t;
        });
        deadlineTimer = timer;
        timer.schedule(() -> {
            if (state.get() != LifecycleState.STOPPED) {
                log.error("[SHUTDOWN] forced shutdown after {}ms", deadlineMs);
                terminator.terminate(1);
            }
        }, deadlineMs, TimeUnit.MILLISECONDS);
    }
}
