package com.walkierelay.server.janitor;

import com.walkierelay.server.lifecycle.EventLoop;
import com.walkierelay.server.media.MediaStore;
import com.walkierelay.server.registry.ChannelDirectory;
import com.walkierelay.server.registry.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodic housekeeping on the event loop: empty-channel sweep, stale media sweep and stats.
 * Armed by {@link #start()} and cancelled by {@link #stop()} from the lifecycle controller.
 */
@Component
public class Janitor {
    private static final Logger log = LoggerFactory.getLogger(Janitor.class);

    private final ChannelDirectory channels;
    private final ConnectionRegistry connections;
    private final MediaStore media;
    private final EventLoop loop;
    private final long emptyChannelIntervalMs;
    private final long statsIntervalMs;
    private final long mediaSweepIntervalMs;
    private final Duration mediaRetention;

    private final List<ScheduledFuture<?>> tasks = new ArrayList<>();

    public Janitor(ChannelDirectory channels,
                   ConnectionRegistry connections,
                   MediaStore media,
                   EventLoop loop,
                   @Value("${walkie.janitor.empty-channel-interval-ms:60000}") long emptyChannelIntervalMs,
                   @Value("${walkie.janitor.stats-interval-ms:300000}") long statsIntervalMs,
                   @Value("${walkie.media.sweep-interval-ms:300000}") long mediaSweepIntervalMs,
                   @Value("${walkie.media.retention-ms:3600000}") long mediaRetentionMs) {
        this.channels = channels;
        this.connections = connections;
        this.media = media;
        this.loop = loop;
        this.emptyChannelIntervalMs = emptyChannelIntervalMs;
        this.statsIntervalMs = statsIntervalMs;
        this.mediaSweepIntervalMs = mediaSweepIntervalMs;
        this.mediaRetention = Duration.ofMillis(mediaRetentionMs);
    }

    public synchronized void start() {
        if (!tasks.isEmpty()) return;
        tasks.add(loop.scheduleAtFixedRate("empty-channel-sweep", this::sweepEmptyChannels, emptyChannelIntervalMs));
        tasks.add(loop.scheduleAtFixedRate("stats", this::collectStats, statsIntervalMs));
        tasks.add(loop.scheduleAtFixedRate("stale-media-sweep", this::sweepStaleMedia, mediaSweepIntervalMs));
        log.info("[JANITOR] started: emptyChannels={}ms stats={}ms media={}ms retention={}",
                emptyChannelIntervalMs, statsIntervalMs, mediaSweepIntervalMs, mediaRetention);
    }

    public synchronized void stop() {
        if (tasks.isEmpty()) return;
        tasks.forEach(t -> t.cancel(false));
        tasks.clear();
        log.info("[JANITOR] stopped");
    }

    public synchronized boolean isRunning() {
        return !tasks.isEmpty();
    }

    /**
     * Backstop for channels left empty by a handler that failed half way.
     */
    public int sweepEmptyChannels() {
        int cleaned = channels.sweepEmpty();
        if (cleaned > 0) {
            log.info("[JANITOR] cleaned {} empty channels", cleaned);
        }
        return cleaned;
    }

    /** File work happens off the loop; the result is reported back on it. */
    public void sweepStaleMedia() {
        media.deleteOlderThanAsync(mediaRetention).whenComplete((deleted, error) ->
                loop.execute("stale-media-report", () -> {
                    if (error != null) {
                        log.warn("[JANITOR] stale media sweep failed", error);
                    } else if (deleted > 0) {
                        log.info("[JANITOR] deleted {} stale audio files", deleted);
                    }
                }));
    }

    public Stats collectStats() {
        Stats stats = new Stats(channels.size(), connections.size(), channels.totalMessageCount());
        log.info("[STATS] {}", stats);
        return stats;
    }

    public static class Stats {
        public final int channels;
        public final int connections;
        public final long totalMessages;

        public Stats(int channels, int connections, long totalMessages) {
            this.channels = channels;
            this.connections = connections;
            this.totalMessages = totalMessages;
        }

        @Override
        public String toString() {
            return "channels=" + channels + " connections=" + connections + " totalMessages=" + totalMessages;
        }
    }
}
