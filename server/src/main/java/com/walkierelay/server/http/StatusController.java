package com.walkierelay.server.http;

import com.walkierelay.server.lifecycle.EventLoop;
import com.walkierelay.server.model.ChannelView;
import com.walkierelay.server.registry.ChannelDirectory;
import com.walkierelay.server.registry.ConnectionRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.time.Clock;
import java.util.List;

/**
 * Read-only views of the relay state. Every read is taken on the event loop.
 */
@RestController
public class StatusController {

    static final String VERSION = "1.0.0";
    private static final long READ_TIMEOUT_MS = 2000;

    private final EventLoop loop;
    private final ChannelDirectory channels;
    private final ConnectionRegistry connections;
    private final Clock clock;

    public StatusController(EventLoop loop, ChannelDirectory channels, ConnectionRegistry connections, Clock clock) {
        this.loop = loop;
        this.channels = channels;
        this.connections = connections;
        this.clock = clock;
    }

    @GetMapping("/")
    public StatusResponse status() {
        int[] counts = counts();
        return new StatusResponse("ok", "Walkie-Talkie Server Running", VERSION,
                counts[0], counts[1], clock.instant().toString());
    }

    @GetMapping("/health")
    public HealthResponse health() {
        int[] counts = counts();
        double uptime = ManagementFactory.getRuntimeMXBean().getUptime() / 1000.0;
        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        return new HealthResponse("healthy", uptime,
                new MemoryResponse(heap.getUsed(), heap.getCommitted(), heap.getMax()),
                counts[0], counts[1]);
    }

    @GetMapping("/channels")
    public List<ChannelView> channels() {
        return loop.call(channels::snapshot, READ_TIMEOUT_MS);
    }

    private int[] counts() {
        return loop.call(() -> new int[]{channels.size(), connections.size()}, READ_TIMEOUT_MS);
    }

    public static class StatusResponse {
        public final String status;
        public final String message;
        public final String version;
        public final int channels;
        public final int users;
        public final String timestamp;

        StatusResponse(String status, String message, String version, int channels, int users, String timestamp) {
            this.status = status;
            this.message = message;
            this.version = version;
            this.channels = channels;
            this.users = users;
            this.timestamp = timestamp;
        }
    }

    public static class HealthResponse {
        public final String status;
        public final double uptime;
        public final MemoryResponse memory;
        public final int channels;
        public final int users;

        HealthResponse(String status, double uptime, MemoryResponse memory, int channels, int users) {
            this.status = status;
            this.uptime = uptime;
            this.memory = memory;
            this.channels = channels;
            this.users = users;
        }
    }

    public static class MemoryResponse {
        public final long heapUsed;
        public final long heapTotal;
        public final long heapMax;

        MemoryResponse(long heapUsed, long heapTotal, long heapMax) {
            this.heapUsed = heapUsed;
            this.heapTotal = heapTotal;
            this.heapMax = heapMax;
        }
    }
}
