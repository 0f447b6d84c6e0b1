package com.walkierelay.server.media;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Stream;

/**
 * Directory of uploaded audio clips. Sweeps run on the {@code media-io} thread so file-system
 * latency never holds up the event loop.
 */
@Component
public class MediaStore {
    private static final Logger log = LoggerFactory.getLogger(MediaStore.class);

    private static final String EXTENSION = ".m4a";
    private static final String BASE36 = "0123456789abcdefghijklmnopqrstuvwxyz";

    private final Path directory;
    private final Clock clock;
    private final ExecutorService io;

    public MediaStore(@Value("${walkie.media.dir:audio_temp}") String directory, Clock clock) {
        this.directory = Paths.get(directory).toAbsolutePath();
        this.clock = clock;
        this.io = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "media-io");
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void init() throws IOException {
        Files.createDirectories(directory);
        log.info("[BOOT] media directory {}", directory);
    }

    /**
     * Copies the stream into a new uniquely named file.
     *
     * @return the stored file name
     */
    public String store(InputStream content) throws IOException {
        String filename = newFileName();
        Files.copy(content, directory.resolve(filename));
        return filename;
    }

    String newFileName() {
        StringBuilder suffix = new StringBuilder(9);
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = 0; i < 9; i++) {
            suffix.append(BASE36.charAt(random.nextInt(BASE36.length())));
        }
        return clock.millis() + "-" + suffix + EXTENSION;
    }

    /**
     * Deletes files last modified longer than {@code retention} ago. A file that cannot be
     * inspected or deleted is logged and skipped.
     *
     * @return how many files were deleted
     */
    public int deleteOlderThan(Duration retention) {
        long now = clock.millis();
        int deleted = 0;
        for (Path file : listFiles()) {
            try {
                long age = now - Files.getLastModifiedTime(file).toMillis();
                if (age > retention.toMillis()) {
                    delete(file);
                    deleted++;
                    log.info("[JANITOR] deleted old audio file {}", file.getFileName());
                }
            } catch (IOException e) {
                log.warn("[WARN] skip {}: {}", file.getFileName(), e.toString());
            }
        }
        return deleted;
    }

    /** Deletes every stored file; failures are logged and skipped. */
    public int purge() {
        int deleted = 0;
        for (Path file : listFiles()) {
            try {
                delete(file);
                deleted++;
            } catch (IOException e) {
                log.warn("[WARN] cannot delete {}: {}", file.getFileName(), e.toString());
            }
        }
        return deleted;
    }

    void delete(Path file) throws IOException {
        Files.deleteIfExists(file);
    }

    public CompletableFuture<Integer> deleteOlderThanAsync(Duration retention) {
        return CompletableFuture.supplyAsync(() -> deleteOlderThan(retention), io);
    }

    public CompletableFuture<Integer> purgeAsync() {
        return CompletableFuture.supplyAsync(this::purge, io);
    }

    private List<Path> listFiles() {
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile).toList();
        } catch (IOException e) {
            log.warn("[WARN] cannot list {}: {}", directory, e.toString());
            return List.of();
        }
    }

    @PreDestroy
    public void close() {
        io.shutdown();
    }
}
