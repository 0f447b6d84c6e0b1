package com.walkierelay.server.media;

import com.walkierelay.server.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MediaStoreTest {

    @TempDir
    Path dir;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T12:00:00Z"));
    private MediaStore store;

    @BeforeEach
    void setUp() throws Exception {
        store = new MediaStore(dir.toString(), clock);
        store.init();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private Path fileAged(String name, Duration age) throws Exception {
        Path file = Files.write(dir.resolve(name), new byte[]{1, 2, 3});
        Files.setLastModifiedTime(file, FileTime.from(clock.instant().minus(age)));
        return file;
    }

    @Test
    void storedFilesGetUniqueTimestampedNames() throws Exception {
        String first = store.store(new ByteArrayInputStream(new byte[]{1}));
        String second = store.store(new ByteArrayInputStream(new byte[]{2}));

        assertNotEquals(first, second);
        assertTrue(first.matches(clock.millis() + "-[0-9a-z]{9}\\.m4a"), first);
        assertArrayEquals(new byte[]{1}, Files.readAllBytes(dir.resolve(first)));
    }

    @Test
    void onlyFilesOlderThanRetentionAreDeleted() throws Exception {
        Path old = fileAged("old.m4a", Duration.ofHours(2));
        Path fresh = fileAged("fresh.m4a", Duration.ofMinutes(10));

        assertEquals(1, store.deleteOlderThan(Duration.ofHours(1)));

        assertFalse(Files.exists(old));
        assertTrue(Files.exists(fresh));
    }

    @Test
    void sweepLeavesSubdirectoriesAlone() throws Exception {
        Path stuck = dir.resolve("stuck");
        Files.createDirectories(stuck);
        Files.write(stuck.resolve("inner.m4a"), new byte[]{1});
        Path old = fileAged("old.m4a", Duration.ofHours(2));

        assertEquals(1, store.deleteOlderThanAsync(Duration.ofHours(1)).get(5, TimeUnit.SECONDS));
        assertFalse(Files.exists(old));
        assertTrue(Files.exists(stuck));
    }

    @Test
    void sweepSkipsAFileItCannotDeleteAndCarriesOn() throws Exception {
        MediaStore failing = new MediaStore(dir.toString(), clock) {
            @Override
            void delete(Path file) throws IOException {
                if (file.getFileName().toString().equals("locked.m4a")) {
                    throw new AccessDeniedException(file.toString());
                }
                super.delete(file);
            }
        };
        Path first = fileAged("a.m4a", Duration.ofHours(2));
        Path locked = fileAged("locked.m4a", Duration.ofHours(2));
        Path last = fileAged("z.m4a", Duration.ofHours(2));

        try {
            assertEquals(2, failing.deleteOlderThan(Duration.ofHours(1)));
            assertFalse(Files.exists(first));
            assertFalse(Files.exists(last));
            assertTrue(Files.exists(locked));

            assertEquals(0, failing.purge());
            assertTrue(Files.exists(locked));
        } finally {
            failing.close();
        }
    }

    @Test
    void missingDirectoryYieldsNothing() throws Exception {
        MediaStore gone = new MediaStore(dir.resolve("missing").toString(), clock);
        try {
            assertEquals(0, gone.deleteOlderThan(Duration.ZERO));
        } finally {
            gone.close();
        }
    }

    @Test
    void purgeDeletesEverything() throws Exception {
        fileAged("a.m4a", Duration.ZERO);
        fileAged("b.m4a", Duration.ofDays(1));

        assertEquals(2, store.purgeAsync().get(5, TimeUnit.SECONDS));
        try (var files = Files.list(dir)) {
            assertEquals(0, files.count());
        }
    }
}
