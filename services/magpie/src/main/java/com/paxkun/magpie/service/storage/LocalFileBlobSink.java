package com.paxkun.magpie.service.storage;

import com.paxkun.magpie.exception.StoreException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Stores images under a local directory that the web layer serves at {@code /images/**}.
 *
 * Author: Pax
 */
@Slf4j
public class LocalFileBlobSink implements BlobSink {

    static final String PUBLIC_PATH = "/images/";

    @Getter
    private final Path root;
    private final String baseUrl;
    private final Clock clock;

    public LocalFileBlobSink(Path root, String baseUrl) {
        this(root, baseUrl, Clock.systemUTC());
    }

    LocalFileBlobSink(Path root, String baseUrl, Clock clock) {
        this.root = root.toAbsolutePath().normalize();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.clock = clock;
    }

    @Override
    public String put(String key, byte[] bytes, String contentType) {
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, bytes, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new StoreException("Failed to write " + key + ": " + e.getMessage(), e);
        }
        log.debug("💾 Wrote {} bytes ({}) to {}", bytes.length, contentType, target);
        return baseUrl + PUBLIC_PATH + key;
    }

    @Override
    public boolean delete(String key) {
        try {
            return Files.deleteIfExists(resolve(key));
        } catch (IOException | StoreException e) {
            log.warn("⚠️ Failed to delete {}: {}", key, e.getMessage());
            return false;
        }
    }

    /**
     * Deletes stored files last modified more than {@code maxAge} ago.
     *
     * @return number of files removed
     */
    public int cleanupOlderThan(Duration maxAge) {
        if (!Files.isDirectory(root)) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(maxAge);

        List<Path> expired;
        try (Stream<Path> files = Files.walk(root)) {
            expired = files.filter(Files::isRegularFile)
                    .filter(file -> isOlderThan(file, cutoff))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StoreException("Failed to scan " + root + ": " + e.getMessage(), e);
        }

        int deleted = 0;
        for (Path file : expired) {
            if (delete(root.relativize(file).toString().replace('\\', '/'))) {
                deleted++;
            }
        }
        return deleted;
    }

    private boolean isOlderThan(Path file, Instant cutoff) {
        try {
            return Files.getLastModifiedTime(file).toInstant().isBefore(cutoff);
        } catch (IOException e) {
            log.warn("⚠️ Could not read modification time of {}: {}", file, e.getMessage());
            return false;
        }
    }

    private Path resolve(String key) {
        if (key == null || key.isBlank()) {
            throw new StoreException("Storage key must not be blank", null);
        }
        Path target = root.resolve(key).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new StoreException("Storage key escapes the upload directory: " + key, null);
        }
        return target;
    }
}
