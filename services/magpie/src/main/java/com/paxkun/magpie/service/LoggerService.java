package com.paxkun.magpie.service;

import com.paxkun.magpie.config.MagpieProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Tagged request log for Magpie ({@code [SEARCH]}, {@code [PIPELINE]}, {@code [STORAGE]} ...).
 * <p>
 * Owns the service data root: the first writable directory out of
 * {@code magpie.logging.data-dir}, {@code %APPDATA%/Noona/magpie}, {@code ~/.noona/magpie}
 * and {@code /app/data}. The local image store defaults to {@code images/} under it and
 * this log goes to {@code logs/latest.log}, archived on every start.
 * <p>
 * Lines below {@code magpie.logging.level} are dropped.
 *
 * Author: Pax
 */
@Slf4j
@Service
public class LoggerService implements InitializingBean {

    public enum Level {
        DEBUG, INFO, WARN, ERROR
    }

    static final String LATEST_LOG = "latest.log";
    private static final DateTimeFormatter ARCHIVE_NAME = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");
    private static final DateTimeFormatter LINE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final Path CONTAINER_DATA_ROOT = Path.of("/app", "data");

    private final MagpieProperties.Logging settings;
    private final Level threshold;

    private Path dataRoot;
    private BufferedWriter writer;

    @Autowired
    public LoggerService(MagpieProperties properties) {
        this(properties.getLogging());
    }

    public LoggerService(MagpieProperties.Logging settings) {
        this.settings = settings;
        this.threshold = parseLevel(settings.getLevel());
    }

    @Override
    public void afterPropertiesSet() {
        dataRoot = firstWritable(dataRootCandidates());
        if (dataRoot == null) {
            log.warn("⚠️ No writable data root, Magpie request log is console-only.");
            return;
        }

        Path logsDir = dataRoot.resolve("logs");
        try {
            Files.createDirectories(logsDir);
            archiveLatest(logsDir);
            writer = Files.newBufferedWriter(logsDir.resolve(LATEST_LOG),
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("⚠️ Cannot open request log under {}, console-only: {}", logsDir.toAbsolutePath(), e.getMessage());
            writer = null;
        }

        info("STARTUP", "🐦 Magpie data root " + dataRoot.toAbsolutePath() + ", log level " + threshold);
    }

    /**
     * Ordered data root candidates. Null entries are skipped.
     */
    protected List<Path> dataRootCandidates() {
        List<Path> candidates = new ArrayList<>();
        if (settings.getDataDir() != null && !settings.getDataDir().isBlank()) {
            candidates.add(Path.of(settings.getDataDir()));
        }
        candidates.add(appDataPath());
        candidates.add(userHomePath());
        candidates.add(CONTAINER_DATA_ROOT);
        return candidates;
    }

    protected Path createDirectories(Path path) throws IOException {
        return Files.createDirectories(path);
    }

    private Path firstWritable(List<Path> candidates) {
        for (Path candidate : candidates) {
            if (candidate == null) {
                continue;
            }
            try {
                Path created = createDirectories(candidate);
                log.info("📁 Magpie data root: {}", created.toAbsolutePath());
                return created;
            } catch (IOException e) {
                log.warn("⚠️ Data root {} not usable ({}), trying next.", candidate.toAbsolutePath(), e.getClass().getSimpleName());
            }
        }
        return null;
    }

    private static Path appDataPath() {
        String appData = System.getenv("APPDATA");
        return appData != null && !appData.isBlank() ? Path.of(appData, "Noona", "magpie") : null;
    }

    private static Path userHomePath() {
        String userHome = System.getProperty("user.home");
        return userHome != null && !userHome.isBlank() ? Path.of(userHome, ".noona", "magpie") : null;
    }

    private void archiveLatest(Path logsDir) throws IOException {
        Path latest = logsDir.resolve(LATEST_LOG);
        if (Files.exists(latest) && Files.size(latest) > 0) {
            Path archived = logsDir.resolve(LocalDateTime.now().format(ARCHIVE_NAME) + ".log");
            Files.move(latest, archived, StandardCopyOption.REPLACE_EXISTING);
        }

        List<Path> archives;
        try (Stream<Path> files = Files.list(logsDir)) {
            archives = files
                    .filter(p -> p.getFileName().toString().endsWith(".log"))
                    .filter(p -> !p.getFileName().toString().equals(LATEST_LOG))
                    .sorted(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed())
                    .toList();
        }
        for (Path stale : archives.subList(Math.min(settings.getMaxArchives(), archives.size()), archives.size())) {
            Files.deleteIfExists(stale);
            log.debug("🗑️ Removed old request log {}", stale.getFileName());
        }
    }

    private synchronized void write(Level level, String tag, String message) {
        if (level.compareTo(threshold) < 0) {
            return;
        }
        String line = String.format("%s [%s] [%s] %s%n", LocalDateTime.now().format(LINE_TIME), level, tag, message);
        if (writer != null) {
            try {
                writer.write(line);
                writer.flush();
            } catch (IOException e) {
                log.error("❌ Request log write failed, continuing console-only", e);
                writer = null;
            }
        }
        System.out.print(line);
    }

    public void debug(String tag, String message) {
        write(Level.DEBUG, tag, message);
    }

    public void info(String tag, String message) {
        write(Level.INFO, tag, message);
    }

    public void warn(String tag, String message) {
        write(Level.WARN, tag, message);
    }

    public void error(String tag, String message, Throwable throwable) {
        write(Level.ERROR, tag, message + " | " + throwable.getClass().getSimpleName() + ": " + throwable.getMessage());
    }

    public Path getDataRoot() {
        return dataRoot;
    }

    static Level parseLevel(String value) {
        if (value == null || value.isBlank()) {
            return Level.INFO;
        }
        try {
            return Level.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("⚠️ Unknown magpie.logging.level '{}', using INFO", value);
            return Level.INFO;
        }
    }
}
