package com.paxkun.magpie.service.pipeline;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Locale;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Builds object keys of the form {@code sunset/1718000000000_1a2b3c4d_1.jpg}:
 * sanitized keyword folder, then timestamp, random id and 1-based position.
 */
@Component
public class StorageKeyGenerator {

    static final String FALLBACK_FOLDER = "untitled";

    private final Clock clock;
    private final Supplier<UUID> ids;

    public StorageKeyGenerator() {
        this(Clock.systemUTC(), UUID::randomUUID);
    }

    StorageKeyGenerator(Clock clock, Supplier<UUID> ids) {
        this.clock = clock;
        this.ids = ids;
    }

    public String generate(String keyword, int index, String extension) {
        String randomId = ids.get().toString().replace("-", "").substring(0, 8);
        return sanitizeKeyword(keyword) + "/" + clock.millis() + "_" + randomId + "_" + (index + 1) + "." + extension;
    }

    static String sanitizeKeyword(String keyword) {
        if (keyword == null) {
            return FALLBACK_FOLDER;
        }
        String folder = keyword.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
        return folder.isEmpty() ? FALLBACK_FOLDER : folder;
    }
}
