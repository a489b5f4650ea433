package com.paxkun.magpie.service.storage;

import com.paxkun.magpie.config.MagpieProperties;
import com.paxkun.magpie.exception.StoreException;
import com.paxkun.magpie.service.LoggerService;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;

/**
 * Hourly sweep of the local upload directory. Disabled while
 * {@code magpie.storage.local.retention-hours} is 0. Registered only with local storage.
 */
@RequiredArgsConstructor
public class StorageRetentionJob {

    private static final String TAG = "RETENTION";

    private final LocalFileBlobSink blobSink;
    private final MagpieProperties properties;
    private final LoggerService logger;

    @Scheduled(fixedDelayString = "PT1H", initialDelayString = "PT5M")
    public void sweep() {
        int retentionHours = properties.getStorage().getLocal().getRetentionHours();
        if (retentionHours <= 0) {
            return;
        }
        try {
            int deleted = blobSink.cleanupOlderThan(Duration.ofHours(retentionHours));
            logger.info(TAG, "🧹 Removed " + deleted + " images older than " + retentionHours + "h");
        } catch (StoreException e) {
            logger.error(TAG, "❌ Retention sweep failed", e);
        }
    }
}
