package com.paxkun.magpie.service.pipeline;

import com.paxkun.magpie.config.MagpieProperties;
import com.paxkun.magpie.service.LoggerService;
import com.paxkun.magpie.service.search.SearchCandidate;
import com.paxkun.magpie.service.storage.BlobSink;
import com.paxkun.magpie.util.LogSafe;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs fetch, transform and store for every candidate at once and keeps whatever
 * succeeded. A failing candidate is logged and dropped; the batch itself never fails.
 * <p>
 * Results come back in completion order, not candidate order.
 *
 * Author: Pax
 */
@Service
public class ImagePipeline {

    private static final String TAG = "PIPELINE";
    static final Duration FORCED_SHUTDOWN_GRACE = Duration.ofMillis(200);

    private final ImageDownloader downloader;
    private final ImageProcessor processor;
    private final BlobSink blobSink;
    private final StorageKeyGenerator keyGenerator;
    private final LoggerService logger;
    private final Duration batchTimeout;

    @Autowired
    public ImagePipeline(ImageDownloader downloader,
                         ImageProcessor processor,
                         BlobSink blobSink,
                         StorageKeyGenerator keyGenerator,
                         LoggerService logger,
                         MagpieProperties properties) {
        this(downloader, processor, blobSink, keyGenerator, logger,
                properties.getDownload().getBatchTimeout());
    }

    public ImagePipeline(ImageDownloader downloader,
                         ImageProcessor processor,
                         BlobSink blobSink,
                         StorageKeyGenerator keyGenerator,
                         LoggerService logger,
                         Duration batchTimeout) {
        this.downloader = downloader;
        this.processor = processor;
        this.blobSink = blobSink;
        this.keyGenerator = keyGenerator;
        this.logger = logger;
        this.batchTimeout = batchTimeout;
    }

    public List<StoredImage> process(List<SearchCandidate> candidates, String keyword, String watermarkText) {
        List<StoredImage> stored = new ArrayList<>();
        if (candidates == null || candidates.isEmpty()) {
            return stored;
        }

        int total = candidates.size();
        logger.info(TAG, "📦 Processing " + total + " images for keyword: " + LogSafe.clean(keyword));

        try (AutoCloseableExecutor pool = new AutoCloseableExecutor(Executors.newFixedThreadPool(total), batchTimeout)) {
            CompletionService<FetchResult> completion = new ExecutorCompletionService<>(pool.executor());
            for (int i = 0; i < total; i++) {
                int position = i;
                SearchCandidate candidate = candidates.get(i);
                completion.submit(() -> fetchTransformStore(candidate, keyword, position, watermarkText));
            }

            long deadline = System.nanoTime() + batchTimeout.toNanos();
            for (int received = 0; received < total; received++) {
                long remaining = deadline - System.nanoTime();
                Future<FetchResult> next = remaining > 0 ? completion.poll(remaining, TimeUnit.NANOSECONDS) : null;
                if (next == null) {
                    logger.warn(TAG, "⏰ Batch timed out with " + (total - received) + " images still in flight");
                    pool.abort(FORCED_SHUTDOWN_GRACE);
                    break;
                }
                collect(next, stored);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn(TAG, "⚠️ Pipeline interrupted, returning " + stored.size() + " stored images");
        }

        logger.info(TAG, "✅ Stored " + stored.size() + " out of " + total + " images");
        return stored;
    }

    private void collect(Future<FetchResult> future, List<StoredImage> stored) throws InterruptedException {
        FetchResult result;
        try {
            result = future.get();
        } catch (ExecutionException e) {
            logger.error(TAG, "❌ Image task crashed", e.getCause() != null ? e.getCause() : e);
            return;
        }

        if (result instanceof FetchResult.Stored) {
            stored.add(((FetchResult.Stored) result).image());
        } else if (result instanceof FetchResult.Failed) {
            FetchResult.Failed failed = (FetchResult.Failed) result;
            logger.warn(TAG, "❌ Image " + (failed.position() + 1) + " dropped: " + failed.reason());
        }
    }

    /**
     * Full per-candidate flow. Converts every failure into {@link FetchResult.Failed}.
     */
    FetchResult fetchTransformStore(SearchCandidate candidate, String keyword, int position, String watermarkText) {
        try {
            logger.debug(TAG, "📥 Downloading image " + (position + 1) + ": " + candidate.imageUrl());
            byte[] original = downloader.fetch(candidate.imageUrl());

            ProcessedImage image = processor.process(original, watermarkText);
            String key = keyGenerator.generate(keyword, position, image.extension());
            String url = blobSink.put(key, image.bytes(), image.contentType());

            logger.info(TAG, "💾 Stored image " + (position + 1) + " (" + image.bytes().length + " bytes"
                    + (image.transformed() ? "" : ", original") + "): " + url);
            return new FetchResult.Stored(new StoredImage(url, candidate.title(), candidate.sourceUrl(), candidate.imageUrl()));
        } catch (RuntimeException e) {
            return new FetchResult.Failed(position, e.getMessage());
        }
    }
}
