package com.paxkun.magpie.service.search;

import com.paxkun.magpie.config.MagpieProperties;
import com.paxkun.magpie.exception.ExhaustedRetriesException;
import com.paxkun.magpie.exception.NoResultsException;
import com.paxkun.magpie.exception.SearchNetworkException;
import com.paxkun.magpie.service.LoggerService;
import com.paxkun.magpie.util.LogSafe;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Drives the session client and the result filter across strictly sequential
 * attempts, rotating identity on every attempt and backing off between failures.
 *
 * Author: Pax
 */
@Service
public class SearchOrchestrator {

    private static final String TAG = "SEARCH";

    private final SearchSessionClient sessionClient;
    private final ResultFilter resultFilter;
    private final IdentityRotator identityRotator;
    private final BackoffPolicy backoffPolicy;
    private final LoggerService logger;
    private final int configuredMaxAttempts;

    private Sleeper sleeper = Sleeper.threadSleep();

    @Autowired
    public SearchOrchestrator(SearchSessionClient sessionClient,
                              ResultFilter resultFilter,
                              IdentityRotator identityRotator,
                              BackoffPolicy backoffPolicy,
                              LoggerService logger,
                              MagpieProperties properties) {
        this(sessionClient, resultFilter, identityRotator, backoffPolicy, logger,
                properties.getSearch().getMaxAttempts());
    }

    public SearchOrchestrator(SearchSessionClient sessionClient,
                              ResultFilter resultFilter,
                              IdentityRotator identityRotator,
                              BackoffPolicy backoffPolicy,
                              LoggerService logger,
                              int configuredMaxAttempts) {
        this.sessionClient = sessionClient;
        this.resultFilter = resultFilter;
        this.identityRotator = identityRotator;
        this.backoffPolicy = backoffPolicy;
        this.logger = logger;
        this.configuredMaxAttempts = configuredMaxAttempts;
    }

    /**
     * One attempt per proxy, capped by configuration; a single attempt when no proxies exist.
     */
    public int maxAttempts() {
        return Math.max(1, Math.min(configuredMaxAttempts, Math.max(identityRotator.proxyCount(), 1)));
    }

    /**
     * @return between 1 and {@code count} candidates, in provider order
     * @throws ExhaustedRetriesException when no attempt produced a usable candidate
     */
    public List<SearchCandidate> searchImages(String keyword, int count) {
        SearchAttempts attempts = new SearchAttempts(maxAttempts());

        while (attempts.hasRemaining()) {
            int attempt = attempts.begin();
            Identity identity = identityRotator.next();
            logger.info(TAG, "🔍 Search attempt " + (attempt + 1) + "/" + attempts.maxAttempts()
                    + " for keyword: " + LogSafe.clean(keyword) + " | proxy=" + identity.describeProxy());

            try {
                List<RawImageResult> raw = sessionClient.search(keyword, identity);
                List<SearchCandidate> candidates = resultFilter.filter(raw, count);
                if (!candidates.isEmpty()) {
                    logger.info(TAG, "✅ Found " + candidates.size() + " valid images on attempt " + (attempt + 1));
                    return candidates;
                }
                attempts.fail(new NoResultsException("No valid images after filtering " + raw.size() + " results"));
                logger.warn(TAG, "⚠️ Attempt " + (attempt + 1) + " returned no usable images");
            } catch (RuntimeException e) {
                attempts.fail(e);
                logger.warn(TAG, "❌ Search attempt " + (attempt + 1) + " failed: " + e.getMessage());
            }

            if (attempts.hasRemaining()) {
                Duration delay = backoffPolicy.delayAfter(attempt, attempts.lastDelay());
                attempts.recordDelay(delay);
                logger.info(TAG, "⏳ Waiting " + delay.toMillis() + "ms before next attempt...");
                pause(delay, attempts);
            }
        }

        ExhaustedRetriesException exhausted = attempts.exhausted();
        logger.warn(TAG, "🛑 " + exhausted.getMessage());
        throw exhausted;
    }

    private void pause(Duration delay, SearchAttempts attempts) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            attempts.fail(new SearchNetworkException("Interrupted during search backoff", e, false));
            throw attempts.exhausted();
        }
    }

    void setSleeper(Sleeper sleeper) {
        this.sleeper = sleeper;
    }
}
