package com.paxkun.magpie.service;

import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;
import com.paxkun.magpie.exception.AllStorageFailedException;
import com.paxkun.magpie.exception.ErrorCode;
import com.paxkun.magpie.exception.ExhaustedRetriesException;
import com.paxkun.magpie.exception.InvalidInputException;
import com.paxkun.magpie.exception.MagpieException;
import com.paxkun.magpie.exception.NoCandidatesFoundException;
import com.paxkun.magpie.service.api.ImageLink;
import com.paxkun.magpie.service.api.SearchImagesRequest;
import com.paxkun.magpie.service.api.SearchImagesResponse;
import com.paxkun.magpie.service.pipeline.ImagePipeline;
import com.paxkun.magpie.service.pipeline.StoredImage;
import com.paxkun.magpie.service.search.SearchCandidate;
import com.paxkun.magpie.service.search.SearchOrchestrator;
import com.paxkun.magpie.util.LogSafe;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * ImageSearchService validates a request, finds candidates and re-hosts them.
 * <p>
 * Errors leave as {@link MagpieException} subclasses carrying the request keyword so the
 * controller advice can render them.
 *
 * Author: Pax
 */
@Service
@RequiredArgsConstructor
public class ImageSearchService {

    public static final int DEFAULT_COUNT = 3;
    public static final int MIN_COUNT = 1;
    public static final int MAX_COUNT = 10;
    public static final int MIN_KEYWORD_LENGTH = 2;

    private static final String TAG = "IMAGE_SEARCH";

    private final SearchOrchestrator searchOrchestrator;
    private final ImagePipeline imagePipeline;
    private final LoggerService logger;

    private Supplier<Long> currentTimeSupplier = System::currentTimeMillis;

    public SearchImagesResponse searchAndStore(SearchImagesRequest request) {
        return searchAndStore(keywordOf(request.getKeyword()), countOf(request.getCount()), request.getWatermarkText());
    }

    public SearchImagesResponse searchAndStore(String keyword, Integer count, String watermarkText) {
        long startedAt = currentTimeSupplier.get();
        String cleanKeyword = validateKeyword(keyword);
        int requested = validateCount(count);

        logger.info(TAG, "🔍 Searching " + requested + " images for keyword: " + LogSafe.clean(cleanKeyword)
                + (watermarkText != null && !watermarkText.isBlank() ? " | watermark=on" : ""));

        List<SearchCandidate> candidates;
        try {
            candidates = searchOrchestrator.searchImages(cleanKeyword, requested);
        } catch (ExhaustedRetriesException e) {
            if (e.getErrorCode() == ErrorCode.NO_IMAGES_FOUND) {
                logger.warn(TAG, "⚠️ No images found for keyword: " + LogSafe.clean(cleanKeyword));
                throw new NoCandidatesFoundException(cleanKeyword, e);
            }
            logger.error(TAG, "❌ Search failed for keyword: " + LogSafe.clean(cleanKeyword), e);
            throw new MagpieException(e.getErrorCode(), e.getMessage(), cleanKeyword, e);
        }
        long searchedAt = currentTimeSupplier.get();

        List<StoredImage> stored = imagePipeline.process(candidates, cleanKeyword, watermarkText);
        long finishedAt = currentTimeSupplier.get();

        if (stored.isEmpty()) {
            logger.warn(TAG, "⚠️ None of the " + candidates.size() + " images could be stored for keyword: "
                    + LogSafe.clean(cleanKeyword));
            throw new AllStorageFailedException(cleanKeyword, candidates.size());
        }

        logger.info(TAG, "✅ Stored " + stored.size() + "/" + candidates.size() + " images for keyword: "
                + LogSafe.clean(cleanKeyword) + " in " + (finishedAt - startedAt) + "ms");

        return SearchImagesResponse.builder()
                .success(true)
                .keyword(cleanKeyword)
                .requestedCount(requested)
                .foundCount(candidates.size())
                .storedCount(stored.size())
                .processingTimeMs(finishedAt - startedAt)
                .timings(new SearchImagesResponse.Timings(searchedAt - startedAt, finishedAt - searchedAt))
                .images(stored.stream()
                        .map(image -> new ImageLink(image.url(), image.title()))
                        .collect(Collectors.toList()))
                .timestamp(Instant.ofEpochMilli(finishedAt).toString())
                .build();
    }

    static String validateKeyword(String keyword) {
        if (keyword == null) {
            throw new InvalidInputException(ErrorCode.INVALID_KEYWORD, "Keyword is required and must be a string");
        }
        String trimmed = keyword.trim();
        if (trimmed.length() < MIN_KEYWORD_LENGTH) {
            throw new InvalidInputException(ErrorCode.KEYWORD_TOO_SHORT,
                    "Keyword must be at least " + MIN_KEYWORD_LENGTH + " characters long");
        }
        return trimmed;
    }

    static int validateCount(Integer count) {
        if (count == null) {
            return DEFAULT_COUNT;
        }
        if (count < MIN_COUNT || count > MAX_COUNT) {
            throw new InvalidInputException(ErrorCode.INVALID_COUNT,
                    "Count must be between " + MIN_COUNT + " and " + MAX_COUNT);
        }
        return count;
    }

    /**
     * @return the keyword when the JSON value is a string, otherwise null
     */
    static String keywordOf(JsonElement keyword) {
        if (keyword == null || !keyword.isJsonPrimitive() || !keyword.getAsJsonPrimitive().isString()) {
            return null;
        }
        return keyword.getAsString();
    }

    static Integer countOf(JsonElement count) {
        if (count == null || count.isJsonNull()) {
            return null;
        }
        if (count.isJsonPrimitive() && count.getAsJsonPrimitive().isNumber()) {
            JsonPrimitive primitive = count.getAsJsonPrimitive();
            try {
                return new BigDecimal(primitive.getAsString()).intValueExact();
            } catch (ArithmeticException | NumberFormatException e) {
                throw new InvalidInputException(ErrorCode.INVALID_COUNT, "Count must be a whole number");
            }
        }
        throw new InvalidInputException(ErrorCode.INVALID_COUNT, "Count must be a number");
    }

    void setCurrentTimeSupplier(Supplier<Long> currentTimeSupplier) {
        this.currentTimeSupplier = Objects.requireNonNull(currentTimeSupplier);
    }
}
