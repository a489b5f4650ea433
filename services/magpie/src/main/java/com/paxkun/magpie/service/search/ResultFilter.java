package com.paxkun.magpie.service.search;

import com.paxkun.magpie.config.MagpieProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns raw provider results into download candidates. Pure: no I/O, no state
 * beyond the configured exclusion markers.
 * <p>
 * The "looks like an image" check is deliberately loose. CDN URLs often carry no
 * extension, so a keyword hit in the URL is enough.
 */
@Slf4j
@Component
public class ResultFilter {

    private static final List<String> IMAGE_EXTENSIONS = List.of(".jpg", ".jpeg", ".png", ".gif", ".webp", ".bmp", ".svg");
    private static final List<String> IMAGE_KEYWORDS = List.of("image", "photo", "pic");
    private static final int MIN_URL_LENGTH = 10;
    private static final String UNTITLED = "Untitled";

    private final List<String> excludedMarkers;

    @Autowired
    public ResultFilter(MagpieProperties properties) {
        this(properties.getSearch().getExcludedDomains());
    }

    public ResultFilter(List<String> excludedMarkers) {
        this.excludedMarkers = excludedMarkers.stream()
                .filter(marker -> marker != null && !marker.isBlank())
                .map(marker -> marker.trim().toLowerCase(Locale.ROOT))
                .toList();
    }

    public List<SearchCandidate> filter(List<RawImageResult> results, int limit) {
        List<SearchCandidate> candidates = new ArrayList<>();
        if (results == null || limit <= 0) {
            return candidates;
        }

        for (RawImageResult result : results) {
            if (candidates.size() >= limit) {
                break;
            }
            if (result == null) {
                continue;
            }

            String imageUrl = result.getImage();
            String sourceUrl = result.getUrl();
            if (imageUrl == null || imageUrl.isBlank()) {
                continue;
            }
            if (isExcluded(imageUrl) || isExcluded(sourceUrl)) {
                log.debug("Skipping excluded source image: {}", imageUrl);
                continue;
            }
            if (!looksLikeImageUrl(imageUrl)) {
                log.debug("Skipping non-image URL: {}", imageUrl);
                continue;
            }

            String title = result.getTitle() == null || result.getTitle().isBlank() ? UNTITLED : result.getTitle();
            candidates.add(new SearchCandidate(imageUrl, sourceUrl, title));
        }
        return candidates;
    }

    boolean isExcluded(String url) {
        if (url == null) {
            return false;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        return excludedMarkers.stream().anyMatch(lower::contains);
    }

    static boolean looksLikeImageUrl(String url) {
        if (url == null || url.length() <= MIN_URL_LENGTH) {
            return false;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            return false;
        }
        boolean hasExtension = IMAGE_EXTENSIONS.stream().anyMatch(lower::contains);
        boolean hasKeyword = IMAGE_KEYWORDS.stream().anyMatch(url::contains);
        return hasExtension || hasKeyword;
    }
}
