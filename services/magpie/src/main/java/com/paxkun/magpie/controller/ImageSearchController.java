package com.paxkun.magpie.controller;

import com.paxkun.magpie.service.ImageSearchService;
import com.paxkun.magpie.service.LoggerService;
import com.paxkun.magpie.service.api.SearchImagesRequest;
import com.paxkun.magpie.service.api.SearchImagesResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ImageSearchController exposes the search-and-store endpoint plus health and docs.
 *
 * Author: Pax
 */
@RestController
@RequiredArgsConstructor
public class ImageSearchController {

    static final String STARTED_AT_ATTRIBUTE = ImageSearchController.class.getName() + ".startedAt";
    private static final String SERVICE_NAME = "magpie";

    private final ImageSearchService imageSearchService;
    private final LoggerService logger;

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "OK");
        body.put("timestamp", Instant.now().toString());
        body.put("service", SERVICE_NAME);
        return ResponseEntity.ok(body);
    }

    /**
     * Searches for images matching a keyword and re-hosts them.
     *
     * @param request keyword, optional count (1-10, default 3) and optional watermark text
     * @return public URLs of the stored images with counts and timings
     */
    @PostMapping("/api/search-images")
    public ResponseEntity<SearchImagesResponse> searchImages(@RequestBody SearchImagesRequest request,
                                                             HttpServletRequest servletRequest) {
        servletRequest.setAttribute(STARTED_AT_ATTRIBUTE, System.currentTimeMillis());
        logger.debug("IMAGE_CONTROLLER", "Search request received");
        SearchImagesResponse response = imageSearchService.searchAndStore(request);
        logger.debug("IMAGE_CONTROLLER", "Search response | stored=" + response.getStoredCount()
                + " | found=" + response.getFoundCount());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/api/docs")
    public ResponseEntity<Map<String, Object>> docs() {
        Map<String, Object> search = new LinkedHashMap<>();
        search.put("method", "POST");
        search.put("path", "/api/search-images");
        search.put("description", "Search images for a keyword, re-encode them and return hosted URLs");
        search.put("body", Map.of(
                "keyword", "string, required, at least 2 characters",
                "count", "integer 1-10, optional, default 3",
                "watermark_text", "string, optional"));

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("method", "GET");
        health.put("path", "/health");
        health.put("description", "Service health check");

        Map<String, Object> images = new LinkedHashMap<>();
        images.put("method", "GET");
        images.put("path", "/images/{keyword}/{file}");
        images.put("description", "Locally stored images");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", SERVICE_NAME);
        body.put("endpoints", List.of(search, health, images));
        return ResponseEntity.ok(body);
    }
}
