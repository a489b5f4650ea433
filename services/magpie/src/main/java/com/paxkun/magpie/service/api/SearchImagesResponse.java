package com.paxkun.magpie.service.api;

import com.google.gson.annotations.SerializedName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Successful search-and-store result. Partial success is still success: {@code storedCount}
 * may be lower than {@code foundCount}.
 *
 * Author: Pax
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchImagesResponse {

    private boolean success;
    private String keyword;

    @SerializedName("requested_count")
    private int requestedCount;

    @SerializedName("found_count")
    private int foundCount;

    @SerializedName("stored_count")
    private int storedCount;

    @SerializedName("processing_time_ms")
    private long processingTimeMs;

    private Timings timings;
    private List<ImageLink> images;
    private String timestamp;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Timings {
        @SerializedName("search_ms")
        private long searchMs;

        @SerializedName("pipeline_ms")
        private long pipelineMs;
    }
}
