package com.paxkun.magpie.service.api;

import com.google.gson.JsonElement;
import com.google.gson.annotations.SerializedName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /api/search-images}.
 * <p>
 * {@code keyword} and {@code count} are kept as raw JSON so a number where a string
 * belongs (or the reverse) is reported as a validation error instead of being coerced.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SearchImagesRequest {

    private JsonElement keyword;

    private JsonElement count;

    @SerializedName("watermark_text")
    private String watermarkText;
}
