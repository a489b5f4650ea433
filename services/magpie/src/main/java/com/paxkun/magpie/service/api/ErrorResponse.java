package com.paxkun.magpie.service.api;

import com.google.gson.annotations.SerializedName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON error body. {@code keyword} and {@code processingTimeMs} are left out when unknown.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    private boolean success;
    private String error;
    private String code;
    private String keyword;

    @SerializedName("processing_time_ms")
    private Long processingTimeMs;

    private String timestamp;
}
