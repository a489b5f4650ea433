package com.paxkun.magpie.service.search;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Decoded body of the provider's JSON results endpoint.
 */
@Data
@NoArgsConstructor
public class ImageResultsPage {

    private List<RawImageResult> results;

    /** Relative URL of the next page; Magpie only ever reads the first. */
    private String next;
}
