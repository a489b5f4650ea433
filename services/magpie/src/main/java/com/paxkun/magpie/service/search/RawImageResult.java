package com.paxkun.magpie.service.search;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One unfiltered entry of the provider's image results payload.
 *
 * Author: Pax
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RawImageResult {

    /** Full-size image URL. */
    private String image;

    /** Page the image was found on. */
    private String url;

    private String title;

    private String thumbnail;

    private Integer width;

    private Integer height;

    /** Upstream index the provider took the result from. */
    private String source;

    public static RawImageResult of(String image, String url, String title) {
        return new RawImageResult(image, url, title, null, null, null, null);
    }
}
