package com.paxkun.magpie.service.search;

/**
 * A discovered image reference awaiting acquisition.
 *
 * @param imageUrl  direct image URL to download
 * @param sourceUrl page the image was found on
 * @param title     provider title, {@code "Untitled"} when missing
 */
public record SearchCandidate(String imageUrl, String sourceUrl, String title) {
}
