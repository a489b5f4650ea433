package com.paxkun.magpie.service.pipeline;

/**
 * One image that made it into storage.
 *
 * @param url         public URL returned by the blob sink
 * @param sourceUrl   page the image was found on
 * @param originalUrl where the bytes were downloaded from
 */
public record StoredImage(String url, String title, String sourceUrl, String originalUrl) {
}
