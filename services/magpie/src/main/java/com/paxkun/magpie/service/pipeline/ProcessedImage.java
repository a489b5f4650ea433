package com.paxkun.magpie.service.pipeline;

/**
 * Bytes ready for storage. {@code transformed} is false when the original download
 * is being stored as-is.
 */
public record ProcessedImage(byte[] bytes, String contentType, String extension, boolean transformed) {
}
