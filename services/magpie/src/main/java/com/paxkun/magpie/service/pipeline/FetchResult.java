package com.paxkun.magpie.service.pipeline;

/**
 * Outcome of one candidate's fetch, transform and store run.
 */
public interface FetchResult {

    record Stored(StoredImage image) implements FetchResult {
    }

    record Failed(int position, String reason) implements FetchResult {
    }
}
