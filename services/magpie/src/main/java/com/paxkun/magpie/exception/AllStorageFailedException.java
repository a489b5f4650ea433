package com.paxkun.magpie.exception;

/**
 * Candidates were found but not a single one made it into storage.
 */
public class AllStorageFailedException extends MagpieException {

    public AllStorageFailedException(String keyword, int candidateCount) {
        super(ErrorCode.UPLOAD_FAILED,
                "Failed to process any of the " + candidateCount + " images found",
                keyword,
                null);
    }
}
