package com.paxkun.magpie.exception;

/**
 * Failure of a single search attempt. The orchestrator retries these across
 * identities and only surfaces them wrapped in {@link ExhaustedRetriesException}.
 */
public abstract class SearchException extends MagpieException {

    protected SearchException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
