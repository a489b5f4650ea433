package com.paxkun.magpie.exception;

/**
 * The provider answered, but not with something usable: non-2xx status,
 * malformed JSON or an oversized body.
 */
public class ProviderException extends SearchException {

    public ProviderException(String message) {
        this(message, null);
    }

    public ProviderException(String message, Throwable cause) {
        super(ErrorCode.SEARCH_FAILED, message, cause);
    }

    protected ProviderException(ErrorCode errorCode, String message) {
        super(errorCode, message, null);
    }
}
