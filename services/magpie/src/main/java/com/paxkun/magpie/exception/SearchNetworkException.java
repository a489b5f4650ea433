package com.paxkun.magpie.exception;

import lombok.Getter;

/**
 * Timeout, DNS or connect failure while talking to the provider.
 */
@Getter
public class SearchNetworkException extends SearchException {

    private final boolean timeout;

    public SearchNetworkException(String message, Throwable cause, boolean timeout) {
        super(timeout ? ErrorCode.REQUEST_TIMEOUT : ErrorCode.NETWORK_ERROR, message, cause);
        this.timeout = timeout;
    }
}
