package com.paxkun.magpie.exception;

/**
 * The search page came back without a session token.
 */
public class SessionTokenException extends SearchException {

    public SessionTokenException(String message) {
        super(ErrorCode.SEARCH_FAILED, message, null);
    }
}
