package com.paxkun.magpie.exception;

import lombok.Getter;

/**
 * Root of Magpie's unchecked exception hierarchy.
 *
 * Author: Pax
 */
@Getter
public class MagpieException extends RuntimeException {

    private final ErrorCode errorCode;

    /** Keyword of the request that failed, when it is known at the throw site. */
    private final String keyword;

    public MagpieException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    public MagpieException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, cause);
    }

    public MagpieException(ErrorCode errorCode, String message, String keyword, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.keyword = keyword;
    }
}
