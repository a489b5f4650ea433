package com.paxkun.magpie.exception;

/**
 * Bad keyword or count. The caller's fault; never retried.
 */
public class InvalidInputException extends MagpieException {

    public InvalidInputException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
