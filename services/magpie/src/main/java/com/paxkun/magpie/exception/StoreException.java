package com.paxkun.magpie.exception;

/**
 * A blob sink rejected a write.
 */
public class StoreException extends MagpieException {

    public StoreException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_ERROR, message, cause);
    }
}
