package com.paxkun.magpie.exception;

/**
 * A candidate image could not be fetched: non-2xx, over the size cap, too small,
 * or a transport failure.
 */
public class DownloadException extends MagpieException {

    public DownloadException(String message) {
        this(message, null);
    }

    public DownloadException(String message, Throwable cause) {
        super(ErrorCode.DOWNLOAD_FAILED, message, cause);
    }

    protected DownloadException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
