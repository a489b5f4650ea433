package com.paxkun.magpie.exception;

public class DownloadTimeoutException extends DownloadException {

    public DownloadTimeoutException(String message, Throwable cause) {
        super(ErrorCode.DOWNLOAD_TIMEOUT, message, cause);
    }
}
