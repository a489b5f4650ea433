package com.paxkun.magpie.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Client-facing failure codes. The HTTP status travels with the code so the
 * controller advice never has to guess.
 */
@Getter
public enum ErrorCode {
    INVALID_REQUEST(HttpStatus.BAD_REQUEST),
    INVALID_KEYWORD(HttpStatus.BAD_REQUEST),
    KEYWORD_TOO_SHORT(HttpStatus.BAD_REQUEST),
    INVALID_COUNT(HttpStatus.BAD_REQUEST),
    NO_IMAGES_FOUND(HttpStatus.NOT_FOUND),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    REQUEST_TIMEOUT(HttpStatus.REQUEST_TIMEOUT),
    NETWORK_ERROR(HttpStatus.SERVICE_UNAVAILABLE),
    SEARCH_FAILED(HttpStatus.BAD_GATEWAY),
    DOWNLOAD_FAILED(HttpStatus.BAD_GATEWAY),
    DOWNLOAD_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT),
    TRANSFORM_FAILED(HttpStatus.INTERNAL_SERVER_ERROR),
    STORAGE_ERROR(HttpStatus.SERVICE_UNAVAILABLE),
    UPLOAD_FAILED(HttpStatus.INTERNAL_SERVER_ERROR),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }
}
