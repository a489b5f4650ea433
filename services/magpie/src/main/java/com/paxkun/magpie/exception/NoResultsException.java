package com.paxkun.magpie.exception;

/**
 * The provider returned zero results, or none survived filtering.
 */
public class NoResultsException extends ProviderException {

    public NoResultsException(String message) {
        super(ErrorCode.NO_IMAGES_FOUND, message);
    }
}
