package com.paxkun.magpie.exception;

public class NoCandidatesFoundException extends MagpieException {

    public NoCandidatesFoundException(String keyword, Throwable cause) {
        super(ErrorCode.NO_IMAGES_FOUND, "No images found for the given keyword", keyword, cause);
    }
}
