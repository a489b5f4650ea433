package com.paxkun.magpie.exception;

/**
 * Decode, resize, watermark or encode failed. Never escapes the image processor,
 * which falls back to less processed bytes instead.
 */
public class TransformException extends MagpieException {

    public TransformException(String message) {
        this(message, null);
    }

    public TransformException(String message, Throwable cause) {
        super(ErrorCode.TRANSFORM_FAILED, message, cause);
    }
}
