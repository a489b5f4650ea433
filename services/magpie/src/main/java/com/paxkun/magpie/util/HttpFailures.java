package com.paxkun.magpie.util;

import io.netty.channel.ConnectTimeoutException;
import reactor.core.Exceptions;

import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;

/**
 * Helpers for classifying what comes out of a blocking WebClient call.
 */
public final class HttpFailures {

    private HttpFailures() {
    }

    /**
     * Strips Reactor's checked-exception wrapper, if any.
     */
    public static Throwable unwrap(Throwable throwable) {
        return Exceptions.unwrap(throwable);
    }

    /**
     * True when any link of the cause chain is a read, response or connect timeout.
     */
    public static boolean isTimeout(Throwable throwable) {
        Throwable current = unwrap(throwable);
        while (current != null) {
            if (current instanceof TimeoutException
                    || current instanceof io.netty.handler.timeout.TimeoutException
                    || current instanceof ConnectTimeoutException
                    || current instanceof SocketTimeoutException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    public static <T extends Throwable> boolean hasCause(Throwable throwable, Class<T> type) {
        Throwable current = unwrap(throwable);
        while (current != null) {
            if (type.isInstance(current)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Message of the innermost cause, which is usually the one worth logging.
     */
    public static String rootMessage(Throwable throwable) {
        Throwable current = unwrap(throwable);
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        String message = current.getMessage();
        return message != null ? message : current.getClass().getSimpleName();
    }
}
