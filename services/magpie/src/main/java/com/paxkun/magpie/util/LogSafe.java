package com.paxkun.magpie.util;

/**
 * Makes caller-supplied text safe to put on a single log line.
 */
public final class LogSafe {

    private static final int MAX_LENGTH = 100;

    private LogSafe() {
    }

    public static String clean(String value) {
        if (value == null) {
            return "null";
        }
        String flattened = value.replaceAll("\\p{Cntrl}", " ");
        return flattened.length() > MAX_LENGTH ? flattened.substring(0, MAX_LENGTH) + "…" : flattened;
    }
}
