package com.paxkun.magpie.exception;

import lombok.Getter;

import java.util.List;

/**
 * Every search attempt failed. Classified by the last recorded cause, so a run that
 * ended on a timeout reports {@link ErrorCode#REQUEST_TIMEOUT} and one that ended on
 * an empty result set reports {@link ErrorCode#NO_IMAGES_FOUND}.
 */
@Getter
public class ExhaustedRetriesException extends MagpieException {

    private final int attempts;
    private final List<RuntimeException> causes;

    public ExhaustedRetriesException(int attempts, List<RuntimeException> causes) {
        super(classify(causes), buildMessage(attempts, causes), lastOf(causes));
        this.attempts = attempts;
        this.causes = List.copyOf(causes);
    }

    public RuntimeException getLastCause() {
        return lastOf(causes);
    }

    private static RuntimeException lastOf(List<RuntimeException> causes) {
        return causes.isEmpty() ? null : causes.get(causes.size() - 1);
    }

    private static ErrorCode classify(List<RuntimeException> causes) {
        RuntimeException last = lastOf(causes);
        if (last instanceof MagpieException) {
            return ((MagpieException) last).getErrorCode();
        }
        return ErrorCode.SEARCH_FAILED;
    }

    private static String buildMessage(int attempts, List<RuntimeException> causes) {
        RuntimeException last = lastOf(causes);
        String lastMessage = last == null ? "none" : last.getMessage();
        return "Image search failed after " + attempts + " attempts. Last error: " + lastMessage;
    }
}
