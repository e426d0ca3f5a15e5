package com.mesosphere.master.master;

import com.mesosphere.master.master.MasterError.Reason;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Exception that indicates that a request to the master was rejected. The {@link Reason} tells callers whether the
 * request was bad, stale, conflicting, or should be retried elsewhere.
 */
public class MasterException extends Exception {

    private final Reason reason;

    public MasterException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public MasterException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public static MasterException validation(String format, Object... args) {
        return new MasterException(Reason.VALIDATION, String.format(format, args));
    }

    public static MasterException notFound(String format, Object... args) {
        return new MasterException(Reason.NOT_FOUND, String.format(format, args));
    }

    public static MasterException conflict(String format, Object... args) {
        return new MasterException(Reason.CONFLICT, String.format(format, args));
    }

    /**
     * Returns the {@link MasterException} at the root of a failed future, looking through the wrappers which
     * {@link java.util.concurrent.CompletableFuture} adds, or {@code null} if the failure had some other cause.
     */
    public static MasterException unwrap(Throwable t) {
        Throwable cause = t;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause instanceof MasterException ? (MasterException) cause : null;
    }

    /**
     * Returns the machine-parseable reason for this exception.
     */
    public Reason getReason() {
        return reason;
    }

    @Override
    public String getMessage() {
        return String.format("%s (reason: %s)", super.getMessage(), reason);
    }
}
