package com.mesosphere.master.storage;

import com.mesosphere.master.storage.StorageError.Reason;

import java.io.IOException;

/**
 * Exception that indicates that there was an issue with storing or accessing values in the persister.
 */
public class PersisterException extends IOException {

    private final Reason reason;

    public PersisterException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public PersisterException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
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
