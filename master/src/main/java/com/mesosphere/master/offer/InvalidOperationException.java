package com.mesosphere.master.offer;

/**
 * Exception thrown when a {@link ResourceOperation} cannot be applied to a set of {@link Resources}, either because
 * the operation is malformed or because the resources don't hold what the operation consumes.
 */
public class InvalidOperationException extends Exception {

    public InvalidOperationException(String message) {
        super(message);
    }
}
