package com.mesosphere.master.master;

/**
 * Container for types related to {@link MasterException}s.
 */
public class MasterError {

    private MasterError() {
        // do not instantiate
    }

    /**
     * Machine-parseable indicator of why a master request failed, with the HTTP status that the transport should
     * respond with.
     */
    public enum Reason {

        /**
         * The request was malformed, or asked for a transition which isn't legal from the current state.
         */
        VALIDATION(400),

        /**
         * The request referenced an agent, framework or machine which the master doesn't know about.
         */
        NOT_FOUND(404),

        /**
         * The registry rejected the change, or the allocator could not satisfy a resource operation.
         */
        CONFLICT(409),

        /**
         * The master has not recovered its state yet. The request may be retried.
         */
        UNAVAILABLE(503);

        private final int statusCode;

        Reason(int statusCode) {
            this.statusCode = statusCode;
        }

        public int getStatusCode() {
            return statusCode;
        }
    }
}
