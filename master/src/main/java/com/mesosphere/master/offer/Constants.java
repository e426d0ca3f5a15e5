package com.mesosphere.master.offer;

/**
 * This class encapsulates constants of relevance to the master's resource ledger.
 */
public class Constants {

    /** The name used for network port resources. */
    public static final String PORTS_RESOURCE_TYPE = "ports";
    /** The name used for storage/disk resources. */
    public static final String DISK_RESOURCE_TYPE = "disk";
    /** The name used for cpu resources. */
    public static final String CPUS_RESOURCE_TYPE = "cpus";
    /** The name used for memory resources. */
    public static final String MEMORY_RESOURCE_TYPE = "mem";
    /** The name used for gpu resources. */
    public static final String GPUS_RESOURCE_TYPE = "gpus";

    /** The "any role" wildcard resource role. */
    public static final String ANY_ROLE = "*";

    /**
     * Scalar resource values are compared at this many decimal places, so that e.g. 0.1 + 0.2 equals 0.3.
     */
    public static final int SCALAR_PRECISION_DIGITS = 3;

    /**
     * The refusal interval attached to resources recovered from rescinded offers when nothing else is configured.
     */
    public static final double DEFAULT_REFUSE_SECONDS = 5.0;

    private Constants() {
        // do not instantiate
    }
}
