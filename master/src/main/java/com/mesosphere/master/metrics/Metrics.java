package com.mesosphere.master.metrics;

import com.mesosphere.master.master.MasterError;

import com.codahale.metrics.MetricRegistry;

import java.util.Locale;

/**
 * This class encapsulates the components necessary for tracking master metrics.
 */
public final class Metrics {

    static final String RESCINDED_OFFERS = "offers.rescinded";

    static final String REMOVED_AGENTS = "agents.removed";

    static final String TORN_DOWN_FRAMEWORKS = "frameworks.torn_down";

    private static final String OPERATIONS_PREFIX = "operations.";

    private static final String MAINTENANCE_PREFIX = "maintenance.";

    private static final String REJECTED_REQUESTS_PREFIX = "requests.";

    private static final MetricRegistry METRICS = new MetricRegistry();

    private Metrics() {}

    public static MetricRegistry getRegistry() {
        return METRICS;
    }

    public static void incrementRescindedOffers() {
        METRICS.counter(RESCINDED_OFFERS).inc();
    }

    public static void incrementRemovedAgents() {
        METRICS.counter(REMOVED_AGENTS).inc();
    }

    public static void incrementTornDownFrameworks() {
        METRICS.counter(TORN_DOWN_FRAMEWORKS).inc();
    }

    /**
     * Counts a resource operation which was applied, e.g. {@code operations.reserve}.
     */
    public static void incrementOperation(String operationName) {
        METRICS.counter(OPERATIONS_PREFIX + operationName).inc();
    }

    /**
     * Counts a maintenance transition, e.g. {@code maintenance.down}.
     */
    public static void incrementMaintenance(String transition) {
        METRICS.counter(MAINTENANCE_PREFIX + transition).inc();
    }

    /**
     * Counts a request which was rejected, by reason, e.g. {@code requests.conflict}.
     */
    public static void incrementRejectedRequests(MasterError.Reason reason) {
        METRICS.counter(REJECTED_REQUESTS_PREFIX + reason.name().toLowerCase(Locale.ROOT)).inc();
    }
}
