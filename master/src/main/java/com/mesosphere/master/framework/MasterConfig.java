package com.mesosphere.master.framework;

import com.mesosphere.master.offer.Constants;

import java.util.Optional;

/**
 * Global master settings retrieved from the environment. Presented as a non-static object to simplify tests, and to
 * make it obvious when global settings are being used.
 */
public final class MasterConfig {

    /**
     * Envvar to specify the hostname reported by the master in its state summaries.
     */
    private static final String MASTER_HOSTNAME_ENV = "MASTER_HOSTNAME";

    private static final String DEFAULT_MASTER_HOSTNAME = "localhost";

    /**
     * Envvar to specify an optional human-readable cluster name.
     */
    private static final String CLUSTER_NAME_ENV = "CLUSTER_NAME";

    /**
     * Envvar to specify how many torn down frameworks are retained for reporting.
     */
    private static final String MAX_COMPLETED_FRAMEWORKS_ENV = "MAX_COMPLETED_FRAMEWORKS";

    private static final int DEFAULT_MAX_COMPLETED_FRAMEWORKS = 50;

    /**
     * Envvar to specify how many terminal tasks are retained per framework for reporting.
     */
    private static final String MAX_COMPLETED_TASKS_PER_FRAMEWORK_ENV = "MAX_COMPLETED_TASKS_PER_FRAMEWORK";

    private static final int DEFAULT_MAX_COMPLETED_TASKS_PER_FRAMEWORK = 1000;

    /**
     * Envvar to specify the refusal filter, in seconds, attached to resources recovered by rescinding offers.
     */
    private static final String OFFER_RESCIND_REFUSE_SECONDS_ENV = "OFFER_RESCIND_REFUSE_SECONDS";

    /**
     * Envvar to specify the page size of task listings when none is requested.
     */
    private static final String TASK_LIST_DEFAULT_LIMIT_ENV = "TASK_LIST_DEFAULT_LIMIT";

    private static final int DEFAULT_TASK_LIST_LIMIT = 100;

    /**
     * When this envvar is present, a detected lock cycle is only logged instead of exiting the process.
     */
    private static final String DISABLE_DEADLOCK_EXIT_ENV = "DISABLE_DEADLOCK_EXIT";

    private final EnvStore envStore;

    private MasterConfig(EnvStore envStore) {
        this.envStore = envStore;
    }

    /**
     * Returns a new {@link MasterConfig} instance which is based off the process environment.
     */
    public static MasterConfig fromEnv() {
        return fromEnvStore(EnvStore.fromEnv());
    }

    /**
     * Returns a new {@link MasterConfig} instance which is based off the provided env store.
     */
    public static MasterConfig fromEnvStore(EnvStore envStore) {
        return new MasterConfig(envStore);
    }

    public String getHostname() {
        return envStore.getOptionalNonEmpty(MASTER_HOSTNAME_ENV, DEFAULT_MASTER_HOSTNAME);
    }

    public Optional<String> getClusterName() {
        return Optional.ofNullable(envStore.getOptionalNonEmpty(CLUSTER_NAME_ENV, null));
    }

    public int getMaxCompletedFrameworks() {
        return getPositiveInt(MAX_COMPLETED_FRAMEWORKS_ENV, DEFAULT_MAX_COMPLETED_FRAMEWORKS);
    }

    public int getMaxCompletedTasksPerFramework() {
        return getPositiveInt(MAX_COMPLETED_TASKS_PER_FRAMEWORK_ENV, DEFAULT_MAX_COMPLETED_TASKS_PER_FRAMEWORK);
    }

    public double getOfferRescindRefuseSeconds() {
        double seconds = envStore.getOptionalDouble(OFFER_RESCIND_REFUSE_SECONDS_ENV, Constants.DEFAULT_REFUSE_SECONDS);
        if (seconds < 0) {
            throw new EnvStore.ConfigException(EnvStore.ConfigException.Type.INVALID_VALUE, String.format(
                    "Configured environment variable '%s' must not be negative: %s",
                    OFFER_RESCIND_REFUSE_SECONDS_ENV, seconds));
        }
        return seconds;
    }

    public int getTaskListDefaultLimit() {
        return getPositiveInt(TASK_LIST_DEFAULT_LIMIT_ENV, DEFAULT_TASK_LIST_LIMIT);
    }

    public boolean isDeadlockExitEnabled() {
        return !envStore.isPresent(DISABLE_DEADLOCK_EXIT_ENV);
    }

    private int getPositiveInt(String envKey, int defaultValue) {
        int value = envStore.getOptionalInt(envKey, defaultValue);
        if (value <= 0) {
            throw new EnvStore.ConfigException(EnvStore.ConfigException.Type.INVALID_VALUE, String.format(
                    "Configured environment variable '%s' must be positive: %d", envKey, value));
        }
        return value;
    }
}
