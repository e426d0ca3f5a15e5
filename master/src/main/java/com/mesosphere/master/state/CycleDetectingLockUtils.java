package com.mesosphere.master.state;

import com.google.common.util.concurrent.CycleDetectingLockFactory;
import com.mesosphere.master.framework.MasterConfig;
import com.mesosphere.master.framework.ProcessExit;

import java.util.concurrent.locks.ReadWriteLock;

/**
 * Construction of read/write locks which log and kill the process if a lock ordering cycle is detected.
 */
public final class CycleDetectingLockUtils {

    /**
     * Logs the error and exits. The process is expected to be restarted in a fresh state.
     */
    private static final CycleDetectingLockFactory.Policy LOG_AND_EXIT_POLICY =
            e -> ProcessExit.exit(ProcessExit.DEADLOCK_ENCOUNTERED, e);

    private CycleDetectingLockUtils() {
        // do not instantiate
    }

    /**
     * Returns a new lock labeled after {@code parentClass}, exiting on deadlock unless disabled in the config.
     */
    public static ReadWriteLock newLock(MasterConfig masterConfig, Class<?> parentClass) {
        return newLock(masterConfig.isDeadlockExitEnabled(), parentClass);
    }

    /**
     * Returns a new lock labeled after {@code parentClass}.
     *
     * @param exitOnDeadlock whether to exit the process if a deadlock is detected, or only log a warning
     */
    public static ReadWriteLock newLock(boolean exitOnDeadlock, Class<?> parentClass) {
        return CycleDetectingLockFactory
                .newInstance(exitOnDeadlock ? LOG_AND_EXIT_POLICY : CycleDetectingLockFactory.Policies.WARN)
                .newReentrantReadWriteLock(parentClass.getSimpleName());
    }
}
