package com.mesosphere.master.master;

import com.mesosphere.master.state.MasterState;

/**
 * A unit of work against the {@link MasterState}, run by the master's dispatcher while it holds the write lock.
 *
 * @param <T> the result of the work
 */
@FunctionalInterface
public interface StateMutation<T> {

    /**
     * Validates and/or modifies the state. A mutation which throws must not have modified the state.
     *
     * @throws MasterException if the request is rejected
     */
    T apply(MasterState state) throws MasterException;
}
