package com.mesosphere.master.registry;

import java.util.concurrent.CompletableFuture;

/**
 * Durable storage for the master's {@link MutationRecord}s. The master only applies a change in memory once the
 * registry has acknowledged it.
 */
public interface Registry {

    /**
     * Durably applies the provided change. The returned future completes with {@code true} only if the change was
     * stored; any other outcome means the change must not be applied.
     */
    CompletableFuture<Boolean> apply(MutationRecord record);

    /**
     * Returns the latest stored state, or an empty snapshot if nothing was stored yet.
     */
    CompletableFuture<RegistrySnapshot> recover();
}
