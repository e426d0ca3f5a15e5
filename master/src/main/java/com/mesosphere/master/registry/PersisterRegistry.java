package com.mesosphere.master.registry;

import com.mesosphere.master.config.JsonSerializer;
import com.mesosphere.master.config.Serializer;
import com.mesosphere.master.offer.LoggingUtils;
import com.mesosphere.master.storage.Persister;
import com.mesosphere.master.storage.PersisterException;
import com.mesosphere.master.storage.PersisterUtils;

import org.slf4j.Logger;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * A {@link Registry} which stores the whole {@link RegistrySnapshot} as a single JSON node in a {@link Persister}.
 * Each record is applied to a copy of the latest snapshot, which only replaces the latest snapshot once it has been
 * written.
 */
public class PersisterRegistry implements Registry {

    private static final Logger LOGGER = LoggingUtils.getLogger(PersisterRegistry.class);

    static final String SNAPSHOT_PATH = PersisterUtils.joinPaths("Registry", "Snapshot");

    private final Persister persister;
    private final Serializer serializer;
    private RegistrySnapshot latest = RegistrySnapshot.empty();

    public PersisterRegistry(Persister persister) {
        this(persister, new JsonSerializer());
    }

    PersisterRegistry(Persister persister, Serializer serializer) {
        this.persister = persister;
        this.serializer = serializer;
    }

    @Override
    public synchronized CompletableFuture<Boolean> apply(MutationRecord record) {
        RegistrySnapshot updated;
        try {
            updated = record.perform(latest);
        } catch (MutationRecord.PreconditionException e) {
            LOGGER.warn("Registry update does not apply: {}: {}", record, e.getMessage());
            return CompletableFuture.completedFuture(false);
        }
        try {
            persister.set(SNAPSHOT_PATH, serializer.serialize(updated));
        } catch (IOException e) {
            LOGGER.error(String.format("Failed to store registry update: %s", record), e);
            return CompletableFuture.completedFuture(false);
        }
        LOGGER.info("Stored registry update: {}", record);
        latest = updated;
        return CompletableFuture.completedFuture(true);
    }

    @Override
    public synchronized CompletableFuture<RegistrySnapshot> recover() {
        CompletableFuture<RegistrySnapshot> future = new CompletableFuture<>();
        try {
            byte[] bytes = PersisterUtils.getOrNull(persister, SNAPSHOT_PATH);
            latest = bytes == null ? RegistrySnapshot.empty() : serializer.deserialize(bytes, RegistrySnapshot.class);
            LOGGER.info("Recovered registry: {}", latest);
            future.complete(latest);
        } catch (PersisterException e) {
            LOGGER.error("Failed to read registry", e);
            future.completeExceptionally(e);
        } catch (IOException e) {
            LOGGER.error("Failed to parse registry", e);
            future.completeExceptionally(e);
        }
        return future;
    }
}
