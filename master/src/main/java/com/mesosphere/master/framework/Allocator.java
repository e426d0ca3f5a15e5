package com.mesosphere.master.framework;

import com.mesosphere.master.maintenance.InverseOfferStatus;
import com.mesosphere.master.offer.ResourceOperation;
import com.mesosphere.master.offer.Resources;

import org.apache.mesos.Protos;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * The resource allocator which decides which agent resources are offered to which framework. The master only tells
 * the allocator about changes to the resources it tracks, and never holds the allocator's own accounting.
 *
 * <p>All arguments are immutable copies. Implementations must not call back into the master synchronously.
 */
public interface Allocator {

    /**
     * Adds a newly registered agent, whose total resources become available for allocation.
     *
     * @param unavailability the scheduled unavailability of the agent's machine, if it is draining
     */
    void addAgent(
            Protos.SlaveID agentId,
            Protos.SlaveInfo info,
            Resources total,
            Optional<Protos.Unavailability> unavailability);

    void addFramework(Protos.FrameworkID frameworkId, Protos.FrameworkInfo info);

    /**
     * Returns resources which had been offered to a framework to the allocator's available pool.
     *
     * @param filters if present, the allocator should not re-offer the resources to the framework until the filter
     *                expires
     */
    void recoverResources(
            Protos.FrameworkID frameworkId,
            Protos.SlaveID agentId,
            Resources resources,
            Optional<Protos.Filters> filters);

    /**
     * Returns the latest responses from frameworks to inverse offers, by agent and then by framework. Statuses may be
     * stale or absent after a master failover.
     */
    CompletableFuture<Map<Protos.SlaveID, Map<Protos.FrameworkID, InverseOfferStatus>>> getInverseOfferStatuses();

    /**
     * Applies a resource operation to the allocator's view of the agent's available resources. The returned future
     * fails if the available resources cannot satisfy the operation.
     */
    CompletableFuture<Void> apply(Protos.SlaveID agentId, ResourceOperation operation);

    /**
     * Informs the allocator of a change to the scheduled unavailability of an agent's machine.
     */
    void updateUnavailability(Protos.SlaveID agentId, Optional<Protos.Unavailability> unavailability);

    void removeAgent(Protos.SlaveID agentId);

    void removeFramework(Protos.FrameworkID frameworkId);
}
