package com.mesosphere.master.offer;

import com.mesosphere.master.master.Master;
import com.mesosphere.master.master.MasterError;
import com.mesosphere.master.master.MasterException;
import com.mesosphere.master.metrics.Metrics;
import com.mesosphere.master.registry.MutationRecord;
import com.mesosphere.master.state.Agent;

import org.apache.mesos.Protos;
import org.slf4j.Logger;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Operator requests to reserve, unreserve, create volumes on, and destroy volumes on an agent's resources.
 *
 * <p>Each request is validated against the agent, then enough of the agent's outstanding offers are rescinded to
 * cover the resources it needs (see {@link OfferRescinder#reconcile}). The operation is then applied by the allocator,
 * committed to the registry, and finally applied to the agent's total and checkpointed resources in memory, after
 * which the agent is sent its new checkpointed resources. The request is validated again right before the commit,
 * since other requests for the same agent may have been applied while the allocator was working.
 */
public class ResourceOperations {

    private static final Logger LOGGER = LoggingUtils.getLogger(ResourceOperations.class);

    private final Master master;

    public ResourceOperations(Master master) {
        this.master = master;
    }

    /**
     * Dynamically reserves resources on an agent. Every resource must carry a dynamic reservation for a role other
     * than {@code *}, with a principal. If the requesting principal is known, it must match the principal of every
     * reservation.
     */
    public CompletableFuture<Void> reserve(Protos.SlaveID agentId, Resources resources, Optional<String> principal) {
        ResourceOperation operation = ResourceOperation.reserve(resources);
        return run(agentId, operation, agent -> {
            checkNotEmpty(operation, resources);
            for (Protos.Resource resource : resources) {
                if (!ResourceUtils.isDynamicallyReserved(resource)) {
                    throw invalid(operation, "Resource %s is not dynamically reserved", Resources.of(resource));
                }
                if (!ResourceUtils.isReserved(resource)) {
                    throw invalid(operation, "Role \"%s\" cannot be dynamically reserved", Constants.ANY_ROLE);
                }
                Optional<String> reservationPrincipal = ResourceUtils.getPrincipal(resource);
                if (!reservationPrincipal.isPresent()) {
                    throw invalid(operation, "A dynamic reservation requires a principal");
                }
                if (principal.isPresent() && !principal.get().equals(reservationPrincipal.get())) {
                    throw invalid(operation,
                            "A reserve operation was attempted by principal '%s', but there is a reserved resource "
                                    + "in the request with principal '%s' set in its reservation",
                            principal.get(), reservationPrincipal.get());
                }
            }
        });
    }

    /**
     * Releases dynamic reservations on an agent. Persistent volumes must be destroyed before their reservation can be
     * released.
     */
    public CompletableFuture<Void> unreserve(Protos.SlaveID agentId, Resources resources) {
        ResourceOperation operation = ResourceOperation.unreserve(resources);
        return run(agentId, operation, agent -> {
            checkNotEmpty(operation, resources);
            for (Protos.Resource resource : resources) {
                if (!ResourceUtils.isDynamicallyReserved(resource)) {
                    throw invalid(operation, "Resource %s is not dynamically reserved", Resources.of(resource));
                }
                if (ResourceUtils.isPersistentVolume(resource)) {
                    throw invalid(operation,
                            "A dynamically reserved persistent volume %s cannot be unreserved", Resources.of(resource));
                }
            }
        });
    }

    /**
     * Creates persistent volumes on reserved disk of an agent. Persistence ids must be unique within the request and
     * must not be in use by a volume already on the agent.
     */
    public CompletableFuture<Void> createVolumes(Protos.SlaveID agentId, Resources volumes) {
        ResourceOperation operation = ResourceOperation.create(volumes);
        return run(agentId, operation, agent -> {
            checkNotEmpty(operation, volumes);
            Set<String> existing = new HashSet<>(
                    ResourceUtils.getPersistenceIds(agent.getCheckpointedResources().toList()));
            Set<String> requested = new HashSet<>();
            for (Protos.Resource volume : volumes) {
                Optional<String> persistenceId = ResourceUtils.getPersistenceId(volume);
                if (!persistenceId.isPresent()) {
                    throw invalid(operation, "Resource %s is not a persistent volume", Resources.of(volume));
                }
                if (!ResourceUtils.isReserved(volume)) {
                    throw invalid(operation, "Persistent volumes cannot be created from unreserved resources");
                }
                if (!requested.add(persistenceId.get())) {
                    throw invalid(operation, "Persistence ID '%s' is not unique", persistenceId.get());
                }
                if (existing.contains(persistenceId.get())) {
                    throw invalid(operation, "Persistence ID '%s' already exists", persistenceId.get());
                }
            }
        });
    }

    /**
     * Destroys persistent volumes on an agent. Every volume must currently exist on the agent.
     */
    public CompletableFuture<Void> destroyVolumes(Protos.SlaveID agentId, Resources volumes) {
        ResourceOperation operation = ResourceOperation.destroy(volumes);
        return run(agentId, operation, agent -> {
            checkNotEmpty(operation, volumes);
            for (Protos.Resource volume : volumes) {
                if (!ResourceUtils.isPersistentVolume(volume)) {
                    throw invalid(operation, "Resource %s is not a persistent volume", Resources.of(volume));
                }
            }
            if (!agent.getCheckpointedResources().persistentVolumes().contains(volumes)) {
                throw invalid(operation, "Persistent volumes not found");
            }
        });
    }

    /**
     * Rescinds just enough of the agent's offers to cover {@code required}, then applies the operation to the agent.
     *
     * @return a future which fails with {@link MasterError.Reason#NOT_FOUND} for an unknown agent, or with
     *         {@link MasterError.Reason#CONFLICT} if the allocator or the registry did not accept the operation
     */
    public CompletableFuture<Void> reconcile(
            Protos.SlaveID agentId, Resources required, ResourceOperation operation) {
        return reconcile(agentId, required, operation, agent -> { });
    }

    private CompletableFuture<Void> reconcile(
            Protos.SlaveID agentId, Resources required, ResourceOperation operation, AgentValidator validator) {
        return master.mutate(state -> {
            Agent agent = Master.getAgent(state, agentId);
            master.getRescinder().reconcile(state, agent, required, operation,
                    OfferRescinder.refuseFor(master.getConfig().getOfferRescindRefuseSeconds()));
            return null;
        }).thenCompose(v -> apply(agentId, operation, validator));
    }

    private CompletableFuture<Void> run(
            Protos.SlaveID agentId, ResourceOperation operation, AgentValidator validator) {
        return master.mutate(state -> {
            validator.validate(Master.getAgent(state, agentId));
            return null;
        }).thenCompose(v -> reconcile(agentId, operation.getRequiredResources(), operation, validator));
    }

    private CompletableFuture<Void> apply(
            Protos.SlaveID agentId, ResourceOperation operation, AgentValidator validator) {
        CompletableFuture<Void> allocated = master.getAllocator().apply(agentId, operation).handle((v, e) -> {
            if (e != null) {
                LOGGER.warn("Allocator failed to apply {} on agent {}: {}",
                        operation, agentId.getValue(), e.getMessage());
                Metrics.incrementRejectedRequests(MasterError.Reason.CONFLICT);
                throw new CompletionException(MasterException.conflict(
                        "Failed to apply %s: %s", operation.getName(), rootMessage(e)));
            }
            return null;
        });
        return allocated.thenCompose(v -> master.commit(
                state -> {
                    Agent agent = Master.getAgent(state, agentId);
                    try {
                        validator.validate(agent);
                    } catch (MasterException e) {
                        throw MasterException.conflict(
                                "Failed to apply %s: %s", operation.getName(), e.getMessage());
                    }
                    return new MutationRecord.ApplyOperation(
                            agentId, operation, checkpointed(applyTo(operation, agent.getTotalResources())));
                },
                state -> {
                    Agent agent = Master.getAgent(state, agentId);
                    Resources total = applyTo(operation, agent.getTotalResources());
                    agent.setTotalResources(total);
                    agent.setCheckpointedResources(checkpointed(total));
                    master.getMessenger().checkpointResources(agentId, agent.getCheckpointedResources());
                    Metrics.incrementOperation(operation.getName());
                    LOGGER.info("Applied {} on agent {}", operation, agentId.getValue());
                    return null;
                }));
    }

    private static Resources applyTo(ResourceOperation operation, Resources total) throws MasterException {
        try {
            return operation.apply(total);
        } catch (InvalidOperationException e) {
            throw MasterException.conflict("Failed to apply %s: %s", operation.getName(), e.getMessage());
        }
    }

    /**
     * Returns the resources an agent must keep across restarts: dynamic reservations and persistent volumes.
     */
    private static Resources checkpointed(Resources total) {
        return total.filter(r -> ResourceUtils.isDynamicallyReserved(r) || ResourceUtils.isPersistentVolume(r));
    }

    private static void checkNotEmpty(ResourceOperation operation, Resources resources) throws MasterException {
        if (resources.isEmpty()) {
            throw invalid(operation, "No resources were provided");
        }
    }

    private static MasterException invalid(ResourceOperation operation, String format, Object... args) {
        return MasterException.validation("Invalid %s operation: %s",
                operation.getType(), String.format(format, args));
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }

    /**
     * Checks a request against the agent it targets.
     */
    @FunctionalInterface
    private interface AgentValidator {
        void validate(Agent agent) throws MasterException;
    }
}
