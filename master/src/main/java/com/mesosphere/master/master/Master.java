package com.mesosphere.master.master;

import com.mesosphere.master.framework.Allocator;
import com.mesosphere.master.framework.MasterConfig;
import com.mesosphere.master.framework.Messenger;
import com.mesosphere.master.metrics.Metrics;
import com.mesosphere.master.offer.LoggingUtils;
import com.mesosphere.master.offer.OfferRescinder;
import com.mesosphere.master.offer.Resources;
import com.mesosphere.master.registry.MutationRecord;
import com.mesosphere.master.registry.Registry;
import com.mesosphere.master.registry.RegistrySnapshot;
import com.mesosphere.master.state.Agent;
import com.mesosphere.master.state.CycleDetectingLockUtils;
import com.mesosphere.master.state.Framework;
import com.mesosphere.master.state.Machine;
import com.mesosphere.master.state.MasterState;
import com.mesosphere.master.state.TaskUtils;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.mesos.Protos;
import org.slf4j.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.function.Function;

/**
 * Owner of the {@link MasterState}.
 *
 * <p>Every change to the state runs as a {@link StateMutation} on a single dispatcher thread, holding the write lock,
 * so that mutations never interleave. Reads take the read lock: they may run concurrently with each other, and never
 * observe a partially applied mutation. Changes which must be durable are first validated on the dispatcher, then
 * committed to the {@link Registry}, and only applied in memory by a second mutation once the registry has
 * acknowledged them. No lock is held while waiting for the registry.
 *
 * <p>Until {@link #recover()} completes, every mutating request fails with {@link MasterError.Reason#UNAVAILABLE}.
 */
public class Master {

    private static final Logger LOGGER = LoggingUtils.getLogger(Master.class);

    private final MasterConfig config;
    private final Allocator allocator;
    private final Messenger messenger;
    private final Registry registry;
    private final OfferRescinder rescinder;
    private final ExecutorService dispatcher;
    private final MasterState state;
    private final Lock readLock;
    private final Lock writeLock;
    private CompletableFuture<?> lastCommit = CompletableFuture.completedFuture(null);

    public Master(MasterConfig config, Allocator allocator, Messenger messenger, Registry registry) {
        this(config, allocator, messenger, registry,
                Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                        .setNameFormat("master-dispatcher-%d")
                        .setDaemon(true)
                        .build()),
                Clock.systemUTC());
    }

    public Master(
            MasterConfig config,
            Allocator allocator,
            Messenger messenger,
            Registry registry,
            ExecutorService dispatcher,
            Clock clock) {
        this.config = config;
        this.allocator = allocator;
        this.messenger = messenger;
        this.registry = registry;
        this.rescinder = new OfferRescinder(allocator, messenger);
        this.dispatcher = dispatcher;
        this.state = new MasterState(config, clock);
        ReadWriteLock lock = CycleDetectingLockUtils.newLock(config, Master.class);
        this.readLock = lock.readLock();
        this.writeLock = lock.writeLock();
    }

    public MasterConfig getConfig() {
        return config;
    }

    public Allocator getAllocator() {
        return allocator;
    }

    public Messenger getMessenger() {
        return messenger;
    }

    public OfferRescinder getRescinder() {
        return rescinder;
    }

    /**
     * Restores machine modes, the maintenance schedule and checkpointed resources from the registry, after which the
     * master starts accepting requests.
     */
    public CompletableFuture<Void> recover() {
        return registry.recover().thenCompose(snapshot -> dispatch(state -> {
            restore(state, snapshot);
            state.setRecovered();
            LOGGER.info("Master recovered: {}", snapshot);
            return null;
        }, false));
    }

    /**
     * Runs the provided mutation on the dispatcher, with the write lock held.
     *
     * @return a future which completes with the mutation's result, or fails with the {@link MasterException} it threw
     */
    public <T> CompletableFuture<T> mutate(StateMutation<T> mutation) {
        return dispatch(mutation, true);
    }

    /**
     * Runs the provided read against the state, on the calling thread, with the read lock held. The function must
     * not modify the state or retain references into it.
     */
    public <T> T query(Function<MasterState, T> function) {
        readLock.lock();
        try {
            return function.apply(state);
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Runs a change which must be durable: {@code validate} checks the request against the current state and returns
     * the record to commit, without modifying anything. Once the registry has stored the record, {@code continuation}
     * applies it in memory. If the registry does not acknowledge the record, the returned future fails with
     * {@link MasterError.Reason#CONFLICT} and the continuation never runs.
     *
     * <p>Commits run one at a time: a commit is only validated once every earlier commit has been applied or has
     * failed, so validation always sees the state left by the previous durable change.
     */
    public synchronized <T> CompletableFuture<T> commit(
            StateMutation<MutationRecord> validate, StateMutation<T> continuation) {
        CompletableFuture<T> result = lastCommit
                .handle((v, e) -> (Void) null)
                .thenCompose(v -> mutate(validate))
                .thenCompose(record -> store(record, continuation));
        lastCommit = result;
        return result;
    }

    /**
     * Returns a future which has already failed with the provided exception.
     */
    public static <T> CompletableFuture<T> failed(MasterException e) {
        Metrics.incrementRejectedRequests(e.getReason());
        CompletableFuture<T> future = new CompletableFuture<>();
        future.completeExceptionally(e);
        return future;
    }

    /**
     * Stops the dispatcher. Pending mutations are abandoned.
     */
    public void stop() {
        dispatcher.shutdownNow();
    }

    // Ledger lifecycle

    /**
     * Registers an agent on the provided machine. If the agent reports no checkpointed resources but some were
     * recovered from the registry, the agent is told to checkpoint the recovered ones.
     */
    public CompletableFuture<Void> addAgent(
            Protos.SlaveInfo info,
            Protos.MachineID machineId,
            Resources checkpointed,
            String version) {
        return mutate(state -> {
            if (!info.hasId()) {
                throw MasterException.validation("Agent '%s' has no id", info.getHostname());
            }
            if (state.getAgent(info.getId()).isPresent()) {
                throw MasterException.validation("Agent %s is already registered", info.getId().getValue());
            }
            Optional<Machine> machine = state.getMachine(machineId);
            if (machine.isPresent() && machine.get().getMode() == Protos.MachineInfo.Mode.DOWN) {
                throw MasterException.validation(
                        "Agent %s cannot register while its machine is DOWN", info.getId().getValue());
            }

            Optional<Resources> recovered = state.takeRecoveredCheckpoint(info.getId());
            Resources agentCheckpoint = checkpointed.isEmpty() ? recovered.orElse(checkpointed) : checkpointed;
            Agent agent = new Agent(
                    info, machineId, Resources.of(info.getResourcesList()), agentCheckpoint, state.now(), version);
            state.addAgent(agent);
            if (checkpointed.isEmpty() && !agentCheckpoint.isEmpty()) {
                messenger.checkpointResources(agent.getId(), agentCheckpoint);
            }
            allocator.addAgent(agent.getId(), info, agent.getTotalResources(),
                    state.getOrCreateMachine(machineId).getUnavailability());
            LOGGER.info("Added agent {} at {}", agent.getId().getValue(), agent.getHostname());
            return null;
        });
    }

    /**
     * Removes an agent from the cluster, marking its tasks lost.
     */
    public CompletableFuture<Void> removeAgent(Protos.SlaveID agentId, String message) {
        return mutate(state -> {
            evictAgent(state, getAgent(state, agentId), message);
            return null;
        });
    }

    public CompletableFuture<Void> addFramework(Protos.FrameworkInfo info) {
        return mutate(state -> {
            if (!info.hasId()) {
                throw MasterException.validation("Framework '%s' has no id", info.getName());
            }
            if (state.getFramework(info.getId()).isPresent()) {
                throw MasterException.validation("Framework %s is already registered", info.getId().getValue());
            }
            state.addFramework(info);
            allocator.addFramework(info.getId(), info);
            LOGGER.info("Added framework {} ({})", info.getId().getValue(), info.getName());
            return null;
        });
    }

    /**
     * Tears down a framework: its offers are rescinded, its tasks are killed and their resources released, every agent
     * is asked to shut down its executors, and the framework moves to the completed history.
     */
    public CompletableFuture<Void> teardown(Protos.FrameworkID frameworkId) {
        return mutate(state -> {
            Framework framework = getFramework(state, frameworkId);

            for (Protos.Offer offer : state.getOffers(framework)) {
                rescinder.rescind(state, offer, Optional.empty());
            }

            for (Protos.TaskInfo taskInfo : new ArrayList<>(framework.getPendingTasks())) {
                state.removePendingTask(framework, taskInfo.getTaskId());
                Protos.Task task = TaskUtils.toTask(frameworkId, taskInfo, Protos.TaskState.TASK_STAGING);
                state.addTask(framework, task);
                state.completeTask(framework, withStatus(task, TaskUtils.newStatus(
                        task.getTaskId(), task.getSlaveId(), Protos.TaskState.TASK_KILLED,
                        Protos.TaskStatus.Reason.REASON_FRAMEWORK_REMOVED, "Framework removed", state.now())));
            }

            for (Protos.Task task : new ArrayList<>(framework.getTasks())) {
                state.completeTask(framework, withStatus(task, TaskUtils.newStatus(
                        task.getTaskId(), task.getSlaveId(), Protos.TaskState.TASK_KILLED,
                        Protos.TaskStatus.Reason.REASON_FRAMEWORK_REMOVED, "Framework removed", state.now())));
                allocator.recoverResources(
                        frameworkId, task.getSlaveId(), Resources.of(task.getResourcesList()), Optional.empty());
            }

            for (Agent agent : state.getAgents()) {
                messenger.shutdownFramework(agent.getId(), frameworkId);
            }

            allocator.removeFramework(frameworkId);
            state.completeFramework(frameworkId);
            Metrics.incrementTornDownFrameworks();
            LOGGER.info("Tore down framework {}", frameworkId.getValue());
            return null;
        });
    }

    /**
     * Records an offer which the allocator has made to a framework.
     */
    public CompletableFuture<Void> addOffer(Protos.Offer offer) {
        return mutate(state -> {
            Agent agent = getAgent(state, offer.getSlaveId());
            getFramework(state, offer.getFrameworkId());
            if (state.getOffer(offer.getId()).isPresent()) {
                throw MasterException.validation("Offer %s already exists", offer.getId().getValue());
            }
            if (!agent.isActive()) {
                throw MasterException.validation("Agent %s is not active", agent.getId().getValue());
            }
            state.addOffer(offer);
            LOGGER.info("Added offer {} to framework {} on agent {}",
                    offer.getId().getValue(), offer.getFrameworkId().getValue(), offer.getSlaveId().getValue());
            return null;
        });
    }

    /**
     * Removes an offer which its framework has accepted or declined. No rescind notice is sent.
     */
    public CompletableFuture<Protos.Offer> removeOffer(Protos.OfferID offerId) {
        return mutate(state -> {
            Optional<Protos.Offer> offer = state.removeOffer(offerId);
            if (!offer.isPresent()) {
                throw MasterException.notFound("No offer found with id %s", offerId.getValue());
            }
            LOGGER.info("Removed offer {}", offerId.getValue());
            return offer.get();
        });
    }

    /**
     * Records a task which a framework has asked to launch, before any agent has acknowledged it.
     */
    public CompletableFuture<Void> addPendingTask(Protos.FrameworkID frameworkId, Protos.TaskInfo taskInfo) {
        return mutate(state -> {
            Framework framework = getFramework(state, frameworkId);
            getAgent(state, taskInfo.getSlaveId());
            if (framework.getTask(taskInfo.getTaskId()).isPresent()) {
                throw MasterException.validation("Task %s is already active", taskInfo.getTaskId().getValue());
            }
            state.addPendingTask(framework, taskInfo);
            LOGGER.info("Added pending task {} for framework {}",
                    taskInfo.getTaskId().getValue(), frameworkId.getValue());
            return null;
        });
    }

    /**
     * Moves a task into the active set in TASK_STAGING, charging its resources to its agent.
     */
    public CompletableFuture<Protos.Task> launchTask(Protos.FrameworkID frameworkId, Protos.TaskInfo taskInfo) {
        return mutate(state -> {
            Framework framework = getFramework(state, frameworkId);
            getAgent(state, taskInfo.getSlaveId());
            if (framework.getTask(taskInfo.getTaskId()).isPresent()) {
                throw MasterException.validation("Task %s is already active", taskInfo.getTaskId().getValue());
            }
            Protos.Task task = TaskUtils.toTask(frameworkId, taskInfo, Protos.TaskState.TASK_STAGING);
            state.addTask(framework, task);
            LOGGER.info("Launched task {} for framework {} on agent {}",
                    task.getTaskId().getValue(), frameworkId.getValue(), task.getSlaveId().getValue());
            return task;
        });
    }

    /**
     * Appends a status to an active task. A terminal status moves the task into its framework's completed history and
     * releases its resources. A terminal status for a pending task records it as completed directly.
     */
    public CompletableFuture<Protos.Task> updateTaskStatus(Protos.FrameworkID frameworkId, Protos.TaskStatus status) {
        return mutate(state -> {
            Framework framework = getFramework(state, frameworkId);
            Optional<Protos.Task> current = framework.getTask(status.getTaskId());
            if (!current.isPresent()) {
                Optional<Protos.TaskInfo> pending = framework.getPendingTask(status.getTaskId());
                if (!pending.isPresent()) {
                    throw MasterException.notFound("No active task found with id %s", status.getTaskId().getValue());
                }
                if (!TaskUtils.isTerminal(status.getState())) {
                    throw MasterException.validation(
                            "Task %s has not been launched yet", status.getTaskId().getValue());
                }
                current = Optional.of(TaskUtils.toTask(frameworkId, pending.get(), Protos.TaskState.TASK_STAGING));
                state.addTask(framework, current.get());
            }

            Protos.Task updated = withStatus(current.get(), status);
            if (TaskUtils.isTerminal(status.getState())) {
                state.completeTask(framework, updated);
                LOGGER.info("Task {} of framework {} completed in state {}",
                        status.getTaskId().getValue(), frameworkId.getValue(), status.getState());
            } else {
                state.updateTask(framework, updated);
                LOGGER.info("Task {} of framework {} is now {}",
                        status.getTaskId().getValue(), frameworkId.getValue(), status.getState());
            }
            return updated;
        });
    }

    /**
     * Removes an agent from the ledger. Must be called from within a mutation.
     *
     * <p>The agent's offers are rescinded, each of its pending and active tasks is marked TASK_LOST with a status
     * update to its framework, every affected framework is told the agent was lost, and the allocator forgets the
     * agent.
     */
    public void evictAgent(MasterState state, Agent agent, String message) {
        Protos.SlaveID agentId = agent.getId();
        rescinder.rescindAll(state, agent);

        Set<Protos.FrameworkID> affected = new LinkedHashSet<>();
        for (Framework framework : new ArrayList<>(state.getFrameworks())) {
            List<Protos.Task> lost = new ArrayList<>();
            for (Protos.TaskInfo taskInfo : new ArrayList<>(framework.getPendingTasks())) {
                if (taskInfo.getSlaveId().equals(agentId)) {
                    state.removePendingTask(framework, taskInfo.getTaskId());
                    Protos.Task task = TaskUtils.toTask(framework.getId(), taskInfo, Protos.TaskState.TASK_STAGING);
                    state.addTask(framework, task);
                    lost.add(task);
                }
            }
            for (Protos.Task task : framework.getTasks()) {
                if (task.getSlaveId().equals(agentId) && !lost.contains(task)) {
                    lost.add(task);
                }
            }

            for (Protos.Task task : lost) {
                Protos.TaskStatus status = TaskUtils.newStatus(
                        task.getTaskId(), agentId, Protos.TaskState.TASK_LOST,
                        Protos.TaskStatus.Reason.REASON_SLAVE_REMOVED, message, state.now());
                state.completeTask(framework, withStatus(task, status));
                messenger.sendStatusUpdate(framework.getId(), status);
                affected.add(framework.getId());
            }
        }

        for (Protos.FrameworkID frameworkId : affected) {
            messenger.agentLost(frameworkId, agentId);
        }
        allocator.removeAgent(agentId);
        state.removeAgent(agentId);
        Metrics.incrementRemovedAgents();
        LOGGER.info("Removed agent {} at {}: {}", agentId.getValue(), agent.getHostname(), message);
    }

    /**
     * Returns the registered agent, or throws {@link MasterError.Reason#NOT_FOUND}.
     */
    public static Agent getAgent(MasterState state, Protos.SlaveID agentId) throws MasterException {
        Optional<Agent> agent = state.getAgent(agentId);
        if (!agent.isPresent()) {
            throw MasterException.notFound("No agent found with id %s", agentId.getValue());
        }
        return agent.get();
    }

    /**
     * Returns the registered framework, or throws {@link MasterError.Reason#NOT_FOUND}.
     */
    public static Framework getFramework(MasterState state, Protos.FrameworkID frameworkId) throws MasterException {
        Optional<Framework> framework = state.getFramework(frameworkId);
        if (!framework.isPresent()) {
            throw MasterException.notFound("No framework found with id %s", frameworkId.getValue());
        }
        return framework.get();
    }

    private <T> CompletableFuture<T> store(MutationRecord record, StateMutation<T> continuation) {
        CompletableFuture<Boolean> stored = registry.apply(record).handle((committed, e) -> {
            if (e != null) {
                LOGGER.error(String.format("Registry failed to store %s", record), e);
                return false;
            } else if (!Boolean.TRUE.equals(committed)) {
                LOGGER.error("Registry rejected {}", record);
                return false;
            }
            return true;
        });
        return stored.thenCompose(committed -> {
            if (committed) {
                return mutate(continuation);
            }
            return Master.<T>failed(MasterException.conflict("Failed to commit %s to the registry", record));
        });
    }

    private <T> CompletableFuture<T> dispatch(StateMutation<T> mutation, boolean requireRecovered) {
        CompletableFuture<T> future = new CompletableFuture<>();
        dispatcher.execute(() -> {
            T result = null;
            Throwable failure = null;
            writeLock.lock();
            try {
                if (requireRecovered && !state.isRecovered()) {
                    throw new MasterException(MasterError.Reason.UNAVAILABLE, "Master has not recovered yet");
                }
                result = mutation.apply(state);
            } catch (MasterException e) {
                LOGGER.warn("Rejected request: {}", e.getMessage());
                Metrics.incrementRejectedRequests(e.getReason());
                failure = e;
            } catch (RuntimeException e) {
                LOGGER.error("Unexpected failure while updating master state", e);
                failure = e;
            } finally {
                writeLock.unlock();
            }
            // Completed outside the lock: dependent stages may go on to wait for the registry.
            if (failure != null) {
                future.completeExceptionally(failure);
            } else {
                future.complete(result);
            }
        });
        return future;
    }

    private static void restore(MasterState state, RegistrySnapshot snapshot) {
        for (Protos.MachineInfo info : snapshot.getMachines()) {
            Machine machine = state.getOrCreateMachine(info.getId());
            machine.setMode(info.getMode());
            machine.setUnavailability(
                    info.hasUnavailability() ? Optional.of(info.getUnavailability()) : Optional.empty());
        }
        state.setSchedules(snapshot.getSchedules());
        for (Map.Entry<String, List<Protos.Resource>> entry : snapshot.getCheckpointedResources().entrySet()) {
            state.putRecoveredCheckpoint(
                    Protos.SlaveID.newBuilder().setValue(entry.getKey()).build(), Resources.of(entry.getValue()));
        }
    }

    private static Protos.Task withStatus(Protos.Task task, Protos.TaskStatus status) {
        return task.toBuilder().setState(status.getState()).addStatuses(status).build();
    }
}
