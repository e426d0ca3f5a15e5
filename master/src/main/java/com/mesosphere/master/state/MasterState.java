package com.mesosphere.master.state;

import com.mesosphere.master.framework.MasterConfig;
import com.mesosphere.master.maintenance.MaintenanceSchedule;
import com.mesosphere.master.offer.Resources;

import com.google.common.collect.EvictingQueue;
import com.google.common.collect.ImmutableList;
import org.apache.mesos.Protos;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The master's authoritative in-memory state: registered agents and frameworks, their tasks, outstanding offers,
 * machines and the maintenance schedule.
 *
 * <p>This class does no locking of its own. It is owned by the master, which serializes every modification on its
 * dispatcher and only hands out read access under its read lock. Methods here only update the in-memory ledger;
 * notifying the allocator, agents and frameworks is left to the callers.
 */
public final class MasterState {

    private final Clock clock;
    private final String hostname;
    private final Optional<String> clusterName;
    private final int maxCompletedTasksPerFramework;

    private final Map<Protos.SlaveID, Agent> agents = new LinkedHashMap<>();
    private final Map<Protos.FrameworkID, Framework> frameworks = new LinkedHashMap<>();
    private final EvictingQueue<Framework> completedFrameworks;
    private final Map<Protos.OfferID, Protos.Offer> offers = new LinkedHashMap<>();
    private final Map<Protos.MachineID, Machine> machines = new LinkedHashMap<>();
    private final Map<Protos.SlaveID, Resources> recoveredCheckpoints = new HashMap<>();
    private List<MaintenanceSchedule> schedules = ImmutableList.of();
    private boolean recovered = false;

    public MasterState(MasterConfig config, Clock clock) {
        this.clock = clock;
        this.hostname = config.getHostname();
        this.clusterName = config.getClusterName();
        this.maxCompletedTasksPerFramework = config.getMaxCompletedTasksPerFramework();
        this.completedFrameworks = EvictingQueue.create(config.getMaxCompletedFrameworks());
    }

    /**
     * Returns the current time in seconds since the epoch, as used in task status timestamps.
     */
    public double now() {
        return clock.millis() / 1000.0;
    }

    public String getHostname() {
        return hostname;
    }

    public Optional<String> getClusterName() {
        return clusterName;
    }

    public boolean isRecovered() {
        return recovered;
    }

    public void setRecovered() {
        this.recovered = true;
    }

    // Agents

    public Optional<Agent> getAgent(Protos.SlaveID agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    public Collection<Agent> getAgents() {
        return Collections.unmodifiableCollection(agents.values());
    }

    /**
     * Registers an agent and places it on its machine, creating an UP machine entry if the machine is unknown.
     */
    public void addAgent(Agent agent) {
        agents.put(agent.getId(), agent);
        getOrCreateMachine(agent.getMachineId()).addAgent(agent.getId());
    }

    /**
     * Removes an agent from the registered set and from its machine. Offers and tasks on the agent must have been
     * removed beforehand.
     */
    public Optional<Agent> removeAgent(Protos.SlaveID agentId) {
        Agent agent = agents.remove(agentId);
        if (agent == null) {
            return Optional.empty();
        }
        Machine machine = machines.get(agent.getMachineId());
        if (machine != null) {
            machine.removeAgent(agentId);
        }
        return Optional.of(agent);
    }

    /**
     * Returns checkpointed resources which were recovered from the registry for an agent that has not re-registered
     * yet.
     */
    public Optional<Resources> takeRecoveredCheckpoint(Protos.SlaveID agentId) {
        return Optional.ofNullable(recoveredCheckpoints.remove(agentId));
    }

    public void putRecoveredCheckpoint(Protos.SlaveID agentId, Resources checkpointed) {
        recoveredCheckpoints.put(agentId, checkpointed);
    }

    // Frameworks

    public Optional<Framework> getFramework(Protos.FrameworkID frameworkId) {
        return Optional.ofNullable(frameworks.get(frameworkId));
    }

    /**
     * Returns the registered frameworks.
     */
    public Collection<Framework> getFrameworks() {
        return Collections.unmodifiableCollection(frameworks.values());
    }

    /**
     * Returns the frameworks which have been torn down, oldest first.
     */
    public List<Framework> getCompletedFrameworks() {
        return Collections.unmodifiableList(new ArrayList<>(completedFrameworks));
    }

    public Framework addFramework(Protos.FrameworkInfo info) {
        Framework framework = new Framework(info, now(), maxCompletedTasksPerFramework);
        frameworks.put(framework.getId(), framework);
        return framework;
    }

    /**
     * Moves a framework into the completed history. Its offers and tasks must have been removed beforehand.
     */
    public Optional<Framework> completeFramework(Protos.FrameworkID frameworkId) {
        Framework framework = frameworks.remove(frameworkId);
        if (framework == null) {
            return Optional.empty();
        }
        framework.deactivate(now());
        completedFrameworks.add(framework);
        return Optional.of(framework);
    }

    // Offers

    public Optional<Protos.Offer> getOffer(Protos.OfferID offerId) {
        return Optional.ofNullable(offers.get(offerId));
    }

    public Collection<Protos.Offer> getOffers() {
        return Collections.unmodifiableCollection(offers.values());
    }

    /**
     * Returns the offers outstanding against an agent, in a stable order.
     */
    public List<Protos.Offer> getOffers(Agent agent) {
        List<Protos.Offer> result = new ArrayList<>();
        for (Protos.OfferID offerId : agent.getOfferIds()) {
            result.add(offers.get(offerId));
        }
        return result;
    }

    public List<Protos.Offer> getOffers(Framework framework) {
        List<Protos.Offer> result = new ArrayList<>();
        for (Protos.OfferID offerId : framework.getOfferIds()) {
            result.add(offers.get(offerId));
        }
        return result;
    }

    /**
     * Returns the total resources outstanding in offers against an agent.
     */
    public Resources getOfferedResources(Agent agent) {
        Resources offered = Resources.empty();
        for (Protos.Offer offer : getOffers(agent)) {
            offered = offered.plus(Resources.of(offer.getResourcesList()));
        }
        return offered;
    }

    public void addOffer(Protos.Offer offer) {
        offers.put(offer.getId(), offer);
        agents.get(offer.getSlaveId()).addOffer(offer.getId());
        frameworks.get(offer.getFrameworkId()).addOffer(offer);
    }

    public Optional<Protos.Offer> removeOffer(Protos.OfferID offerId) {
        Protos.Offer offer = offers.remove(offerId);
        if (offer == null) {
            return Optional.empty();
        }
        Agent agent = agents.get(offer.getSlaveId());
        if (agent != null) {
            agent.removeOffer(offerId);
        }
        Framework framework = frameworks.get(offer.getFrameworkId());
        if (framework != null) {
            framework.removeOffer(offer);
        }
        return Optional.of(offer);
    }

    // Tasks

    public void addPendingTask(Framework framework, Protos.TaskInfo taskInfo) {
        framework.addPendingTask(taskInfo);
    }

    /**
     * Replaces a framework's pending task, if any, with an active task, and charges its resources to the agent.
     */
    public void addTask(Framework framework, Protos.Task task) {
        framework.removePendingTask(task.getTaskId());
        framework.addTask(task);
        Agent agent = agents.get(task.getSlaveId());
        if (agent != null) {
            agent.addUsedResources(framework.getId(), Resources.of(task.getResourcesList()));
        }
    }

    public void updateTask(Framework framework, Protos.Task task) {
        framework.updateTask(task);
    }

    /**
     * Moves an active task into its framework's completed history, releasing its resources on the agent.
     */
    public void completeTask(Framework framework, Protos.Task task) {
        framework.completeTask(task);
        Agent agent = agents.get(task.getSlaveId());
        if (agent != null) {
            agent.removeUsedResources(framework.getId(), Resources.of(task.getResourcesList()));
        }
    }

    public Optional<Protos.TaskInfo> removePendingTask(Framework framework, Protos.TaskID taskId) {
        return framework.removePendingTask(taskId);
    }

    // Machines and maintenance

    public Optional<Machine> getMachine(Protos.MachineID machineId) {
        return Optional.ofNullable(machines.get(machineId));
    }

    public Collection<Machine> getMachines() {
        return Collections.unmodifiableCollection(machines.values());
    }

    public Machine getOrCreateMachine(Protos.MachineID machineId) {
        return machines.computeIfAbsent(machineId, Machine::new);
    }

    public List<MaintenanceSchedule> getSchedules() {
        return schedules;
    }

    public void setSchedules(List<MaintenanceSchedule> schedules) {
        this.schedules = ImmutableList.copyOf(schedules);
    }
}
