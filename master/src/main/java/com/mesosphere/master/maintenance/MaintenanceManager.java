package com.mesosphere.master.maintenance;

import com.mesosphere.master.framework.ShutdownNotice;
import com.mesosphere.master.master.Master;
import com.mesosphere.master.master.MasterException;
import com.mesosphere.master.metrics.Metrics;
import com.mesosphere.master.offer.LoggingUtils;
import com.mesosphere.master.registry.MutationRecord;
import com.mesosphere.master.state.Agent;
import com.mesosphere.master.state.Machine;
import com.mesosphere.master.state.MasterState;

import com.google.common.collect.ImmutableList;
import org.apache.mesos.Protos;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Moves machines through their maintenance modes.
 *
 * <p>A machine starts UP. It becomes DRAINING when a schedule naming it is set, DOWN when an operator brings it down,
 * and UP again when an operator brings it back up, at which point it leaves the schedule. Every transition is
 * validated against the current state, committed to the registry, and only then applied in memory.
 */
public class MaintenanceManager {

    private static final Logger LOGGER = LoggingUtils.getLogger(MaintenanceManager.class);

    static final String DOWN_MESSAGE = "Operator initiated 'Machine DOWN'";

    private final Master master;

    public MaintenanceManager(Master master) {
        this.master = master;
    }

    /**
     * Returns the active schedule, or an empty schedule if there is none.
     */
    public MaintenanceSchedule getSchedule() {
        return master.query(MaintenanceManager::getActiveSchedule);
    }

    /**
     * Replaces the active schedule. Machines which join the schedule start DRAINING, machines which leave it go back
     * UP, and machines which stay get the unavailability of their new window. DOWN machines stay DOWN.
     */
    public CompletableFuture<Void> setSchedule(MaintenanceSchedule schedule) {
        return master.commit(
                state -> {
                    MaintenanceValidation.schedule(schedule, state.getMachines());
                    return new MutationRecord.UpdateSchedule(schedule);
                },
                state -> {
                    Map<Protos.MachineID, Protos.Unavailability> updated = schedule.getUnavailabilities();
                    for (Machine machine : new ArrayList<>(state.getMachines())) {
                        if (updated.containsKey(machine.getId())) {
                            continue;
                        }
                        if (machine.getMode() != Protos.MachineInfo.Mode.UP
                                || machine.getUnavailability().isPresent()) {
                            machine.setMode(Protos.MachineInfo.Mode.UP);
                            updateUnavailability(state, machine, Optional.empty());
                        }
                    }
                    for (Map.Entry<Protos.MachineID, Protos.Unavailability> entry : updated.entrySet()) {
                        Machine machine = state.getOrCreateMachine(entry.getKey());
                        if (machine.getMode() == Protos.MachineInfo.Mode.UP) {
                            machine.setMode(Protos.MachineInfo.Mode.DRAINING);
                        }
                        updateUnavailability(state, machine, Optional.of(entry.getValue()));
                    }
                    state.setSchedules(schedule.isEmpty()
                            ? Collections.emptyList()
                            : Collections.singletonList(schedule));
                    Metrics.incrementMaintenance("schedule");
                    LOGGER.info("Updated maintenance schedule: {}", schedule);
                    return null;
                });
    }

    /**
     * Brings DRAINING machines DOWN. Every agent on them is told to shut down and is removed from the cluster right
     * away, without waiting for it to acknowledge.
     */
    public CompletableFuture<Void> bringDown(List<Protos.MachineID> machineIds) {
        return master.commit(
                state -> {
                    MaintenanceValidation.machines(machineIds);
                    for (Protos.MachineID id : machineIds) {
                        Machine machine = getScheduledMachine(state, id);
                        if (machine.getMode() != Protos.MachineInfo.Mode.DRAINING) {
                            throw MasterException.validation(
                                    "Machine '%s' is not in DRAINING mode and cannot be brought down",
                                    MaintenanceValidation.toString(id));
                        }
                    }
                    return new MutationRecord.StartMaintenance(machineIds);
                },
                state -> {
                    ShutdownNotice notice = new ShutdownNotice(DOWN_MESSAGE);
                    for (Protos.MachineID id : machineIds) {
                        Machine machine = state.getOrCreateMachine(id);
                        for (Protos.SlaveID agentId : new ArrayList<>(machine.getAgentIds())) {
                            Optional<Agent> agent = state.getAgent(agentId);
                            if (!agent.isPresent()) {
                                continue;
                            }
                            master.getMessenger().shutdownAgent(agentId, notice);
                            master.evictAgent(state, agent.get(), DOWN_MESSAGE);
                        }
                        machine.setMode(Protos.MachineInfo.Mode.DOWN);
                        LOGGER.info("Machine {} is DOWN", MaintenanceValidation.toString(id));
                    }
                    Metrics.incrementMaintenance("down");
                    return null;
                });
    }

    /**
     * Brings DOWN machines back UP, removing them from the schedule. Windows and schedules left empty are dropped.
     */
    public CompletableFuture<Void> bringUp(List<Protos.MachineID> machineIds) {
        return master.commit(
                state -> {
                    MaintenanceValidation.machines(machineIds);
                    for (Protos.MachineID id : machineIds) {
                        Machine machine = getScheduledMachine(state, id);
                        if (machine.getMode() != Protos.MachineInfo.Mode.DOWN) {
                            throw MasterException.validation(
                                    "Machine '%s' is not in DOWN mode and cannot be brought up",
                                    MaintenanceValidation.toString(id));
                        }
                    }
                    return new MutationRecord.StopMaintenance(machineIds);
                },
                state -> {
                    for (Protos.MachineID id : machineIds) {
                        Machine machine = state.getOrCreateMachine(id);
                        machine.setMode(Protos.MachineInfo.Mode.UP);
                        machine.setUnavailability(Optional.empty());
                        LOGGER.info("Machine {} is UP", MaintenanceValidation.toString(id));
                    }
                    state.setSchedules(state.getSchedules().stream()
                            .map(schedule -> schedule.without(machineIds))
                            .filter(schedule -> !schedule.isEmpty())
                            .collect(Collectors.toList()));
                    Metrics.incrementMaintenance("up");
                    return null;
                });
    }

    /**
     * Returns the draining machines, with the inverse offer responses for their agents, and the down machines.
     *
     * <p>The responses come from the allocator, which does not persist them: after a failover they start out empty.
     */
    public CompletableFuture<ClusterStatus> status() {
        return master.getAllocator().getInverseOfferStatuses().thenApply(statuses -> master.query(state -> {
            List<ClusterStatus.DrainingMachine> draining = new ArrayList<>();
            List<Protos.MachineID> down = new ArrayList<>();
            for (Machine machine : state.getMachines()) {
                switch (machine.getMode()) {
                    case DRAINING:
                        List<InverseOfferStatus> machineStatuses = new ArrayList<>();
                        for (Protos.SlaveID agentId : machine.getAgentIds()) {
                            Map<Protos.FrameworkID, InverseOfferStatus> agentStatuses = statuses.get(agentId);
                            if (agentStatuses != null) {
                                machineStatuses.addAll(agentStatuses.values());
                            }
                        }
                        draining.add(new ClusterStatus.DrainingMachine(machine.getId(), machineStatuses));
                        break;
                    case DOWN:
                        down.add(machine.getId());
                        break;
                    default:
                        break;
                }
            }
            return new ClusterStatus(draining, down);
        }));
    }

    private static MaintenanceSchedule getActiveSchedule(MasterState state) {
        List<MaintenanceSchedule> schedules = state.getSchedules();
        return schedules.isEmpty() ? MaintenanceSchedule.empty() : schedules.get(0);
    }

    private static Machine getScheduledMachine(MasterState state, Protos.MachineID id) throws MasterException {
        Optional<Machine> machine = state.getMachine(id);
        if (!machine.isPresent() || !isScheduled(state, id)) {
            throw MasterException.validation(
                    "Machine '%s' is not part of a maintenance schedule", MaintenanceValidation.toString(id));
        }
        return machine.get();
    }

    private static boolean isScheduled(MasterState state, Protos.MachineID id) {
        return state.getSchedules().stream().anyMatch(schedule -> schedule.getUnavailabilities().containsKey(id));
    }

    /**
     * Sets the machine's unavailability, withdrawing the offers made for its agents so that frameworks see the new
     * interval in their next offers.
     */
    private void updateUnavailability(
            MasterState state, Machine machine, Optional<Protos.Unavailability> unavailability) {
        machine.setUnavailability(unavailability);
        for (Protos.SlaveID agentId : ImmutableList.copyOf(machine.getAgentIds())) {
            Optional<Agent> agent = state.getAgent(agentId);
            if (agent.isPresent()) {
                master.getRescinder().rescindAll(state, agent.get());
                master.getAllocator().updateUnavailability(agentId, unavailability);
            }
        }
    }
}
