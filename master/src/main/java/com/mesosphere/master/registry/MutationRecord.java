package com.mesosphere.master.registry;

import com.mesosphere.master.maintenance.MaintenanceSchedule;
import com.mesosphere.master.offer.ResourceOperation;
import com.mesosphere.master.offer.Resources;

import com.google.common.collect.ImmutableList;
import org.apache.mesos.Protos;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A change to the durable state of the master, which must be committed to the {@link Registry} before the master
 * applies it in memory.
 */
public abstract class MutationRecord {

    /**
     * Thrown when a record does not apply to the snapshot it is performed on, for example bringing down a machine
     * which the registry does not have as DRAINING.
     */
    public static class PreconditionException extends Exception {
        PreconditionException(String format, Object... args) {
            super(String.format(format, args));
        }
    }

    private MutationRecord() {
        // closed set of records
    }

    /**
     * Returns the result of applying this change to the provided snapshot.
     *
     * @throws PreconditionException if the snapshot is not in a state this change may be applied to
     */
    public abstract RegistrySnapshot perform(RegistrySnapshot snapshot) throws PreconditionException;

    /**
     * Replaces the maintenance schedule. Machines which leave the schedule are forgotten, machines which join it start
     * DRAINING, and machines which stay keep their mode with the unavailability of their new window.
     */
    public static final class UpdateSchedule extends MutationRecord {
        private final MaintenanceSchedule schedule;

        public UpdateSchedule(MaintenanceSchedule schedule) {
            this.schedule = schedule;
        }

        public MaintenanceSchedule getSchedule() {
            return schedule;
        }

        @Override
        public RegistrySnapshot perform(RegistrySnapshot snapshot) throws PreconditionException {
            Map<Protos.MachineID, Protos.MachineInfo> existing = byId(snapshot.getMachines());
            Map<Protos.MachineID, Protos.Unavailability> scheduled = schedule.getUnavailabilities();
            for (Protos.MachineInfo info : existing.values()) {
                if (info.getMode() == Protos.MachineInfo.Mode.DOWN && !scheduled.containsKey(info.getId())) {
                    throw new PreconditionException(
                            "Machine %s is DOWN and cannot leave the schedule", info.getId().getHostname());
                }
            }
            List<Protos.MachineInfo> machines = new ArrayList<>();
            for (Map.Entry<Protos.MachineID, Protos.Unavailability> entry : scheduled.entrySet()) {
                Protos.MachineInfo previous = existing.get(entry.getKey());
                Protos.MachineInfo.Builder builder = previous == null
                        ? Protos.MachineInfo.newBuilder()
                                .setId(entry.getKey())
                                .setMode(Protos.MachineInfo.Mode.DRAINING)
                        : previous.toBuilder();
                machines.add(builder.setUnavailability(entry.getValue()).build());
            }
            return snapshot
                    .withMachines(machines)
                    .withSchedules(schedule.isEmpty() ? ImmutableList.of() : ImmutableList.of(schedule));
        }

        @Override
        public String toString() {
            return String.format("UpdateSchedule{%s}", schedule);
        }
    }

    /**
     * Moves machines into DOWN mode.
     */
    public static final class StartMaintenance extends MutationRecord {
        private final List<Protos.MachineID> machineIds;

        public StartMaintenance(Collection<Protos.MachineID> machineIds) {
            this.machineIds = ImmutableList.copyOf(machineIds);
        }

        public List<Protos.MachineID> getMachineIds() {
            return machineIds;
        }

        @Override
        public RegistrySnapshot perform(RegistrySnapshot snapshot) throws PreconditionException {
            checkModes(snapshot, machineIds, Protos.MachineInfo.Mode.DRAINING);
            return snapshot.withMachines(snapshot.getMachines().stream()
                    .map(info -> machineIds.contains(info.getId())
                            ? info.toBuilder().setMode(Protos.MachineInfo.Mode.DOWN).build()
                            : info)
                    .collect(Collectors.toList()));
        }

        @Override
        public String toString() {
            return String.format("StartMaintenance{%d machines}", machineIds.size());
        }
    }

    /**
     * Brings machines back UP, removing them from the maintenance schedule.
     */
    public static final class StopMaintenance extends MutationRecord {
        private final List<Protos.MachineID> machineIds;

        public StopMaintenance(Collection<Protos.MachineID> machineIds) {
            this.machineIds = ImmutableList.copyOf(machineIds);
        }

        public List<Protos.MachineID> getMachineIds() {
            return machineIds;
        }

        @Override
        public RegistrySnapshot perform(RegistrySnapshot snapshot) throws PreconditionException {
            checkModes(snapshot, machineIds, Protos.MachineInfo.Mode.DOWN);
            return snapshot
                    .withMachines(snapshot.getMachines().stream()
                            .filter(info -> !machineIds.contains(info.getId()))
                            .collect(Collectors.toList()))
                    .withSchedules(snapshot.getSchedules().stream()
                            .map(schedule -> schedule.without(machineIds))
                            .filter(schedule -> !schedule.isEmpty())
                            .collect(Collectors.toList()));
        }

        @Override
        public String toString() {
            return String.format("StopMaintenance{%d machines}", machineIds.size());
        }
    }

    /**
     * Records the checkpointed resources of an agent after a resource operation was applied to it.
     */
    public static final class ApplyOperation extends MutationRecord {
        private final Protos.SlaveID agentId;
        private final ResourceOperation operation;
        private final Resources checkpointed;

        public ApplyOperation(Protos.SlaveID agentId, ResourceOperation operation, Resources checkpointed) {
            this.agentId = agentId;
            this.operation = operation;
            this.checkpointed = checkpointed;
        }

        public Protos.SlaveID getAgentId() {
            return agentId;
        }

        public ResourceOperation getOperation() {
            return operation;
        }

        public Resources getCheckpointedResources() {
            return checkpointed;
        }

        @Override
        public RegistrySnapshot perform(RegistrySnapshot snapshot) {
            Map<String, List<Protos.Resource>> checkpoints = new HashMap<>(snapshot.getCheckpointedResources());
            if (checkpointed.isEmpty()) {
                checkpoints.remove(agentId.getValue());
            } else {
                checkpoints.put(agentId.getValue(), checkpointed.toList());
            }
            return snapshot.withCheckpointedResources(checkpoints);
        }

        @Override
        public String toString() {
            return String.format("ApplyOperation{agent=%s, %s}", agentId.getValue(), operation);
        }
    }

    private static void checkModes(
            RegistrySnapshot snapshot, List<Protos.MachineID> machineIds, Protos.MachineInfo.Mode expected)
            throws PreconditionException {
        Map<Protos.MachineID, Protos.MachineInfo> existing = byId(snapshot.getMachines());
        for (Protos.MachineID id : machineIds) {
            Protos.MachineInfo info = existing.get(id);
            if (info == null || info.getMode() != expected) {
                throw new PreconditionException("Machine %s is %s, expected %s",
                        id.getHostname(), info == null ? "not scheduled" : info.getMode(), expected);
            }
        }
    }

    private static Map<Protos.MachineID, Protos.MachineInfo> byId(List<Protos.MachineInfo> machines) {
        Map<Protos.MachineID, Protos.MachineInfo> result = new LinkedHashMap<>();
        for (Protos.MachineInfo info : machines) {
            result.put(info.getId(), info);
        }
        return result;
    }
}
