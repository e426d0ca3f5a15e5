package com.mesosphere.master.registry;

import com.mesosphere.master.maintenance.MaintenanceSchedule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.mesos.Protos;

import java.util.List;
import java.util.Map;

/**
 * The durable part of the master's state: the maintenance mode of every scheduled machine, the maintenance schedules,
 * and the checkpointed resources of every agent on which an operator has applied a resource operation.
 */
public final class RegistrySnapshot {

    private static final RegistrySnapshot EMPTY =
            new RegistrySnapshot(ImmutableList.of(), ImmutableList.of(), ImmutableMap.of());

    private final List<Protos.MachineInfo> machines;
    private final List<MaintenanceSchedule> schedules;
    private final Map<String, List<Protos.Resource>> checkpointedResources;

    @JsonCreator
    public RegistrySnapshot(
            @JsonProperty("machines") List<Protos.MachineInfo> machines,
            @JsonProperty("schedules") List<MaintenanceSchedule> schedules,
            @JsonProperty("checkpointed_resources") Map<String, List<Protos.Resource>> checkpointedResources) {
        this.machines = machines == null ? ImmutableList.of() : ImmutableList.copyOf(machines);
        this.schedules = schedules == null ? ImmutableList.of() : ImmutableList.copyOf(schedules);
        this.checkpointedResources =
                checkpointedResources == null ? ImmutableMap.of() : ImmutableMap.copyOf(checkpointedResources);
    }

    public static RegistrySnapshot empty() {
        return EMPTY;
    }

    @JsonProperty("machines")
    public List<Protos.MachineInfo> getMachines() {
        return machines;
    }

    @JsonProperty("schedules")
    public List<MaintenanceSchedule> getSchedules() {
        return schedules;
    }

    /**
     * Returns the checkpointed resources by agent id.
     */
    @JsonProperty("checkpointed_resources")
    public Map<String, List<Protos.Resource>> getCheckpointedResources() {
        return checkpointedResources;
    }

    RegistrySnapshot withMachines(List<Protos.MachineInfo> machines) {
        return new RegistrySnapshot(machines, schedules, checkpointedResources);
    }

    RegistrySnapshot withSchedules(List<MaintenanceSchedule> schedules) {
        return new RegistrySnapshot(machines, schedules, checkpointedResources);
    }

    RegistrySnapshot withCheckpointedResources(Map<String, List<Protos.Resource>> checkpointedResources) {
        return new RegistrySnapshot(machines, schedules, checkpointedResources);
    }

    @Override
    public boolean equals(Object o) {
        return EqualsBuilder.reflectionEquals(this, o);
    }

    @Override
    public int hashCode() {
        return HashCodeBuilder.reflectionHashCode(this);
    }

    @Override
    public String toString() {
        return String.format("RegistrySnapshot{machines=%d, schedules=%d, agents=%d}",
                machines.size(), schedules.size(), checkpointedResources.size());
    }
}
