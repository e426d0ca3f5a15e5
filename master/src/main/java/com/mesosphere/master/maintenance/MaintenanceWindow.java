package com.mesosphere.master.maintenance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.mesos.Protos;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A set of machines which are expected to be unavailable for the same interval.
 */
public final class MaintenanceWindow {

    private final List<Protos.MachineID> machineIds;
    private final Protos.Unavailability unavailability;

    @JsonCreator
    public MaintenanceWindow(
            @JsonProperty("machine_ids") List<Protos.MachineID> machineIds,
            @JsonProperty("unavailability") Protos.Unavailability unavailability) {
        this.machineIds = machineIds == null ? ImmutableList.of() : ImmutableList.copyOf(machineIds);
        this.unavailability = unavailability;
    }

    @JsonProperty("machine_ids")
    public List<Protos.MachineID> getMachineIds() {
        return machineIds;
    }

    @JsonProperty("unavailability")
    public Protos.Unavailability getUnavailability() {
        return unavailability;
    }

    /**
     * Returns a copy of this window without the provided machines.
     */
    MaintenanceWindow without(Collection<Protos.MachineID> removed) {
        return new MaintenanceWindow(
                machineIds.stream().filter(id -> !removed.contains(id)).collect(Collectors.toList()),
                unavailability);
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
        return String.format("MaintenanceWindow{machines=%s, unavailability=%s}",
                machineIds.stream().map(MaintenanceValidation::toString).collect(Collectors.toList()),
                unavailability == null ? "none" : unavailability.toString().replace('\n', ' ').trim());
    }
}
