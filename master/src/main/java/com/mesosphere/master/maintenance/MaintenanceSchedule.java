package com.mesosphere.master.maintenance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.mesos.Protos;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * An ordered list of {@link MaintenanceWindow}s. A machine may appear in at most one window of a schedule.
 */
public final class MaintenanceSchedule {

    private static final MaintenanceSchedule EMPTY = new MaintenanceSchedule(ImmutableList.of());

    private final List<MaintenanceWindow> windows;

    @JsonCreator
    public MaintenanceSchedule(@JsonProperty("windows") List<MaintenanceWindow> windows) {
        this.windows = windows == null ? ImmutableList.of() : ImmutableList.copyOf(windows);
    }

    public static MaintenanceSchedule empty() {
        return EMPTY;
    }

    @JsonProperty("windows")
    public List<MaintenanceWindow> getWindows() {
        return windows;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return windows.isEmpty();
    }

    /**
     * Returns the unavailability of every machine in the schedule, in window order.
     */
    @JsonIgnore
    public Map<Protos.MachineID, Protos.Unavailability> getUnavailabilities() {
        Map<Protos.MachineID, Protos.Unavailability> result = new LinkedHashMap<>();
        for (MaintenanceWindow window : windows) {
            for (Protos.MachineID id : window.getMachineIds()) {
                result.put(id, window.getUnavailability());
            }
        }
        return result;
    }

    /**
     * Returns a copy of this schedule with the provided machines removed from every window. Windows which are left
     * without any machines are dropped.
     */
    public MaintenanceSchedule without(Collection<Protos.MachineID> machineIds) {
        return new MaintenanceSchedule(windows.stream()
                .map(window -> window.without(machineIds))
                .filter(window -> !window.getMachineIds().isEmpty())
                .collect(Collectors.toList()));
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
        return String.format("MaintenanceSchedule%s", windows);
    }
}
