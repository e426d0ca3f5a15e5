package com.mesosphere.master.maintenance;

import com.mesosphere.master.config.SerializationUtils;
import com.mesosphere.master.master.MasterException;
import com.mesosphere.master.state.Machine;

import com.google.common.net.InetAddresses;
import org.apache.commons.lang3.StringUtils;
import org.apache.mesos.Protos;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks operator maintenance requests before anything is committed. Every failure is reported as a
 * {@link com.mesosphere.master.master.MasterError.Reason#VALIDATION} error.
 */
public final class MaintenanceValidation {

    private MaintenanceValidation() {
        // do not instantiate
    }

    /**
     * Checks that a new schedule is well formed, and that it keeps every machine which is currently DOWN. A DOWN
     * machine leaves the schedule only when it is brought back up.
     *
     * @param schedule the requested schedule
     * @param machines the machines currently known to the master
     */
    public static void schedule(MaintenanceSchedule schedule, Collection<Machine> machines) throws MasterException {
        Set<Protos.MachineID> scheduled = new HashSet<>();
        for (MaintenanceWindow window : schedule.getWindows()) {
            if (window.getMachineIds().isEmpty()) {
                throw MasterException.validation("List of machines in the maintenance window is empty");
            }
            for (Protos.MachineID id : window.getMachineIds()) {
                machine(id);
                if (!scheduled.add(id)) {
                    throw MasterException.validation(
                            "Machine '%s' appears more than once in the schedule", toString(id));
                }
            }
            unavailability(window.getUnavailability());
        }

        for (Machine machine : machines) {
            if (machine.getMode() == Protos.MachineInfo.Mode.DOWN && !scheduled.contains(machine.getId())) {
                throw MasterException.validation(
                        "Machine '%s' is deactivated and cannot be removed from the schedule",
                        toString(machine.getId()));
            }
        }
    }

    /**
     * Checks a list of machine ids from a DOWN or UP request: the list is not empty, every id is well formed, and no
     * id is repeated.
     */
    public static void machines(List<Protos.MachineID> ids) throws MasterException {
        if (ids.isEmpty()) {
            throw MasterException.validation("List of machines is empty");
        }
        Set<Protos.MachineID> seen = new HashSet<>();
        for (Protos.MachineID id : ids) {
            machine(id);
            if (!seen.add(id)) {
                throw MasterException.validation("Machine '%s' appears more than once in the list", toString(id));
            }
        }
    }

    /**
     * Checks that a machine id has a hostname or an IP address, and that the IP address, if any, parses.
     */
    public static void machine(Protos.MachineID id) throws MasterException {
        if (StringUtils.isEmpty(id.getHostname()) && StringUtils.isEmpty(id.getIp())) {
            throw MasterException.validation("Both 'hostname' and 'ip' for a machine are empty");
        }
        if (!StringUtils.isEmpty(id.getIp()) && !InetAddresses.isInetAddress(id.getIp())) {
            throw MasterException.validation("Invalid IP address '%s' for machine", id.getIp());
        }
    }

    public static void unavailability(Protos.Unavailability unavailability) throws MasterException {
        if (unavailability == null) {
            throw MasterException.validation("Maintenance window has no unavailability");
        }
        if (unavailability.hasDuration() && unavailability.getDuration().getNanoseconds() < 0) {
            throw MasterException.validation("Unavailability duration is negative");
        }
    }

    /**
     * Renders a machine id the way it appears in requests, for use in messages.
     */
    public static String toString(Protos.MachineID id) {
        return SerializationUtils.toShortJsonStringOrEmpty(id);
    }
}
