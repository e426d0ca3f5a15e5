package com.mesosphere.master.state;

import org.apache.mesos.Protos;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * A physical machine hosting zero or more agents, along with its maintenance mode.
 *
 * <p>Instances are owned by {@link MasterState} and must only be modified by the master's dispatcher.
 */
public final class Machine {

    private final Protos.MachineID id;
    private final Set<Protos.SlaveID> agentIds = new LinkedHashSet<>();
    private Protos.MachineInfo.Mode mode = Protos.MachineInfo.Mode.UP;
    private Optional<Protos.Unavailability> unavailability = Optional.empty();

    public Machine(Protos.MachineID id) {
        this.id = id;
    }

    public Protos.MachineID getId() {
        return id;
    }

    public Protos.MachineInfo.Mode getMode() {
        return mode;
    }

    public void setMode(Protos.MachineInfo.Mode mode) {
        this.mode = mode;
    }

    public Optional<Protos.Unavailability> getUnavailability() {
        return unavailability;
    }

    public void setUnavailability(Optional<Protos.Unavailability> unavailability) {
        this.unavailability = unavailability;
    }

    /**
     * Returns a read-only view of the agents on this machine. Callers which remove agents while iterating must copy
     * the result first.
     */
    public Set<Protos.SlaveID> getAgentIds() {
        return Collections.unmodifiableSet(agentIds);
    }

    void addAgent(Protos.SlaveID agentId) {
        agentIds.add(agentId);
    }

    void removeAgent(Protos.SlaveID agentId) {
        agentIds.remove(agentId);
    }

    @Override
    public String toString() {
        return String.format("Machine{id=%s, mode=%s, agents=%d}", id.getHostname(), mode, agentIds.size());
    }
}
