package com.mesosphere.master.maintenance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.mesos.Protos;

import java.util.List;

/**
 * Maintenance status of the cluster: the machines which are draining, with the frameworks' responses to inverse
 * offers for their agents, and the machines which are down. Machines which are up are not listed.
 */
public final class ClusterStatus {

    /**
     * A draining machine and the inverse offer responses received for the agents running on it.
     */
    public static final class DrainingMachine {
        private final Protos.MachineID id;
        private final List<InverseOfferStatus> statuses;

        @JsonCreator
        public DrainingMachine(
                @JsonProperty("id") Protos.MachineID id,
                @JsonProperty("statuses") List<InverseOfferStatus> statuses) {
            this.id = id;
            this.statuses = statuses == null ? ImmutableList.of() : ImmutableList.copyOf(statuses);
        }

        @JsonProperty("id")
        public Protos.MachineID getId() {
            return id;
        }

        @JsonProperty("statuses")
        public List<InverseOfferStatus> getStatuses() {
            return statuses;
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
            return String.format("DrainingMachine{id=%s, statuses=%s}", MaintenanceValidation.toString(id), statuses);
        }
    }

    private final List<DrainingMachine> drainingMachines;
    private final List<Protos.MachineID> downMachines;

    @JsonCreator
    public ClusterStatus(
            @JsonProperty("draining_machines") List<DrainingMachine> drainingMachines,
            @JsonProperty("down_machines") List<Protos.MachineID> downMachines) {
        this.drainingMachines =
                drainingMachines == null ? ImmutableList.of() : ImmutableList.copyOf(drainingMachines);
        this.downMachines = downMachines == null ? ImmutableList.of() : ImmutableList.copyOf(downMachines);
    }

    @JsonProperty("draining_machines")
    public List<DrainingMachine> getDrainingMachines() {
        return drainingMachines;
    }

    @JsonProperty("down_machines")
    public List<Protos.MachineID> getDownMachines() {
        return downMachines;
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
        return String.format("ClusterStatus{draining=%s, down=%d}", drainingMachines, downMachines.size());
    }
}
