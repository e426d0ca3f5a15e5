package com.mesosphere.master.maintenance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.mesos.Protos;

/**
 * A framework's latest response to an inverse offer for an agent's resources, as tracked by the allocator.
 */
public final class InverseOfferStatus {

    /**
     * The framework's response to the inverse offer.
     */
    public enum Status {
        /** The framework has not responded yet. */
        UNKNOWN,
        /** The framework will vacate the agent. */
        ACCEPT,
        /** The framework will not vacate the agent. */
        DECLINE
    }

    private final Status status;
    private final Protos.FrameworkID frameworkId;
    private final double timestamp;

    @JsonCreator
    public InverseOfferStatus(
            @JsonProperty("status") Status status,
            @JsonProperty("framework_id") Protos.FrameworkID frameworkId,
            @JsonProperty("timestamp") double timestamp) {
        this.status = status;
        this.frameworkId = frameworkId;
        this.timestamp = timestamp;
    }

    @JsonProperty("status")
    public Status getStatus() {
        return status;
    }

    @JsonProperty("framework_id")
    public Protos.FrameworkID getFrameworkId() {
        return frameworkId;
    }

    /**
     * Seconds since the epoch at which the response was received.
     */
    @JsonProperty("timestamp")
    public double getTimestamp() {
        return timestamp;
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
        return String.format("%s[%s@%s]", status, frameworkId.getValue(), timestamp);
    }
}
