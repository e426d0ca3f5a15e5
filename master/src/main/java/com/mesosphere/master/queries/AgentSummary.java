package com.mesosphere.master.queries;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Immutable JSON serialization object describing a registered agent and how its resources are split.
 */
public final class AgentSummary {

    private final String id;
    private final String hostname;
    private final double registeredTime;
    private final String version;
    private final boolean active;
    private final Map<String, Object> resources;
    private final Map<String, Object> usedResources;
    private final Map<String, Object> offeredResources;
    private final Map<String, Map<String, Object>> reservedResources;
    private final Map<String, Object> unreservedResources;
    private final TaskStateSummary taskStates;
    private final List<String> frameworkIds;

    AgentSummary(
            String id,
            String hostname,
            double registeredTime,
            String version,
            boolean active,
            Map<String, Object> resources,
            Map<String, Object> usedResources,
            Map<String, Object> offeredResources,
            Map<String, Map<String, Object>> reservedResources,
            Map<String, Object> unreservedResources,
            TaskStateSummary taskStates,
            Collection<String> frameworkIds) {
        this.id = id;
        this.hostname = hostname;
        this.registeredTime = registeredTime;
        this.version = version;
        this.active = active;
        this.resources = resources;
        this.usedResources = usedResources;
        this.offeredResources = offeredResources;
        this.reservedResources = reservedResources;
        this.unreservedResources = unreservedResources;
        this.taskStates = taskStates;
        this.frameworkIds = ImmutableList.copyOf(frameworkIds);
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @JsonProperty("hostname")
    public String getHostname() {
        return hostname;
    }

    @JsonProperty("registered_time")
    public double getRegisteredTime() {
        return registeredTime;
    }

    @JsonProperty("version")
    public String getVersion() {
        return version;
    }

    @JsonProperty("active")
    public boolean isActive() {
        return active;
    }

    @JsonProperty("resources")
    public Map<String, Object> getResources() {
        return resources;
    }

    @JsonProperty("used_resources")
    public Map<String, Object> getUsedResources() {
        return usedResources;
    }

    @JsonProperty("offered_resources")
    public Map<String, Object> getOfferedResources() {
        return offeredResources;
    }

    @JsonProperty("reserved_resources")
    public Map<String, Map<String, Object>> getReservedResources() {
        return reservedResources;
    }

    @JsonProperty("unreserved_resources")
    public Map<String, Object> getUnreservedResources() {
        return unreservedResources;
    }

    @JsonProperty("task_states")
    public TaskStateSummary getTaskStates() {
        return taskStates;
    }

    @JsonProperty("framework_ids")
    public List<String> getFrameworkIds() {
        return frameworkIds;
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
        return String.format("AgentSummary{id=%s, hostname=%s, active=%s}", id, hostname, active);
    }
}
