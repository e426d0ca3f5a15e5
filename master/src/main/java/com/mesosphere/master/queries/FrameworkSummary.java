package com.mesosphere.master.queries;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable JSON serialization object describing a registered or completed framework.
 */
public final class FrameworkSummary {

    private final String id;
    private final String name;
    private final String hostname;
    private final Optional<String> webuiUrl;
    private final List<String> capabilities;
    private final double registeredTime;
    private final Optional<Double> unregisteredTime;
    private final boolean active;
    private final Map<String, Object> usedResources;
    private final Map<String, Object> offeredResources;
    private final TaskStateSummary taskStates;
    private final List<String> agentIds;

    FrameworkSummary(
            String id,
            String name,
            String hostname,
            Optional<String> webuiUrl,
            Collection<String> capabilities,
            double registeredTime,
            Optional<Double> unregisteredTime,
            boolean active,
            Map<String, Object> usedResources,
            Map<String, Object> offeredResources,
            TaskStateSummary taskStates,
            Collection<String> agentIds) {
        this.id = id;
        this.name = name;
        this.hostname = hostname;
        this.webuiUrl = webuiUrl;
        this.capabilities = ImmutableList.copyOf(capabilities);
        this.registeredTime = registeredTime;
        this.unregisteredTime = unregisteredTime;
        this.active = active;
        this.usedResources = usedResources;
        this.offeredResources = offeredResources;
        this.taskStates = taskStates;
        this.agentIds = ImmutableList.copyOf(agentIds);
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("hostname")
    public String getHostname() {
        return hostname;
    }

    @JsonProperty("webui_url")
    public Optional<String> getWebuiUrl() {
        return webuiUrl;
    }

    @JsonProperty("capabilities")
    public List<String> getCapabilities() {
        return capabilities;
    }

    @JsonProperty("registered_time")
    public double getRegisteredTime() {
        return registeredTime;
    }

    @JsonProperty("unregistered_time")
    public Optional<Double> getUnregisteredTime() {
        return unregisteredTime;
    }

    @JsonProperty("active")
    public boolean isActive() {
        return active;
    }

    @JsonProperty("used_resources")
    public Map<String, Object> getUsedResources() {
        return usedResources;
    }

    @JsonProperty("offered_resources")
    public Map<String, Object> getOfferedResources() {
        return offeredResources;
    }

    @JsonProperty("task_states")
    public TaskStateSummary getTaskStates() {
        return taskStates;
    }

    @JsonProperty("agent_ids")
    public List<String> getAgentIds() {
        return agentIds;
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
        return String.format("FrameworkSummary{id=%s, name=%s, active=%s}", id, name, active);
    }
}
