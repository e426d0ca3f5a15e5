package com.mesosphere.master.queries;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

import java.util.List;
import java.util.Optional;

/**
 * Immutable JSON serialization object for the whole cluster: the master itself, its agents and its frameworks.
 */
public final class StateSummary {

    private final String hostname;
    private final Optional<String> cluster;
    private final List<AgentSummary> agents;
    private final List<FrameworkSummary> frameworks;
    private final List<FrameworkSummary> completedFrameworks;

    StateSummary(
            String hostname,
            Optional<String> cluster,
            List<AgentSummary> agents,
            List<FrameworkSummary> frameworks,
            List<FrameworkSummary> completedFrameworks) {
        this.hostname = hostname;
        this.cluster = cluster;
        this.agents = ImmutableList.copyOf(agents);
        this.frameworks = ImmutableList.copyOf(frameworks);
        this.completedFrameworks = ImmutableList.copyOf(completedFrameworks);
    }

    @JsonProperty("hostname")
    public String getHostname() {
        return hostname;
    }

    @JsonProperty("cluster")
    public Optional<String> getCluster() {
        return cluster;
    }

    @JsonProperty("slaves")
    public List<AgentSummary> getAgents() {
        return agents;
    }

    @JsonProperty("frameworks")
    public List<FrameworkSummary> getFrameworks() {
        return frameworks;
    }

    @JsonProperty("completed_frameworks")
    public List<FrameworkSummary> getCompletedFrameworks() {
        return completedFrameworks;
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
        return String.format("StateSummary{hostname=%s, agents=%d, frameworks=%d, completed=%d}",
                hostname, agents.size(), frameworks.size(), completedFrameworks.size());
    }
}
